package com.apichat.model;

/**
 * Why a function execution did not succeed.
 */
public enum FailureType {
    /** The call reached the remote API and returned 2xx/3xx. */
    NONE,
    /** The remote host could not be reached. */
    CONNECTION,
    /** The remote call exceeded the execution timeout. */
    TIMEOUT,
    /** The remote API answered with a 4xx or 5xx status. */
    HTTP_STATUS,
    /** Unsupported method, unresolved path placeholder or unusable target URL. */
    MALFORMED_REQUEST,
    /** No function with the requested name in the agent's function set. */
    FUNCTION_NOT_FOUND,
    /** The function's binding no longer resolves to an endpoint or document. */
    BINDING_MISSING,
    /** Any other error raised while executing. */
    EXECUTION_ERROR
}
