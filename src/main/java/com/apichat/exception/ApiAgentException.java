package com.apichat.exception;

/**
 * The root runtime exception for application-specific errors within the API agent.
 * <p>
 * Subclasses distinguish the failure classes a caller reacts to differently: a missing
 * backend credential is user-actionable, an unreachable backend may be retried by the caller,
 * and function resolution errors never leave the execution engine.
 */
public class ApiAgentException extends RuntimeException {

    /**
     * Constructs a new ApiAgentException with the specified detail message.
     *
     * @param message The detail message.
     */
    public ApiAgentException(String message) {
        super(message);
    }

    /**
     * Constructs a new ApiAgentException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The cause, may be {@code null}.
     */
    public ApiAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
