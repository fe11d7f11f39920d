package com.apichat.exception;

import lombok.Getter;

/**
 * Thrown when a reasoning backend could not be reached or did not answer within the timeout.
 * The core never retries; the caller may.
 */
@Getter
public class BackendUnreachableException extends ApiAgentException {

    private final String provider;

    public BackendUnreachableException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
