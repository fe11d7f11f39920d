package com.apichat.exception;

import lombok.Getter;

/**
 * Thrown when a reasoning backend answered with a non-2xx status, e.g. an invalid key or a
 * malformed request.
 */
@Getter
public class BackendRejectedException extends ApiAgentException {

    private final String provider;
    private final int statusCode;

    public BackendRejectedException(String provider, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }
}
