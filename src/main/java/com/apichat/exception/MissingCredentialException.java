package com.apichat.exception;

import lombok.Getter;

/**
 * Thrown when the selected reasoning backend requires a credential and none was supplied.
 * The user has to configure a key; retrying cannot help.
 */
@Getter
public class MissingCredentialException extends ApiAgentException {

    private final String provider;

    public MissingCredentialException(String provider, String message) {
        super(message);
        this.provider = provider;
    }
}
