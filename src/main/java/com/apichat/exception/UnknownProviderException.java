package com.apichat.exception;

public class UnknownProviderException extends ApiAgentException {

    public UnknownProviderException(String provider) {
        super("Unsupported LLM provider: " + provider);
    }
}
