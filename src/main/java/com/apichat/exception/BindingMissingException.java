package com.apichat.exception;

/**
 * Signals that a function's execution binding no longer resolves to an endpoint or document.
 * This is a data-integrity problem, not a transient one.
 */
public class BindingMissingException extends ApiAgentException {

    public BindingMissingException(String message) {
        super(message);
    }
}
