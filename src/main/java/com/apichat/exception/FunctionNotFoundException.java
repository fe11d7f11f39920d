package com.apichat.exception;

/**
 * Signals that a backend requested a function the agent does not expose.
 */
public class FunctionNotFoundException extends ApiAgentException {

    public FunctionNotFoundException(String functionName) {
        super("Function '" + functionName + "' not found in agent's available functions");
    }
}
