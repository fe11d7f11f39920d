package com.apichat.service.api;

import com.apichat.model.CompiledAgent;
import com.apichat.model.ExecutionResult;
import java.util.Map;

public interface ExecutionEngine {

    /**
     * Resolves a function of the agent to its endpoint, synthesizes the HTTP request from the
     * arguments and issues it.
     * <p>
     * Never throws for an unknown function, a stale binding, a transport failure or an error
     * status: every outcome is encoded in the returned {@link ExecutionResult}.
     *
     * @param agent        The agent whose function set is searched by exact name.
     * @param functionName The requested function.
     * @param arguments    The decoded arguments, may be empty.
     * @return The normalized outcome of the call.
     */
    ExecutionResult execute(CompiledAgent agent, String functionName, Map<String, Object> arguments);

    /**
     * Renders a result as the content of a function-result conversation turn: the pretty-printed
     * body for a structured success, the raw text otherwise, and "Error status: message" for a failure.
     */
    String formatForConversation(ExecutionResult result);
}
