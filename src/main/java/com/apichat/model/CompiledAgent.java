package com.apichat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.List;
import java.util.Optional;

/**
 * An executable agent: the system preamble and function set compiled from one document,
 * plus the backend profile used to drive conversations.
 *
 * @param name           The agent name.
 * @param documentId     The document the functions were compiled from.
 * @param systemPreamble The capability brief seeded as the first conversation message.
 * @param functions      The compiled function set, in endpoint order.
 * @param profile        The reasoning backend settings.
 * @param active         Whether the agent accepts chat messages. Agents stored without the flag are active.
 */
public record CompiledAgent(String name,
                            String documentId,
                            String systemPreamble,
                            List<FunctionSchema> functions,
                            AgentProfile profile,
                            Boolean active) {

    @JsonCreator
    public CompiledAgent {
        functions = functions == null ? List.of() : List.copyOf(functions);
        active = active == null ? Boolean.TRUE : active;
    }

    public CompiledAgent(String name, String documentId, String systemPreamble,
                         List<FunctionSchema> functions, AgentProfile profile) {
        this(name, documentId, systemPreamble, functions, profile, Boolean.TRUE);
    }

    public CompiledAgent withActive(boolean active) {
        return new CompiledAgent(name, documentId, systemPreamble, functions, profile, active);
    }

    public Optional<FunctionSchema> findFunction(String functionName) {
        return functions.stream().filter(f -> f.name().equals(functionName)).findFirst();
    }
}
