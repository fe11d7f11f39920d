package com.apichat.cli;

import com.apichat.cli.ui.Spinner;
import com.apichat.dto.response.CommandResponse;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.AgentProfile;
import com.apichat.model.CompilationResult;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import com.apichat.model.ExecutionResult;
import com.apichat.service.api.AgentService;
import com.apichat.service.api.ExecutionEngine;
import com.apichat.service.api.StateService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Commands for customizing endpoints and for creating, regenerating and testing agents.
 */
@ShellComponent
public class AgentCommand {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final AgentService agentService;
    private final StateService stateService;
    private final ExecutionEngine executionEngine;
    private final Spinner spinner;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public AgentCommand(AgentService agentService,
                        StateService stateService,
                        ExecutionEngine executionEngine,
                        Spinner spinner) {
        this.agentService = agentService;
        this.stateService = stateService;
        this.executionEngine = executionEngine;
        this.spinner = spinner;
    }

    @ShellMethod(key = "customize", value = "Override the description of an endpoint or enable/disable it.")
    public String customize(
            @ShellOption(help = "The alias of the API.") String alias,
            @ShellOption(value = {"--operation", "-o"}, help = "The operationId, or derived name, of the endpoint.") String operation,
            @ShellOption(help = "A replacement description.", defaultValue = ShellOption.NULL) String description,
            @ShellOption(help = "true to enable, false to disable.", defaultValue = ShellOption.NULL) String enabled
    ) {
        if (enabled != null && !"true".equalsIgnoreCase(enabled) && !"false".equalsIgnoreCase(enabled)) {
            return CommandResponse.error("--enabled must be true or false, was '" + enabled + "'.").toAnsiString();
        }
        try {
            Boolean enablement = enabled == null ? null : Boolean.valueOf(enabled);
            EndpointOverlay overlay = agentService.customize(alias, operation, description, enablement);
            return CommandResponse.ok("Saved customization for '" + overlay.operationKey() + "' (enabled: " + overlay.enabled()
                    + "). Run 'agent-regenerate' to apply it to existing agents.").toAnsiString();
        } catch (ApiAgentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "agent-create", value = "Compile a learned API into a conversational agent.")
    public String create(
            @ShellOption(help = "The name of the agent.") String name,
            @ShellOption(help = "The alias of the API the agent works with.") String alias,
            @ShellOption(help = "The reasoning backend: openai, anthropic or ollama.", defaultValue = "openai") String provider,
            @ShellOption(help = "The model name.", defaultValue = "gpt-4-turbo-preview") String model,
            @ShellOption(help = "Sampling temperature between 0.0 and 1.0.", defaultValue = "0.7") double temperature,
            @ShellOption(value = "--max-tokens", help = "Token limit per backend turn.", defaultValue = "4096") int maxTokens
    ) {
        try {
            CompilationResult result = agentService.createAgent(name, alias, new AgentProfile(provider, model, temperature, maxTokens));
            return render(result);
        } catch (ApiAgentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "agent-regenerate", value = "Recompile an agent after its API or customizations changed.")
    public String regenerate(@ShellOption(help = "The name of the agent.") String name) {
        try {
            return render(agentService.regenerateAgent(name));
        } catch (ApiAgentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "agent-activate", value = "Put an agent back into service.")
    public String activate(@ShellOption(help = "The name of the agent.") String name) {
        return toggle(name, true);
    }

    @ShellMethod(key = "agent-deactivate", value = "Take an agent out of service without deleting it.")
    public String deactivate(@ShellOption(help = "The name of the agent.") String name) {
        return toggle(name, false);
    }

    private String toggle(String name, boolean active) {
        try {
            CompiledAgent agent = agentService.setActive(name, active);
            return CommandResponse.ok("Agent '" + agent.name() + "' is now " + (active ? "active." : "inactive.")).toAnsiString();
        } catch (ApiAgentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    /**
     * Executes one function of an agent directly, without involving the reasoning backend.
     *
     * @param agentName The agent.
     * @param function  The function name.
     * @param args      The arguments as a JSON object.
     * @return The formatted execution result.
     */
    @ShellMethod(key = "test-function", value = "Call one function of an agent directly with JSON arguments.")
    public String testFunction(
            @ShellOption(value = "--agent", help = "The name of the agent.") String agentName,
            @ShellOption(help = "The function name.") String function,
            @ShellOption(help = "The arguments as a JSON object.", defaultValue = "{}") String args
    ) {
        CompiledAgent agent = stateService.getAgent(agentName);
        if (agent == null) {
            return CommandResponse.error("No agent found with name '" + agentName + "'.").toAnsiString();
        }
        Map<String, Object> arguments;
        try {
            arguments = objectMapper.readValue(args, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            return CommandResponse.error("Arguments must be a JSON object: " + e.getOriginalMessage()).toAnsiString();
        }

        ExecutionResult result = spinner.spin("Calling API...", () -> executionEngine.execute(agent, function, arguments));
        String header = result.getMethod() != null
                ? result.getMethod() + " " + result.getUrl() + " -> " + result.getStatusCode()
                : function;
        return new CommandResponse(result.isSuccess(), header).toAnsiString()
                + "\n" + executionEngine.formatForConversation(result);
    }

    private String render(CompilationResult result) {
        StringBuilder message = new StringBuilder(result.message());
        if (result.success()) {
            message.append(" (").append(result.agent().profile().provider())
                    .append(", ").append(result.agent().profile().model()).append(").");
        }
        result.errors().forEach(error -> message.append("\n  - ").append(error));
        return new CommandResponse(result.success(), message.toString()).toAnsiString();
    }
}
