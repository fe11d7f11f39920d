package com.apichat.cli;

import com.apichat.dto.response.CommandResponse;
import com.apichat.dto.response.EndpointView;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.ApiDocument;
import com.apichat.service.api.AgentService;
import com.apichat.service.api.StateService;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.List;

/**
 * Commands for inspecting learned APIs and the enablement of their endpoints.
 */
@ShellComponent
public class InspectCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_RED = "\u001B[31m";

    private final StateService stateService;
    private final AgentService agentService;

    public InspectCommand(StateService stateService, AgentService agentService) {
        this.stateService = stateService;
        this.agentService = agentService;
    }

    /**
     * Lists the endpoints of a learned API, or one endpoint when an operation is given.
     *
     * @param alias     The alias of the API to inspect.
     * @param operation (Optional) The operationId, or derived name, of a single endpoint.
     * @return The formatted listing.
     */
    @ShellMethod(key = "details", value = "Show the endpoints of a learned API and whether they are enabled.")
    public String details(
            @ShellOption(help = "The alias of the API to inspect.") String alias,
            @ShellOption(value = {"--operation", "-o"}, help = "A single operation to inspect.", defaultValue = ShellOption.NULL) String operation
    ) {
        List<EndpointView> views;
        try {
            views = agentService.describeEndpoints(alias);
        } catch (ApiAgentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }

        if (operation != null) {
            views = views.stream().filter(v -> v.operationKey().equals(operation)).toList();
            if (views.isEmpty()) {
                return CommandResponse.error("Operation '" + operation + "' not found in API '" + alias + "'.").toAnsiString();
            }
        }

        ApiDocument document = stateService.getDocument(alias);
        StringBuilder out = new StringBuilder();
        out.append(ANSI_CYAN).append("Endpoints of API: ").append(ANSI_YELLOW).append(document.title());
        if (document.version() != null) {
            out.append(" (v").append(document.version()).append(")");
        }
        out.append(ANSI_RESET).append('\n');
        out.append("Base URL: ").append(document.hasBaseUrl() ? document.baseUrl() : "not configured").append('\n');
        views.forEach(view -> appendView(out, view));
        return out.toString();
    }

    private void appendView(StringBuilder out, EndpointView view) {
        out.append("-".repeat(50)).append('\n');
        out.append(ANSI_GREEN).append("Operation: ").append(ANSI_YELLOW).append(view.operationKey()).append(ANSI_RESET);
        out.append(view.enabled() ? "" : ANSI_RED + " [disabled]" + ANSI_RESET);
        out.append(view.deprecated() ? ANSI_RED + " [deprecated]" + ANSI_RESET : "").append('\n');
        out.append("  ").append(ANSI_PURPLE).append(view.method()).append(ANSI_RESET).append(' ').append(view.path()).append('\n');
        if (view.summary() != null) {
            out.append("  Summary: ").append(view.summary()).append('\n');
        }
        if (view.customDescription() != null) {
            out.append("  Custom description: ").append(view.customDescription()).append('\n');
        }
        if (!view.tags().isEmpty()) {
            out.append("  Tags: ").append(String.join(", ", view.tags())).append('\n');
        }
        if (!view.parameters().isEmpty()) {
            out.append(ANSI_CYAN).append("  Parameters:").append(ANSI_RESET).append('\n');
            view.parameters().forEach(p -> out.append("    - ").append(p).append('\n'));
        }
        if (view.hasRequestBody()) {
            out.append("  Accepts a request body").append('\n');
        }
    }
}
