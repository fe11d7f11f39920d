package com.apichat.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.apichat.cli.ui.Spinner;
import com.apichat.dto.response.ApiCallRecord;
import com.apichat.dto.response.ChatResponse;
import com.apichat.dto.response.CommandResponse;
import com.apichat.dto.response.FunctionCallRecord;
import com.apichat.exception.ApiAgentException;
import com.apichat.exception.BackendUnreachableException;
import com.apichat.exception.MissingCredentialException;
import com.apichat.model.CompiledAgent;
import com.apichat.service.api.ConversationService;
import com.apichat.service.api.StateService;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Sends one message to an agent and prints its reply together with the functions and HTTP
 * requests it used to produce it.
 */
@ShellComponent
public class ChatCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";

    private final StateService stateService;
    private final ConversationService conversationService;
    private final Spinner spinner;

    public ChatCommand(StateService stateService, ConversationService conversationService, Spinner spinner) {
        this.stateService = stateService;
        this.conversationService = conversationService;
        this.spinner = spinner;
    }

    /**
     * @param agentName The agent to talk to.
     * @param message   The user's message; may span several words.
     * @param verbose   If true, the root logger is switched to DEBUG for the duration of the command.
     */
    @ShellMethod(key = "chat", value = "Send a message to an agent.")
    public String chat(
            @ShellOption(value = {"--agent", "-a"}, help = "The name of the agent.") String agentName,
            @ShellOption(value = {"--message", "-m"}, arity = Integer.MAX_VALUE, help = "The message.") String[] message,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        Logger rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
        }

        try {
            CompiledAgent agent = stateService.getAgent(agentName);
            if (agent == null) {
                return CommandResponse.error("No agent found with name '" + agentName + "'. Use 'agent-create' first.").toAnsiString();
            }
            String userMessage = String.join(" ", message);
            String credential = stateService.getBackendCredential(agent.profile().provider());

            ChatResponse response = spinner.spin("Thinking...",
                    () -> conversationService.chat(agent, userMessage, credential));
            return render(response);
        } catch (MissingCredentialException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        } catch (BackendUnreachableException e) {
            return CommandResponse.error(e.getMessage() + " You can try again.").toAnsiString();
        } catch (ApiAgentException e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }

    String render(ChatResponse response) {
        StringBuilder out = new StringBuilder();
        out.append(ANSI_CYAN).append("Agent: ").append(ANSI_RESET).append(response.message()).append('\n');
        if (!response.functionCalls().isEmpty()) {
            out.append('\n').append(ANSI_PURPLE).append("Function calls:").append(ANSI_RESET).append('\n');
            for (FunctionCallRecord call : response.functionCalls()) {
                out.append("  ").append(call.success() ? ANSI_GREEN + "ok  " : ANSI_RED + "fail").append(ANSI_RESET)
                        .append(' ').append(call.name()).append(' ').append(call.arguments())
                        .append(ANSI_YELLOW).append(" (").append(call.durationMillis()).append(" ms)").append(ANSI_RESET);
                if (call.error() != null) {
                    out.append(" ").append(call.error());
                }
                out.append('\n');
            }
        }
        if (!response.apiCalls().isEmpty()) {
            out.append(ANSI_PURPLE).append("API calls:").append(ANSI_RESET).append('\n');
            for (ApiCallRecord call : response.apiCalls()) {
                out.append("  ").append(call.method()).append(' ').append(call.url())
                        .append(" -> ").append(call.statusCode() == 0 ? "no response" : String.valueOf(call.statusCode()))
                        .append('\n');
            }
        }
        return out.toString();
    }
}
