package com.apichat.cli;

import com.apichat.cli.ui.Spinner;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.AgentProfile;
import com.apichat.model.CompilationResult;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import com.apichat.model.ExecutionResult;
import com.apichat.service.api.AgentService;
import com.apichat.service.api.ExecutionEngine;
import com.apichat.service.api.StateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentCommandTest {

    private static final AgentProfile PROFILE = new AgentProfile("anthropic", "claude-3", 0.2, 1000);
    private static final CompiledAgent AGENT = new CompiledAgent("pets", "petstore", "preamble", List.of(), PROFILE);

    @Mock
    private AgentService agentService;
    @Mock
    private StateService stateService;
    @Mock
    private ExecutionEngine executionEngine;
    @Mock
    private Spinner spinner;

    private AgentCommand agentCommand;

    @BeforeEach
    void setUp() {
        agentCommand = new AgentCommand(agentService, stateService, executionEngine, spinner);
        lenient().when(spinner.spin(anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> task = invocation.getArgument(1, Supplier.class);
            return task.get();
        });
    }

    @Test
    void customize_rejectsNonBooleanEnabledFlag() {
        String output = agentCommand.customize("petstore", "listPets", null, "maybe");

        assertThat(output).contains("--enabled must be true or false, was 'maybe'.");
        verifyNoInteractions(agentService);
    }

    @Test
    void customize_savesOverlay() {
        when(agentService.customize("petstore", "listPets", null, false))
                .thenReturn(new EndpointOverlay("listPets", null, false));

        String output = agentCommand.customize("petstore", "listPets", null, "FALSE");

        assertThat(output).contains("Saved customization for 'listPets' (enabled: false)");
        assertThat(output).contains("agent-regenerate");
    }

    @Test
    void create_printsProviderAndCompilationWarnings() {
        when(agentService.createAgent("pets", "petstore", PROFILE)).thenReturn(new CompilationResult(true,
                "Created agent 'pets' with 5 functions", AGENT,
                List.of("Function name 'search' collides; renamed to 'search_2'")));

        String output = agentCommand.create("pets", "petstore", "anthropic", "claude-3", 0.2, 1000);

        assertThat(output).contains("Created agent 'pets' with 5 functions (anthropic, claude-3).");
        assertThat(output).contains("  - Function name 'search' collides; renamed to 'search_2'");
        assertThat(output).startsWith("\u001B[32m");
    }

    @Test
    void create_printsServiceErrors() {
        when(agentService.createAgent("pets", "missing", PROFILE))
                .thenThrow(new ApiAgentException("No API found with alias 'missing'. Use the 'learn' command first."));

        String output = agentCommand.create("pets", "missing", "anthropic", "claude-3", 0.2, 1000);

        assertThat(output).startsWith("\u001B[31m").contains("Use the 'learn' command first.");
    }

    @Test
    void regenerate_printsCompilationFailure() {
        when(agentService.regenerateAgent("pets")).thenReturn(CompilationResult.failure(
                "No endpoints left to compile", List.of("All endpoints are disabled")));

        String output = agentCommand.regenerate("pets");

        assertThat(output).startsWith("\u001B[31m")
                .contains("No endpoints left to compile")
                .contains("  - All endpoints are disabled");
    }

    @Test
    void deactivate_reportsNewState() {
        when(agentService.setActive("pets", false)).thenReturn(AGENT.withActive(false));

        String output = agentCommand.deactivate("pets");

        assertThat(output).contains("Agent 'pets' is now inactive.");
    }

    @Test
    void activate_printsServiceErrors() {
        when(agentService.setActive("ghost", true)).thenThrow(new ApiAgentException("No agent found with name 'ghost'."));

        String output = agentCommand.activate("ghost");

        assertThat(output).contains("No agent found with name 'ghost'.");
    }

    @Test
    void testFunction_executesWithParsedArguments() {
        ExecutionResult result = ExecutionResult.builder().success(true).statusCode(200)
                .method("GET").url("http://pets.test/api/pets/7").build();
        when(stateService.getAgent("pets")).thenReturn(AGENT);
        when(executionEngine.execute(AGENT, "showPetById", Map.of("petId", 7))).thenReturn(result);
        when(executionEngine.formatForConversation(result)).thenReturn("{ \"id\" : 7 }");

        String output = agentCommand.testFunction("pets", "showPetById", "{\"petId\": 7}");

        assertThat(output).contains("GET http://pets.test/api/pets/7 -> 200");
        assertThat(output).endsWith("\n{ \"id\" : 7 }");
    }

    @Test
    void testFunction_rejectsNonObjectArguments() {
        when(stateService.getAgent("pets")).thenReturn(AGENT);

        String output = agentCommand.testFunction("pets", "showPetById", "[1, 2]");

        assertThat(output).contains("Arguments must be a JSON object");
        verifyNoInteractions(executionEngine);
    }

    @Test
    void testFunction_whenAgentUnknown_printsError() {
        String output = agentCommand.testFunction("ghost", "listPets", "{}");

        assertThat(output).contains("No agent found with name 'ghost'.");
    }
}
