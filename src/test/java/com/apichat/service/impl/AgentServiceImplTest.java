package com.apichat.service.impl;

import com.apichat.dto.response.EndpointView;
import com.apichat.exception.ApiAgentException;
import com.apichat.exception.UnknownProviderException;
import com.apichat.model.AgentProfile;
import com.apichat.model.ApiDocument;
import com.apichat.model.CompilationResult;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import com.apichat.model.FunctionSchema;
import com.apichat.service.api.StateService;
import com.apichat.service.provider.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentServiceImplTest {

    @Mock
    private StateService stateService;

    @Mock
    private ProviderRegistry providerRegistry;

    private AgentServiceImpl agentService;

    private final ApiDocument petstore = AgentCompilerServiceImplTest.petstore();

    @BeforeEach
    void setUp() {
        agentService = new AgentServiceImpl(stateService, new AgentCompilerServiceImpl(), providerRegistry);
    }

    @Test
    void createAgent_shouldCompileWithStoredOverlaysAndSave() {
        when(stateService.getDocument("petstore")).thenReturn(petstore);
        when(stateService.getOverlays("petstore"))
                .thenReturn(Map.of("listPets", new EndpointOverlay("listPets", null, false)));

        CompilationResult result = agentService.createAgent("pets", "petstore", AgentProfile.defaults());

        assertThat(result.success()).isTrue();
        ArgumentCaptor<CompiledAgent> saved = ArgumentCaptor.forClass(CompiledAgent.class);
        verify(stateService).saveAgent(saved.capture());
        assertThat(saved.getValue().name()).isEqualTo("pets");
        assertThat(saved.getValue().documentId()).isEqualTo("petstore");
        assertThat(saved.getValue().functions()).extracting(FunctionSchema::name)
                .doesNotContain("listPets")
                .contains("createPet", "showPetById");
    }

    @Test
    void createAgent_shouldNotSaveWhenEveryEndpointIsDisabled() {
        ApiDocument single = new ApiDocument("tiny", "Tiny", null, null, null, "http://tiny.test",
                List.of(petstore.endpoints().get(0)));
        when(stateService.getDocument("tiny")).thenReturn(single);
        when(stateService.getOverlays("tiny"))
                .thenReturn(Map.of("listPets", new EndpointOverlay("listPets", null, false)));

        CompilationResult result = agentService.createAgent("tiny-agent", "tiny", AgentProfile.defaults());

        assertThat(result.success()).isFalse();
        verify(stateService, never()).saveAgent(any());
    }

    @Test
    void createAgent_shouldRejectUnknownDocument() {
        assertThatThrownBy(() -> agentService.createAgent("pets", "missing", AgentProfile.defaults()))
                .isInstanceOf(ApiAgentException.class)
                .hasMessage("No API found with alias 'missing'. Use the 'learn' command first.");
    }

    @Test
    void createAgent_shouldRejectUnknownProvider() {
        when(providerRegistry.get("gemini")).thenThrow(new UnknownProviderException("gemini"));

        assertThatThrownBy(() -> agentService.createAgent("pets", "petstore", new AgentProfile("gemini", "g", 0.5, 100)))
                .isInstanceOf(UnknownProviderException.class);
        verify(stateService, never()).getDocument(anyString());
    }

    @Test
    void createAgent_shouldRejectOutOfRangeSettings() {
        assertThatThrownBy(() -> agentService.createAgent("pets", "petstore", new AgentProfile("openai", "gpt-4", 1.5, 100)))
                .isInstanceOf(ApiAgentException.class)
                .hasMessageContaining("Temperature");
        assertThatThrownBy(() -> agentService.createAgent("pets", "petstore", new AgentProfile("openai", "gpt-4", 0.5, 0)))
                .isInstanceOf(ApiAgentException.class)
                .hasMessageContaining("Max tokens");
        verify(stateService, never()).getDocument(anyString());
    }

    @Test
    void regenerateAgent_shouldReuseStoredProfile() {
        AgentProfile profile = new AgentProfile("ollama", "llama3", 0.1, 256);
        CompiledAgent existing = new CompiledAgent("pets", "petstore", "old preamble", List.of(), profile);
        when(stateService.getAgent("pets")).thenReturn(existing);
        when(stateService.getDocument("petstore")).thenReturn(petstore);
        when(stateService.getOverlays("petstore")).thenReturn(Map.of());

        CompilationResult result = agentService.regenerateAgent("pets");

        assertThat(result.success()).isTrue();
        assertThat(result.agent().profile()).isEqualTo(profile);
        assertThat(result.agent().functions()).hasSize(petstore.endpoints().size());
        verify(stateService).saveAgent(result.agent());
    }

    @Test
    void regenerateAgent_shouldKeepAgentInactive() {
        CompiledAgent existing = new CompiledAgent("pets", "petstore", "old preamble", List.of(), AgentProfile.defaults())
                .withActive(false);
        when(stateService.getAgent("pets")).thenReturn(existing);
        when(stateService.getDocument("petstore")).thenReturn(petstore);
        when(stateService.getOverlays("petstore")).thenReturn(Map.of());

        CompilationResult result = agentService.regenerateAgent("pets");

        assertThat(result.success()).isTrue();
        assertThat(result.agent().active()).isFalse();
        assertThat(result.agent().functions()).isNotEmpty();
        verify(stateService).saveAgent(result.agent());
    }

    @Test
    void setActive_shouldStoreFlagAndKeepFunctions() {
        CompiledAgent existing = new CompiledAgent("pets", "petstore", "preamble", List.of(), AgentProfile.defaults());
        when(stateService.getAgent("pets")).thenReturn(existing);

        CompiledAgent deactivated = agentService.setActive("pets", false);

        assertThat(deactivated.active()).isFalse();
        assertThat(deactivated.systemPreamble()).isEqualTo("preamble");
        verify(stateService).saveAgent(deactivated);
    }

    @Test
    void setActive_shouldRejectUnknownAgent() {
        assertThatThrownBy(() -> agentService.setActive("ghost", true))
                .isInstanceOf(ApiAgentException.class)
                .hasMessage("No agent found with name 'ghost'.");
        verify(stateService, never()).saveAgent(any());
    }

    @Test
    void regenerateAgent_shouldRejectUnknownAgent() {
        assertThatThrownBy(() -> agentService.regenerateAgent("ghost"))
                .isInstanceOf(ApiAgentException.class)
                .hasMessage("No agent found with name 'ghost'.");
    }

    @Test
    void customize_shouldMergeWithExistingOverlay() {
        when(stateService.getDocument("petstore")).thenReturn(petstore);
        when(stateService.getOverlays("petstore"))
                .thenReturn(Map.of("showPetById", new EndpointOverlay("showPetById", "Look up one pet", true)));

        EndpointOverlay overlay = agentService.customize("petstore", "showPetById", null, false);

        assertThat(overlay).isEqualTo(new EndpointOverlay("showPetById", "Look up one pet", false));
        verify(stateService).saveOverlay(eq("petstore"), eq(overlay));
    }

    @Test
    void customize_shouldAcceptDerivedOperationKey() {
        when(stateService.getDocument("petstore")).thenReturn(petstore);
        when(stateService.getOverlays("petstore")).thenReturn(Map.of());

        EndpointOverlay overlay = agentService.customize("petstore", "delete_pets_by_petId", "Remove a pet", null);

        assertThat(overlay.enabled()).isTrue();
        assertThat(overlay.customDescription()).isEqualTo("Remove a pet");
    }

    @Test
    void customize_shouldRejectUnknownOperation() {
        when(stateService.getDocument("petstore")).thenReturn(petstore);

        assertThatThrownBy(() -> agentService.customize("petstore", "adoptPet", "x", null))
                .isInstanceOf(ApiAgentException.class)
                .hasMessage("Operation 'adoptPet' not found in API 'petstore'.");
        verify(stateService, never()).saveOverlay(anyString(), any());
    }

    @Test
    void describeEndpoints_shouldMergeOverlayFlags() {
        when(stateService.getDocument("petstore")).thenReturn(petstore);
        when(stateService.getOverlays("petstore"))
                .thenReturn(Map.of("listPets", new EndpointOverlay("listPets", "Every pet", false)));

        List<EndpointView> views = agentService.describeEndpoints("petstore");

        assertThat(views).hasSize(6);
        EndpointView listPets = views.get(0);
        assertThat(listPets.enabled()).isFalse();
        assertThat(listPets.customDescription()).isEqualTo("Every pet");
        assertThat(listPets.parameters()).containsExactly("limit (in: query, required: false)");
        EndpointView delete = views.get(3);
        assertThat(delete.operationKey()).isEqualTo("delete_pets_by_petId");
        assertThat(delete.deprecated()).isTrue();
        assertThat(delete.enabled()).isTrue();
    }
}
