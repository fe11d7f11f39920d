package com.apichat.service.impl;

import com.apichat.dto.response.EndpointView;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.AgentProfile;
import com.apichat.model.ApiDocument;
import com.apichat.model.CompilationResult;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import com.apichat.service.api.AgentCompilerService;
import com.apichat.service.api.AgentService;
import com.apichat.service.api.StateService;
import com.apichat.service.provider.ProviderRegistry;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class AgentServiceImpl implements AgentService {

    private final StateService stateService;
    private final AgentCompilerService compilerService;
    private final ProviderRegistry providerRegistry;

    public AgentServiceImpl(StateService stateService,
                            AgentCompilerService compilerService,
                            ProviderRegistry providerRegistry) {
        this.stateService = stateService;
        this.compilerService = compilerService;
        this.providerRegistry = providerRegistry;
    }

    @Override
    public CompilationResult createAgent(String agentName, String documentId, AgentProfile profile) {
        validate(profile);
        return compileAndStore(agentName, requireDocument(documentId), profile, true);
    }

    @Override
    public CompilationResult regenerateAgent(String agentName) {
        CompiledAgent existing = requireAgent(agentName);
        log.info("Regenerating agent '{}' from document '{}'", agentName, existing.documentId());
        return compileAndStore(agentName, requireDocument(existing.documentId()), existing.profile(), existing.active());
    }

    @Override
    public CompiledAgent setActive(String agentName, boolean active) {
        CompiledAgent updated = requireAgent(agentName).withActive(active);
        stateService.saveAgent(updated);
        log.info("Agent '{}' {}", agentName, active ? "activated" : "deactivated");
        return updated;
    }

    @Override
    public EndpointOverlay customize(String documentId, String operationKey, String customDescription, Boolean enabled) {
        ApiDocument document = requireDocument(documentId);
        boolean known = document.endpoints().stream().anyMatch(e -> e.operationKey().equals(operationKey));
        if (!known) {
            throw new ApiAgentException("Operation '" + operationKey + "' not found in API '" + documentId + "'.");
        }
        EndpointOverlay current = stateService.getOverlays(documentId).get(operationKey);
        EndpointOverlay overlay = new EndpointOverlay(operationKey,
                customDescription != null ? customDescription : current == null ? null : current.customDescription(),
                enabled != null ? enabled : current == null || current.enabled());
        stateService.saveOverlay(documentId, overlay);
        log.info("Saved overlay for '{}' in API '{}': enabled={}", operationKey, documentId, overlay.enabled());
        return overlay;
    }

    @Override
    public List<EndpointView> describeEndpoints(String documentId) {
        ApiDocument document = requireDocument(documentId);
        Map<String, EndpointOverlay> overlays = stateService.getOverlays(documentId);
        return document.endpoints().stream()
                .map(endpoint -> EndpointView.of(endpoint, overlays.get(endpoint.operationKey())))
                .toList();
    }

    private CompilationResult compileAndStore(String agentName, ApiDocument document, AgentProfile profile, boolean active) {
        CompilationResult result = compilerService.compile(agentName, document, stateService.getOverlays(document.id()), profile);
        if (result.success() && !active) {
            result = new CompilationResult(true, result.message(), result.agent().withActive(false), result.errors());
        }
        if (result.success()) {
            stateService.saveAgent(result.agent());
            log.info("Stored agent '{}' with {} functions", agentName, result.agent().functions().size());
        } else {
            log.warn("Compilation of agent '{}' failed: {}", agentName, result.errors());
        }
        return result;
    }

    private CompiledAgent requireAgent(String agentName) {
        CompiledAgent agent = stateService.getAgent(agentName);
        if (agent == null) {
            throw new ApiAgentException("No agent found with name '" + agentName + "'.");
        }
        return agent;
    }

    private ApiDocument requireDocument(String documentId) {
        ApiDocument document = stateService.getDocument(documentId);
        if (document == null) {
            throw new ApiAgentException("No API found with alias '" + documentId + "'. Use the 'learn' command first.");
        }
        return document;
    }

    private void validate(AgentProfile profile) {
        providerRegistry.get(profile.provider());
        if (profile.temperature() < 0.0 || profile.temperature() > 1.0) {
            throw new ApiAgentException("Temperature must be between 0.0 and 1.0, was " + profile.temperature());
        }
        if (profile.maxTokens() <= 0) {
            throw new ApiAgentException("Max tokens must be positive, was " + profile.maxTokens());
        }
    }
}
