package com.apichat.service.api;

import com.apichat.dto.response.EndpointView;
import com.apichat.model.AgentProfile;
import com.apichat.model.CompilationResult;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import java.util.List;

/**
 * Manages agents and overlays on top of the learned documents: the operations behind the
 * shell commands that are not part of a chat exchange.
 */
public interface AgentService {

    /**
     * Compiles a new agent from a learned document, applying the document's current overlays,
     * and stores it when compilation succeeds.
     *
     * @throws com.apichat.exception.ApiAgentException if the document is unknown or the profile is invalid.
     */
    CompilationResult createAgent(String agentName, String documentId, AgentProfile profile);

    /**
     * Recompiles an existing agent with its stored profile against the current document and overlays.
     *
     * @throws com.apichat.exception.ApiAgentException if the agent or its document is unknown.
     */
    CompilationResult regenerateAgent(String agentName);

    /**
     * Takes an agent in or out of service. An inactive agent keeps its compiled functions but
     * refuses chat messages until it is activated again.
     *
     * @return The stored agent with the new flag.
     * @throws com.apichat.exception.ApiAgentException if the agent is unknown.
     */
    CompiledAgent setActive(String agentName, boolean active);

    /**
     * Writes the overlay of one operation. Existing agents pick it up on regeneration.
     *
     * @param operationKey      The operationId, or derived name, of the endpoint.
     * @param customDescription A replacement description; {@code null} keeps the current one.
     * @param enabled           Whether the endpoint is compiled into agents; {@code null} keeps the current flag.
     * @return The stored overlay.
     * @throws com.apichat.exception.ApiAgentException if the document or operation is unknown.
     */
    EndpointOverlay customize(String documentId, String operationKey, String customDescription, Boolean enabled);

    /**
     * @return One view per endpoint of the document, in document order.
     * @throws com.apichat.exception.ApiAgentException if the document is unknown.
     */
    List<EndpointView> describeEndpoints(String documentId);
}
