package com.apichat.service.api;

import com.apichat.model.ApiDocument;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import java.util.Collection;
import java.util.Map;

/**
 * An interface defining the contract for managing the persistent state of the application:
 * learned documents, per-endpoint overlays, compiled agents and reasoning backend credentials.
 */
public interface StateService {

    /**
     * Saves or replaces a learned document under its id.
     */
    void saveDocument(ApiDocument document);

    /**
     * @return The document, or {@code null} if none was learned under this id.
     */
    ApiDocument getDocument(String documentId);

    Collection<ApiDocument> listDocuments();

    /**
     * Saves or replaces the overlay for one operation of a document.
     */
    void saveOverlay(String documentId, EndpointOverlay overlay);

    /**
     * @return The overlays of the document keyed by operation key; empty when none were saved.
     */
    Map<String, EndpointOverlay> getOverlays(String documentId);

    void saveAgent(CompiledAgent agent);

    /**
     * @return The agent, or {@code null} if no agent with this name exists.
     */
    CompiledAgent getAgent(String agentName);

    Collection<CompiledAgent> listAgents();

    /**
     * Saves the key of a reasoning backend, e.g. "openai". The key is stored encrypted.
     */
    void saveBackendCredential(String provider, String key);

    /**
     * @return The decrypted key, or {@code null} if none is stored or it cannot be decrypted.
     */
    String getBackendCredential(String provider);
}
