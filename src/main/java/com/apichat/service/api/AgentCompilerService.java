package com.apichat.service.api;

import com.apichat.model.AgentProfile;
import com.apichat.model.ApiDocument;
import com.apichat.model.ApiEndpoint;
import com.apichat.model.CompilationResult;
import com.apichat.model.EndpointOverlay;
import com.apichat.model.FunctionSchema;
import java.util.List;
import java.util.Map;

/**
 * Compiles the endpoints of a document into the system preamble and callable-function schemas
 * of an agent. Compilation is deterministic: identical inputs always yield identical output.
 */
public interface AgentCompilerService {

    /**
     * Compiles every enabled endpoint of the document into an agent.
     *
     * @param agentName The name of the agent.
     * @param document  The source document.
     * @param overlays  Overlays keyed by {@link ApiEndpoint#operationKey()}; may be empty.
     * @param profile   The reasoning backend settings of the agent.
     * @return A successful result with the agent and any non-fatal errors, or a failure with the error list.
     */
    CompilationResult compile(String agentName, ApiDocument document, Map<String, EndpointOverlay> overlays, AgentProfile profile);

    /**
     * Builds the capability brief describing the API and the given endpoints.
     */
    String buildSystemPreamble(ApiDocument document, List<ApiEndpoint> endpoints);

    /**
     * Builds one function schema per endpoint, appending a numeric suffix to colliding names.
     *
     * @param errors Receives a warning for every renamed function.
     */
    List<FunctionSchema> buildFunctions(String documentId, List<ApiEndpoint> endpoints,
                                        Map<String, EndpointOverlay> overlays, List<String> errors);

    /**
     * Filters the endpoints whose overlay enablement resolves to true. Endpoints without an overlay
     * are enabled.
     */
    List<ApiEndpoint> enabledEndpoints(ApiDocument document, Map<String, EndpointOverlay> overlays);
}
