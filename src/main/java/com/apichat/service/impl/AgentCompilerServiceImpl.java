package com.apichat.service.impl;

import com.apichat.model.AgentProfile;
import com.apichat.model.ApiDocument;
import com.apichat.model.ApiEndpoint;
import com.apichat.model.BodyProperty;
import com.apichat.model.CompilationResult;
import com.apichat.model.CompiledAgent;
import com.apichat.model.EndpointOverlay;
import com.apichat.model.EndpointParameter;
import com.apichat.model.ExecutionBinding;
import com.apichat.model.FunctionSchema;
import com.apichat.model.ParameterLocation;
import com.apichat.model.ParameterSchema;
import com.apichat.model.PropertySchema;
import com.apichat.service.api.AgentCompilerService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The {@link AgentCompilerService} that turns endpoints into the function-calling vocabulary
 * shared by all reasoning backends.
 * <p>
 * Endpoints whose path template references a placeholder without a matching path parameter are
 * reported and left out; the rest of the document still compiles.
 */
@Service
@Slf4j
public class AgentCompilerServiceImpl implements AgentCompilerService {

    static final String GENERIC_BODY = "body";
    static final String NO_PARAMS = "_no_params";
    static final String DEPRECATION_NOTICE = " (DEPRECATED - use alternative if available)";

    private static final Map<String, String> TYPE_MAPPING = Map.ofEntries(
            Map.entry("integer", "number"),
            Map.entry("int", "number"),
            Map.entry("long", "number"),
            Map.entry("float", "number"),
            Map.entry("double", "number"),
            Map.entry("number", "number"),
            Map.entry("string", "string"),
            Map.entry("boolean", "boolean"),
            Map.entry("bool", "boolean"),
            Map.entry("array", "array"),
            Map.entry("object", "object"));

    @Override
    public CompilationResult compile(String agentName, ApiDocument document, Map<String, EndpointOverlay> overlays, AgentProfile profile) {
        Map<String, EndpointOverlay> overlayMap = overlays == null ? Map.of() : overlays;
        if (document.endpoints().isEmpty()) {
            return CompilationResult.failure("No endpoints found in API description '" + document.id() + "'",
                    List.of("No endpoints available"));
        }

        List<ApiEndpoint> enabled = enabledEndpoints(document, overlayMap);
        if (enabled.isEmpty()) {
            return CompilationResult.failure("No enabled endpoints found in API description '" + document.id() + "'",
                    List.of("All endpoints are disabled"));
        }

        List<String> errors = new ArrayList<>();
        List<ApiEndpoint> compilable = new ArrayList<>();
        for (ApiEndpoint endpoint : enabled) {
            String problem = unresolvedPlaceholders(endpoint);
            if (problem == null) {
                compilable.add(endpoint);
            } else {
                log.warn("Skipping {}: {}", endpoint.id(), problem);
                errors.add(endpoint.id() + ": " + problem);
            }
        }
        if (compilable.isEmpty()) {
            return CompilationResult.failure("No endpoint of '" + document.id() + "' could be compiled", errors);
        }

        String preamble = buildSystemPreamble(document, compilable);
        List<FunctionSchema> functions = buildFunctions(document.id(), compilable, overlayMap, errors);
        CompiledAgent agent = new CompiledAgent(agentName, document.id(), preamble, functions, profile);

        log.info("Compiled agent '{}' with {} functions from '{}' ({} errors).", agentName, functions.size(), document.id(), errors.size());
        return new CompilationResult(true, "Agent compiled with " + functions.size() + " functions", agent, errors);
    }

    @Override
    public List<ApiEndpoint> enabledEndpoints(ApiDocument document, Map<String, EndpointOverlay> overlays) {
        return document.endpoints().stream()
                .filter(endpoint -> {
                    EndpointOverlay overlay = overlays.get(endpoint.operationKey());
                    return overlay == null || overlay.enabled();
                })
                .collect(Collectors.toList());
    }

    @Override
    public String buildSystemPreamble(ApiDocument document, List<ApiEndpoint> endpoints) {
        String apiInfo = document.version() != null && !document.version().isBlank()
                ? document.title() + " (v" + document.version() + ")"
                : document.title();

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an AI assistant that can interact with the ").append(apiInfo).append(" API.\n\n")
                .append("API Information:\n")
                .append("- Name: ").append(document.title()).append('\n')
                .append("- Description: ").append(orDefault(document.description(), "No description available")).append('\n')
                .append("- Base URL: ").append(orDefault(document.baseUrl(), "Not specified")).append('\n')
                .append("- OpenAPI Version: ").append(orDefault(document.openApiVersion(), "Unknown")).append("\n\n")
                .append("Your capabilities:\n")
                .append("You have access to ").append(endpoints.size())
                .append(" API endpoints that you can call to help users. When a user asks you to do something that requires API interaction, you should:\n\n")
                .append("1. Understand the user's intent\n")
                .append("2. Determine which API endpoint(s) to call\n")
                .append("3. Extract the necessary parameters from the user's request\n")
                .append("4. Call the appropriate function(s)\n")
                .append("5. Provide a direct, concise response with the results\n\n")
                .append("Important guidelines:\n")
                .append("- Call the API functions directly without announcing what you're going to do\n")
                .append("- Provide results immediately and concisely\n")
                .append("- If you need more information from the user, ask for it instead of guessing\n")
                .append("- Handle errors gracefully and explain what went wrong\n")
                .append("- Never make up or hallucinate API responses - only use actual data from the API calls\n\n")
                .append("Available endpoints:\n");

        for (ApiEndpoint endpoint : endpoints) {
            String tags = endpoint.tags().isEmpty() ? "" : " [" + String.join(", ", endpoint.tags()) + "]";
            prompt.append("\n- ").append(endpoint.method()).append(' ').append(endpoint.pathTemplate())
                    .append(tags).append(": ").append(orDefault(endpoint.summary(), "No description"));
        }
        return prompt.toString();
    }

    @Override
    public List<FunctionSchema> buildFunctions(String documentId, List<ApiEndpoint> endpoints,
                                               Map<String, EndpointOverlay> overlays, List<String> errors) {
        Set<String> taken = new HashSet<>();
        List<FunctionSchema> functions = new ArrayList<>();
        for (ApiEndpoint endpoint : endpoints) {
            String baseName = endpoint.operationKey();
            String name = baseName;
            int suffix = 2;
            while (!taken.add(name)) {
                name = baseName + "_" + suffix++;
            }
            if (!name.equals(baseName)) {
                errors.add("Function name '" + baseName + "' of " + endpoint.id() + " collides with an earlier endpoint; renamed to '" + name + "'");
            }
            functions.add(new FunctionSchema(
                    name,
                    describe(endpoint, overlays.get(endpoint.operationKey())),
                    buildParameterSchema(endpoint),
                    new ExecutionBinding(documentId, endpoint.id())));
        }
        return functions;
    }

    String describe(ApiEndpoint endpoint, EndpointOverlay overlay) {
        String description;
        if (overlay != null && overlay.hasCustomDescription()) {
            description = overlay.customDescription();
        } else if (hasText(endpoint.summary())) {
            description = endpoint.summary();
        } else if (hasText(endpoint.description())) {
            description = endpoint.description();
        } else {
            description = endpoint.method() + " " + endpoint.pathTemplate();
        }
        return endpoint.deprecated() ? description + DEPRECATION_NOTICE : description;
    }

    /**
     * Path parameters first (always required), then query parameters (required as declared), then
     * the flat body properties. A required body without flat properties becomes a single required
     * {@code body} object.
     */
    ParameterSchema buildParameterSchema(ApiEndpoint endpoint) {
        Map<String, PropertySchema> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();

        for (EndpointParameter parameter : endpoint.parametersIn(ParameterLocation.PATH)) {
            if (properties.putIfAbsent(parameter.name(), property(parameter, "Path parameter: ")) == null) {
                required.add(parameter.name());
            }
        }
        for (EndpointParameter parameter : endpoint.parametersIn(ParameterLocation.QUERY)) {
            if (properties.putIfAbsent(parameter.name(), property(parameter, "Query parameter: ")) == null && parameter.required()) {
                required.add(parameter.name());
            }
        }

        if (endpoint.requestBody() != null) {
            for (BodyProperty bodyProperty : endpoint.requestBody().properties()) {
                properties.putIfAbsent(bodyProperty.name(), new PropertySchema(
                        mapType(bodyProperty.type()),
                        hasText(bodyProperty.description()) ? bodyProperty.description() : "Body field: " + bodyProperty.name()));
            }
            if (endpoint.requestBody().required() && !endpoint.requestBody().hasProperties() && !properties.containsKey(GENERIC_BODY)) {
                properties.put(GENERIC_BODY, new PropertySchema("object",
                        hasText(endpoint.requestBody().description()) ? endpoint.requestBody().description() : "Request body"));
                required.add(GENERIC_BODY);
            }
        }

        if (properties.isEmpty()) {
            properties.put(NO_PARAMS, new PropertySchema("string", "This endpoint requires no parameters", List.of("none")));
        }
        return new ParameterSchema(properties, required);
    }

    static String mapType(String sourceType) {
        if (sourceType == null) {
            return "string";
        }
        return TYPE_MAPPING.getOrDefault(sourceType.toLowerCase(Locale.ROOT), "string");
    }

    private PropertySchema property(EndpointParameter parameter, String defaultPrefix) {
        return new PropertySchema(mapType(parameter.type()),
                hasText(parameter.description()) ? parameter.description() : defaultPrefix + parameter.name());
    }

    private String unresolvedPlaceholders(ApiEndpoint endpoint) {
        List<String> missing = new ArrayList<>();
        List<String> ambiguous = new ArrayList<>();
        for (String placeholder : endpoint.pathPlaceholders()) {
            long matches = endpoint.parametersIn(ParameterLocation.PATH).stream()
                    .filter(p -> p.name().equals(placeholder))
                    .count();
            if (matches == 0) {
                missing.add(placeholder);
            } else if (matches > 1) {
                ambiguous.add(placeholder);
            }
        }
        if (missing.isEmpty() && ambiguous.isEmpty()) {
            return null;
        }
        StringBuilder problem = new StringBuilder();
        if (!missing.isEmpty()) {
            problem.append("path placeholder(s) without a path parameter: ").append(String.join(", ", missing));
        }
        if (!ambiguous.isEmpty()) {
            if (problem.length() > 0) {
                problem.append("; ");
            }
            problem.append("path placeholder(s) declared more than once: ").append(String.join(", ", ambiguous));
        }
        return problem.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String orDefault(String value, String fallback) {
        return hasText(value) ? value : fallback;
    }
}
