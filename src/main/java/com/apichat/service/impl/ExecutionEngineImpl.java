package com.apichat.service.impl;

import com.apichat.exception.BindingMissingException;
import com.apichat.exception.FunctionNotFoundException;
import com.apichat.model.*;
import com.apichat.service.api.ExecutionEngine;
import com.apichat.service.api.StateService;
import com.apichat.util.NetworkFailures;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Executes compiled functions as real HTTP calls against the API they were compiled from.
 * <p>
 * Arguments are consumed in a fixed order: path placeholders, declared query parameters,
 * declared header and cookie parameters, and finally the body for POST, PUT and PATCH. The body
 * is the literal {@code body} argument when present, otherwise an object built from every
 * remaining argument whose name does not start with an underscore.
 */
@Service
@Slf4j
public class ExecutionEngineImpl implements ExecutionEngine {

    static final String LITERAL_BODY = "body";
    static final String TIMEOUT_MESSAGE = "Request timeout - the API took too long to respond";

    private static final Set<HttpMethod> DISPATCHABLE = EnumSet.of(
            HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.PATCH, HttpMethod.DELETE);

    private final WebClient webClient;
    private final StateService stateService;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final String userAgent;
    private final int errorPreviewLength;

    public ExecutionEngineImpl(WebClient webClient,
                               StateService stateService,
                               ObjectMapper objectMapper,
                               @Value("${agent.execution.timeout:30s}") Duration timeout,
                               @Value("${agent.execution.user-agent:api-chat-agent/0.1}") String userAgent,
                               @Value("${agent.execution.error-preview-length:200}") int errorPreviewLength) {
        this.webClient = webClient;
        this.stateService = stateService;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.errorPreviewLength = errorPreviewLength;
    }

    @Override
    public ExecutionResult execute(CompiledAgent agent, String functionName, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        ApiDocument document;
        ApiEndpoint endpoint;
        try {
            FunctionSchema function = agent.findFunction(functionName)
                    .orElseThrow(() -> new FunctionNotFoundException(functionName));
            ExecutionBinding binding = function.executionBinding();
            if (binding == null) {
                throw new BindingMissingException("Function '" + functionName + "' has no execution binding");
            }
            document = stateService.getDocument(binding.documentId());
            if (document == null) {
                throw new BindingMissingException("API document '" + binding.documentId()
                        + "' bound to function '" + functionName + "' no longer exists");
            }
            endpoint = document.findEndpoint(binding.endpointId())
                    .orElseThrow(() -> new BindingMissingException("Endpoint '" + binding.endpointId()
                            + "' bound to function '" + functionName + "' no longer exists in API document '"
                            + binding.documentId() + "'"));
        } catch (FunctionNotFoundException e) {
            log.warn(e.getMessage());
            return ExecutionResult.failure(FailureType.FUNCTION_NOT_FOUND, 0, null, null, e.getMessage());
        } catch (BindingMissingException e) {
            log.error("Stale execution binding: {}", e.getMessage());
            return ExecutionResult.failure(FailureType.BINDING_MISSING, 0, null, null, e.getMessage());
        }

        log.info("Executing function '{}' as {}", functionName, endpoint.id());
        return execute(document, endpoint, args);
    }

    ExecutionResult execute(ApiDocument document, ApiEndpoint endpoint, Map<String, Object> args) {
        String method = endpoint.method().name();
        Set<String> consumed = new HashSet<>();

        // 1. path
        Map<String, String> pathValues = new LinkedHashMap<>();
        for (EndpointParameter parameter : endpoint.parametersIn(ParameterLocation.PATH)) {
            if (args.containsKey(parameter.name()) && args.get(parameter.name()) != null) {
                pathValues.put(parameter.name(), stringify(args.get(parameter.name())));
                consumed.add(parameter.name());
            }
        }
        List<String> unresolved = endpoint.pathPlaceholders().stream()
                .filter(name -> !pathValues.containsKey(name))
                .toList();
        if (!unresolved.isEmpty()) {
            String target = joinUrl(document.baseUrl(), endpoint.pathTemplate());
            return ExecutionResult.failure(FailureType.MALFORMED_REQUEST, 0, method, target,
                    "Missing value for path parameter(s) " + unresolved + " in " + endpoint.pathTemplate());
        }
        if (!DISPATCHABLE.contains(endpoint.method())) {
            return ExecutionResult.failure(FailureType.MALFORMED_REQUEST, 0, method,
                    joinUrl(document.baseUrl(), endpoint.pathTemplate()), "Unsupported HTTP method: " + method);
        }

        // 2. query
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        for (EndpointParameter parameter : endpoint.parametersIn(ParameterLocation.QUERY)) {
            Object value = args.get(parameter.name());
            if (value != null) {
                if (value instanceof Collection<?> values) {
                    values.forEach(v -> query.add(parameter.name(), stringify(v)));
                } else {
                    query.add(parameter.name(), stringify(value));
                }
                consumed.add(parameter.name());
            }
        }

        // 3. headers and cookies
        Map<String, String> headerValues = collect(endpoint, ParameterLocation.HEADER, args, consumed);
        Map<String, String> cookieValues = collect(endpoint, ParameterLocation.COOKIE, args, consumed);

        // 4. body
        Object body = null;
        if (endpoint.method().acceptsBody()) {
            if (args.containsKey(LITERAL_BODY)) {
                body = args.get(LITERAL_BODY);
            } else {
                Map<String, Object> synthesized = new LinkedHashMap<>();
                args.forEach((name, value) -> {
                    if (!consumed.contains(name) && !name.startsWith("_")) {
                        synthesized.put(name, value);
                    }
                });
                if (!synthesized.isEmpty()) {
                    body = synthesized;
                }
            }
        }

        if (!document.hasBaseUrl()) {
            String barePath = UriComponentsBuilder.fromPath(endpoint.pathTemplate()).buildAndExpand(pathValues).toUriString();
            return ExecutionResult.failure(FailureType.MALFORMED_REQUEST, 0, method, barePath,
                    "No base URL is configured for API '" + document.id() + "', cannot call " + barePath);
        }

        URI uri;
        try {
            uri = buildUri(document.baseUrl(), endpoint.pathTemplate(), pathValues, query);
        } catch (IllegalArgumentException e) {
            return ExecutionResult.failure(FailureType.MALFORMED_REQUEST, 0, method,
                    joinUrl(document.baseUrl(), endpoint.pathTemplate()), "Invalid request URL: " + e.getMessage());
        }
        return dispatch(method, uri, headerValues, cookieValues, body);
    }

    private ExecutionResult dispatch(String method, URI uri, Map<String, String> headerValues,
                                     Map<String, String> cookieValues, Object body) {
        String url = uri.toString();
        log.debug("Dispatching {} {} with headers {} and body {}", method, url, headerValues.keySet(), body);

        WebClient.RequestBodySpec request = webClient.method(org.springframework.http.HttpMethod.valueOf(method))
                .uri(uri)
                .headers(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.set(HttpHeaders.USER_AGENT, userAgent);
                    headerValues.forEach(headers::set);
                })
                .cookies(cookies -> cookieValues.forEach(cookies::add));
        WebClient.RequestHeadersSpec<?> ready = body != null ? request.bodyValue(body) : request;

        long started = System.nanoTime();
        RawResponse response;
        try {
            response = ready.exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(text -> new RawResponse(clientResponse.statusCode().value(), text)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            if (NetworkFailures.isTimeout(e)) {
                log.warn("{} {} timed out after {}", method, url, timeout);
                return ExecutionResult.failure(FailureType.TIMEOUT, 408, method, url, TIMEOUT_MESSAGE);
            }
            if (NetworkFailures.isConnectionFailure(e)) {
                log.warn("{} {} failed: could not connect ({})", method, url, e.getMessage());
                return ExecutionResult.failure(FailureType.CONNECTION, 0, method, url, "Could not connect to " + url);
            }
            log.error("Unexpected error while calling {} {}", method, url, e);
            return ExecutionResult.failure(FailureType.EXECUTION_ERROR, 0, method, url, "Request failed: " + e.getMessage());
        }
        if (response == null) {
            return ExecutionResult.failure(FailureType.EXECUTION_ERROR, 0, method, url, "No response received from " + url);
        }

        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();
        boolean success = response.status() >= 200 && response.status() < 300;
        log.info("{} {} -> {} in {} ms", method, url, response.status(), elapsedMillis);

        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .success(success)
                .statusCode(response.status())
                .method(method)
                .url(url)
                .body(parseBody(response.text()));
        if (!success) {
            result.failureType(FailureType.HTTP_STATUS).errorMessage(httpError(response));
        }
        return result.build();
    }

    @Override
    public String formatForConversation(ExecutionResult result) {
        if (!result.isSuccess()) {
            return "Error " + result.getStatusCode() + ": " + result.getErrorMessage();
        }
        JsonNode body = result.getBody();
        if (body == null) {
            return "Request succeeded with status " + result.getStatusCode() + " and no content.";
        }
        if (body.isTextual()) {
            return body.asText();
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.warn("Could not pretty-print the response body, using compact form", e);
            return body.toString();
        }
    }

    private static Map<String, String> collect(ApiEndpoint endpoint, ParameterLocation location,
                                               Map<String, Object> args, Set<String> consumed) {
        Map<String, String> values = new LinkedHashMap<>();
        for (EndpointParameter parameter : endpoint.parametersIn(location)) {
            Object value = args.get(parameter.name());
            if (value != null) {
                values.put(parameter.name(), stringify(value));
                consumed.add(parameter.name());
            }
        }
        return values;
    }

    private JsonNode parseBody(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private String httpError(RawResponse response) {
        String text = response.text();
        if (text == null || text.isBlank()) {
            return "HTTP " + response.status();
        }
        String preview = text.length() > errorPreviewLength ? text.substring(0, errorPreviewLength) : text;
        return "HTTP " + response.status() + ": " + preview;
    }

    private static String stringify(Object value) {
        return String.valueOf(value);
    }

    /**
     * Expands path and query values as URI variables, so that characters such as braces, plus
     * signs or ampersands in a value are percent-encoded instead of read as template syntax.
     */
    static URI buildUri(String baseUrl, String pathTemplate, Map<String, String> pathValues,
                        MultiValueMap<String, String> query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(joinUrl(baseUrl, pathTemplate));
        Map<String, Object> variables = new HashMap<>(pathValues);
        int index = 0;
        for (Map.Entry<String, List<String>> entry : query.entrySet()) {
            for (String value : entry.getValue()) {
                String variable = "query" + index++;
                while (variables.containsKey(variable)) {
                    variable = "query" + index++;
                }
                variables.put(variable, value);
                builder.queryParam(entry.getKey(), "{" + variable + "}");
            }
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    /**
     * Joins base URL and path with exactly one slash between them. Without a base URL the path
     * is returned unchanged.
     */
    static String joinUrl(String baseUrl, String path) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return path;
        }
        return UriComponentsBuilder.fromUriString(baseUrl)
                .path(path.startsWith("/") ? path : "/" + path)
                .build()
                .toUriString();
    }

    private record RawResponse(int status, String text) {
    }
}
