package com.apichat.service.impl;

import com.apichat.model.ApiDocument;
import com.apichat.model.ApiEndpoint;
import com.apichat.model.BodyProperty;
import com.apichat.model.EndpointParameter;
import com.apichat.model.ExtractionResult;
import com.apichat.model.HttpMethod;
import com.apichat.model.ParameterLocation;
import com.apichat.model.RequestBodyModel;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.servers.ServerVariable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a parsed description tree into the typed endpoint model in a single pass.
 * <p>
 * Every path item is converted independently. When one is malformed it is skipped and the
 * reason is recorded, so the caller always receives the endpoints that could be read.
 */
@Component
@Slf4j
public class EndpointExtractor {

    static final List<String> BODY_CONTENT_TYPES = List.of("application/json", "application/xml");

    private static final String SCHEMA_REF_PREFIX = "#/components/schemas/";
    private static final String PARAMETER_REF_PREFIX = "#/components/parameters/";
    private static final String REQUEST_BODY_REF_PREFIX = "#/components/requestBodies/";

    /**
     * Extracts the document metadata and all endpoints of the tree.
     *
     * @param documentId The id the extracted document will carry.
     * @param openApi    The parsed description tree.
     * @return The document with every endpoint that could be extracted, plus one error per skipped path item.
     */
    public ExtractionResult extract(String documentId, OpenAPI openApi) {
        List<String> errors = new ArrayList<>();
        List<ApiEndpoint> endpoints = new ArrayList<>();

        if (openApi.getPaths() == null || openApi.getPaths().isEmpty()) {
            errors.add("The description document declares no paths.");
        } else {
            openApi.getPaths().forEach((path, pathItem) -> {
                try {
                    endpoints.addAll(extractPathItem(path, pathItem, openApi));
                } catch (RuntimeException e) {
                    log.warn("Skipping path '{}': {}", path, e.getMessage());
                    errors.add("Skipped path '" + path + "': " + e.getMessage());
                }
            });
        }

        String title = "Untitled API";
        String description = null;
        String version = null;
        if (openApi.getInfo() != null) {
            if (openApi.getInfo().getTitle() != null && !openApi.getInfo().getTitle().isBlank()) {
                title = openApi.getInfo().getTitle();
            }
            description = openApi.getInfo().getDescription();
            version = openApi.getInfo().getVersion();
        }

        ApiDocument document = new ApiDocument(documentId, title, description, version,
                openApi.getOpenapi(), baseUrl(openApi), endpoints);
        log.info("Extracted {} endpoints from '{}' ({} path items skipped).", endpoints.size(), documentId, errors.size());
        return new ExtractionResult(document, errors);
    }

    private List<ApiEndpoint> extractPathItem(String path, PathItem pathItem, OpenAPI openApi) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/'");
        }
        if (pathItem == null) {
            throw new IllegalArgumentException("path item is empty");
        }
        if (pathItem.get$ref() != null) {
            throw new IllegalArgumentException("unresolved path item reference " + pathItem.get$ref());
        }

        Map<PathItem.HttpMethod, Operation> operations = pathItem.readOperationsMap();
        List<ApiEndpoint> endpoints = new ArrayList<>();
        for (HttpMethod method : HttpMethod.values()) {
            Operation operation = operations.get(PathItem.HttpMethod.valueOf(method.name()));
            if (operation != null) {
                endpoints.add(createEndpoint(method, path, pathItem, operation, openApi));
            }
        }
        return endpoints;
    }

    private ApiEndpoint createEndpoint(HttpMethod method, String path, PathItem pathItem, Operation operation, OpenAPI openApi) {
        Map<ParameterLocation, List<EndpointParameter>> parameters = new EnumMap<>(ParameterLocation.class);
        for (Parameter parameter : mergedParameters(pathItem, operation, openApi)) {
            if (parameter.getName() == null || parameter.getName().isBlank()) {
                throw new IllegalArgumentException(method + " declares a parameter without a name");
            }
            ParameterLocation.fromString(parameter.getIn()).ifPresentOrElse(
                    location -> parameters.computeIfAbsent(location, l -> new ArrayList<>())
                            .add(new EndpointParameter(
                                    parameter.getName(),
                                    location,
                                    Boolean.TRUE.equals(parameter.getRequired()),
                                    typeOf(parameter.getSchema(), openApi),
                                    parameter.getDescription())),
                    () -> log.debug("Dropping parameter '{}' of {} {} with unrecognized location '{}'",
                            parameter.getName(), method, path, parameter.getIn()));
        }

        return new ApiEndpoint(
                ApiEndpoint.idOf(method, path),
                operation.getOperationId(),
                method,
                path,
                operation.getSummary(),
                operation.getDescription(),
                parameters,
                createRequestBody(operation.getRequestBody(), openApi),
                responses(operation),
                securitySchemes(operation, openApi),
                operation.getTags(),
                Boolean.TRUE.equals(operation.getDeprecated()));
    }

    /**
     * Path-level parameters apply to every operation unless the operation redeclares the same
     * name and location.
     */
    private List<Parameter> mergedParameters(PathItem pathItem, Operation operation, OpenAPI openApi) {
        Map<String, Parameter> merged = new LinkedHashMap<>();
        if (pathItem.getParameters() != null) {
            pathItem.getParameters().forEach(p -> {
                Parameter resolved = resolveParameter(p, openApi);
                merged.put(resolved.getIn() + ":" + resolved.getName(), resolved);
            });
        }
        if (operation.getParameters() != null) {
            operation.getParameters().forEach(p -> {
                Parameter resolved = resolveParameter(p, openApi);
                merged.put(resolved.getIn() + ":" + resolved.getName(), resolved);
            });
        }
        return new ArrayList<>(merged.values());
    }

    private Parameter resolveParameter(Parameter parameter, OpenAPI openApi) {
        if (parameter == null) {
            throw new IllegalArgumentException("null parameter entry");
        }
        String ref = parameter.get$ref();
        if (ref == null) {
            return parameter;
        }
        if (ref.startsWith(PARAMETER_REF_PREFIX) && openApi.getComponents() != null
                && openApi.getComponents().getParameters() != null) {
            Parameter resolved = openApi.getComponents().getParameters().get(ref.substring(PARAMETER_REF_PREFIX.length()));
            if (resolved != null) {
                return resolved;
            }
        }
        throw new IllegalArgumentException("unresolved parameter reference " + ref);
    }

    /**
     * Reads the body schema of the first supported content type. Only the top-level properties
     * are kept; a body without flat properties keeps an empty list.
     */
    private RequestBodyModel createRequestBody(RequestBody requestBody, OpenAPI openApi) {
        if (requestBody == null) {
            return null;
        }
        if (requestBody.get$ref() != null) {
            requestBody = resolveRequestBody(requestBody.get$ref(), openApi);
        }
        boolean required = Boolean.TRUE.equals(requestBody.getRequired());
        Content content = requestBody.getContent();
        if (content == null) {
            return new RequestBodyModel(null, required, requestBody.getDescription(), List.of());
        }

        for (String contentType : BODY_CONTENT_TYPES) {
            MediaType mediaType = content.get(contentType);
            if (mediaType == null) {
                continue;
            }
            List<BodyProperty> properties = new ArrayList<>();
            Schema<?> schema = resolveSchema(mediaType.getSchema(), openApi);
            if (schema != null && schema.getProperties() != null) {
                schema.getProperties().forEach((name, propertySchema) -> {
                    Schema<?> resolved = resolveSchema(propertySchema, openApi);
                    properties.add(new BodyProperty(name, typeOf(resolved, openApi),
                            resolved != null ? resolved.getDescription() : null));
                });
            }
            return new RequestBodyModel(contentType, required, requestBody.getDescription(), properties);
        }
        return new RequestBodyModel(null, required, requestBody.getDescription(), List.of());
    }

    private RequestBody resolveRequestBody(String ref, OpenAPI openApi) {
        if (ref.startsWith(REQUEST_BODY_REF_PREFIX) && openApi.getComponents() != null
                && openApi.getComponents().getRequestBodies() != null) {
            RequestBody resolved = openApi.getComponents().getRequestBodies().get(ref.substring(REQUEST_BODY_REF_PREFIX.length()));
            if (resolved != null) {
                return resolved;
            }
        }
        throw new IllegalArgumentException("unresolved request body reference " + ref);
    }

    /**
     * Follows a {@code #/components/schemas/} reference. An unresolvable reference yields the
     * schema unchanged so that the caller sees no properties rather than failing the endpoint.
     */
    private Schema<?> resolveSchema(Schema<?> schema, OpenAPI openApi) {
        Schema<?> current = schema;
        int hops = 0;
        while (current != null && current.get$ref() != null && hops++ < 16) {
            String ref = current.get$ref();
            if (!ref.startsWith(SCHEMA_REF_PREFIX) || openApi.getComponents() == null
                    || openApi.getComponents().getSchemas() == null) {
                return current;
            }
            Schema<?> resolved = openApi.getComponents().getSchemas().get(ref.substring(SCHEMA_REF_PREFIX.length()));
            if (resolved == null) {
                return current;
            }
            current = resolved;
        }
        return current;
    }

    private String typeOf(Schema<?> schema, OpenAPI openApi) {
        Schema<?> resolved = resolveSchema(schema, openApi);
        if (resolved == null) {
            return null;
        }
        if (resolved.getType() != null) {
            return resolved.getType();
        }
        Set<String> types = resolved.getTypes();
        if (types != null) {
            return types.stream().filter(t -> !"null".equals(t)).findFirst().orElse(null);
        }
        return resolved.getProperties() != null ? "object" : null;
    }

    private Map<String, String> responses(Operation operation) {
        Map<String, String> responses = new LinkedHashMap<>();
        if (operation.getResponses() != null) {
            for (Map.Entry<String, ApiResponse> entry : operation.getResponses().entrySet()) {
                ApiResponse response = entry.getValue();
                responses.put(entry.getKey(), response != null && response.getDescription() != null ? response.getDescription() : "");
            }
        }
        return responses;
    }

    private List<String> securitySchemes(Operation operation, OpenAPI openApi) {
        List<SecurityRequirement> requirements = operation.getSecurity() != null ? operation.getSecurity() : openApi.getSecurity();
        Set<String> names = new LinkedHashSet<>();
        if (requirements != null) {
            requirements.forEach(requirement -> names.addAll(requirement.keySet()));
        }
        return new ArrayList<>(names);
    }

    /**
     * The first declared server, with server variables replaced by their defaults. A bare "/"
     * server, which the parser inserts when a document declares none, counts as absent.
     */
    private String baseUrl(OpenAPI openApi) {
        List<Server> servers = openApi.getServers();
        if (servers == null || servers.isEmpty() || servers.get(0).getUrl() == null) {
            return null;
        }
        Server server = servers.get(0);
        String url = server.getUrl().trim();
        if (server.getVariables() != null) {
            for (Map.Entry<String, ServerVariable> variable : server.getVariables().entrySet()) {
                if (variable.getValue() != null && variable.getValue().getDefault() != null) {
                    url = url.replace("{" + variable.getKey() + "}", variable.getValue().getDefault());
                }
            }
        }
        if (url.isEmpty() || "/".equals(url)) {
            return null;
        }
        return url;
    }
}
