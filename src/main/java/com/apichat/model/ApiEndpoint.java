package com.apichat.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The normalized, immutable representation of one remote operation, extracted from an
 * API description document. Downstream components never look at the raw document again.
 *
 * @param id            A stable identifier inside the owning document ("GET /pets/{id}").
 * @param operationId   The declared {@code operationId}, or {@code null} when the document has none.
 * @param method        The HTTP verb.
 * @param pathTemplate  The path with {@code {name}} placeholders.
 * @param summary       Short summary, may be {@code null}.
 * @param description   Long description, may be {@code null}.
 * @param parameters    Declared parameters grouped by location; every location is present.
 * @param requestBody   The request body, or {@code null} when the operation declares none.
 * @param responses     Status code to response description. Informational only.
 * @param security      Names of the security schemes the operation requires.
 * @param tags          Declared tags.
 * @param deprecated    Whether the operation is marked deprecated.
 */
public record ApiEndpoint(String id,
                          String operationId,
                          HttpMethod method,
                          String pathTemplate,
                          String summary,
                          String description,
                          Map<ParameterLocation, List<EndpointParameter>> parameters,
                          RequestBodyModel requestBody,
                          Map<String, String> responses,
                          List<String> security,
                          List<String> tags,
                          boolean deprecated) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");

    public ApiEndpoint {
        Map<ParameterLocation, List<EndpointParameter>> grouped = new EnumMap<>(ParameterLocation.class);
        for (ParameterLocation location : ParameterLocation.values()) {
            List<EndpointParameter> declared = parameters == null ? null : parameters.get(location);
            grouped.put(location, declared == null ? List.of() : List.copyOf(declared));
        }
        parameters = Map.copyOf(grouped);
        responses = responses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(responses));
        security = security == null ? List.of() : List.copyOf(security);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static String idOf(HttpMethod method, String pathTemplate) {
        return method.name() + " " + pathTemplate;
    }

    public List<EndpointParameter> parametersIn(ParameterLocation location) {
        return parameters.get(location);
    }

    /**
     * Lists the placeholder names of the path template in order of appearance.
     *
     * @return e.g. {@code ["ownerId", "petId"]} for {@code /owners/{ownerId}/pets/{petId}}.
     */
    public List<String> pathPlaceholders() {
        Matcher matcher = PLACEHOLDER.matcher(pathTemplate);
        List<String> names = new ArrayList<>();
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    public boolean hasOperationId() {
        return operationId != null && !operationId.isBlank();
    }

    /**
     * The key this endpoint is known by: its declared operationId, or the name derived from
     * method and path when the document declares none. Overlays and function names use it.
     */
    public String operationKey() {
        return hasOperationId() ? operationId : deriveOperationId(method, pathTemplate);
    }

    /**
     * Derives an identifier from method and path: the lower-cased method, then every path segment
     * joined with underscores, with each {@code {param}} placeholder written as {@code by_param}.
     * <p>
     * {@code GET /pets/{id}} becomes {@code get_pets_by_id}.
     */
    public static String deriveOperationId(HttpMethod method, String pathTemplate) {
        List<String> parts = new ArrayList<>();
        for (String segment : pathTemplate.split("/")) {
            if (segment.isBlank()) {
                continue;
            }
            Matcher matcher = PLACEHOLDER.matcher(segment);
            parts.add(matcher.replaceAll("by_$1"));
        }
        String joined = parts.isEmpty() ? "root" : String.join("_", parts);
        String name = method.name().toLowerCase(Locale.ROOT) + "_" + joined;
        return name.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
