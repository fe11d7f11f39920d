package com.apichat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The object schema describing a function's arguments. It serializes to the JSON Schema shape
 * {@code {"type":"object","properties":{...},"required":[...]}} that the reasoning backends expect.
 *
 * @param type       Always {@code "object"}.
 * @param properties Properties in insertion order (path, query, then body fields).
 * @param required   Names of the required properties.
 */
public record ParameterSchema(String type, Map<String, PropertySchema> properties, List<String> required) {

    public static final String OBJECT = "object";

    @JsonCreator
    public ParameterSchema {
        type = OBJECT;
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? List.of() : List.copyOf(required);
    }

    public ParameterSchema(Map<String, PropertySchema> properties, List<String> required) {
        this(OBJECT, properties, required);
    }
}
