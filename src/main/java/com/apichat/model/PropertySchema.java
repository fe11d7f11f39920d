package com.apichat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One property of a function's parameter schema, in the reduced type vocabulary
 * {@code string | number | boolean | array | object}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertySchema(String type,
                             String description,
                             @JsonProperty("enum") List<String> enumValues) {

    @JsonCreator
    public PropertySchema {
    }

    public PropertySchema(String type, String description) {
        this(type, description, null);
    }
}
