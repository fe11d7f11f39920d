package com.apichat.model;

import java.util.List;

/**
 * The request body of an {@link ApiEndpoint}, reduced to the first supported content type.
 * Only the flat, top-level properties of the body schema are kept; nested or array bodies
 * have an empty property list.
 *
 * @param contentType The content type the schema was read from (e.g. "application/json").
 * @param required    Whether the body itself is required.
 * @param description The body description, may be {@code null}.
 * @param properties  The flat properties of the body schema, in declaration order.
 */
public record RequestBodyModel(String contentType,
                               boolean required,
                               String description,
                               List<BodyProperty> properties) {

    public RequestBodyModel {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public boolean hasProperties() {
        return !properties.isEmpty();
    }
}
