package com.apichat.model;

import java.util.List;
import java.util.Optional;

/**
 * A learned API description document together with the endpoints extracted from it.
 *
 * @param id             The alias the document was learned under; execution bindings refer to it.
 * @param title          The API title from the {@code info} block.
 * @param description    The API description, may be {@code null}.
 * @param version        The API version from the {@code info} block, may be {@code null}.
 * @param openApiVersion The OpenAPI/Swagger version of the source document, may be {@code null}.
 * @param baseUrl        The first declared server URL, or {@code null} when none is configured.
 * @param endpoints      The extracted endpoints, in document order.
 */
public record ApiDocument(String id,
                          String title,
                          String description,
                          String version,
                          String openApiVersion,
                          String baseUrl,
                          List<ApiEndpoint> endpoints) {

    public ApiDocument {
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
    }

    public Optional<ApiEndpoint> findEndpoint(String endpointId) {
        return endpoints.stream().filter(e -> e.id().equals(endpointId)).findFirst();
    }

    public boolean hasBaseUrl() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
