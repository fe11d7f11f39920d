package com.apichat.dto.response;

import com.apichat.model.ApiEndpoint;
import com.apichat.model.EndpointOverlay;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A read-only view of one endpoint together with the flags its overlay contributes.
 * Built field by field; the endpoint itself is never modified.
 *
 * @param parameters One line per parameter, e.g. {@code "id (in: path, required: true)"}.
 */
public record EndpointView(String id,
                           String operationKey,
                           String method,
                           String path,
                           String summary,
                           String description,
                           List<String> tags,
                           List<String> parameters,
                           boolean hasRequestBody,
                           boolean deprecated,
                           boolean enabled,
                           String customDescription) {

    public static EndpointView of(ApiEndpoint endpoint, EndpointOverlay overlay) {
        List<String> parameters = endpoint.parameters().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .flatMap(entry -> entry.getValue().stream()
                        .map(p -> p.name() + " (in: " + entry.getKey().name().toLowerCase(Locale.ROOT)
                                + ", required: " + p.required() + ")"))
                .toList();
        return new EndpointView(
                endpoint.id(),
                endpoint.operationKey(),
                endpoint.method().name(),
                endpoint.pathTemplate(),
                endpoint.summary(),
                endpoint.description(),
                endpoint.tags(),
                parameters,
                endpoint.requestBody() != null,
                endpoint.deprecated(),
                overlay == null || overlay.enabled(),
                overlay == null ? null : overlay.customDescription());
    }
}
