package com.apichat.model;

/**
 * A per-operation customization applied when an agent is compiled. Absence of an overlay
 * means "enabled, use the endpoint's own summary or description".
 *
 * @param operationKey      The operationId (or derived function name) the overlay applies to.
 * @param customDescription Replaces the endpoint description in the function schema, may be {@code null}.
 * @param enabled           Whether the endpoint is compiled into agents.
 */
public record EndpointOverlay(String operationKey, String customDescription, boolean enabled) {

    public boolean hasCustomDescription() {
        return customDescription != null && !customDescription.isBlank();
    }
}
