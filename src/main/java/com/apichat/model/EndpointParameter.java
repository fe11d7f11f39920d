package com.apichat.model;

/**
 * A single declared parameter of an {@link ApiEndpoint}.
 *
 * @param name        The parameter name as declared in the description document.
 * @param location    Where the parameter is sent.
 * @param required    Whether the description marks the parameter as required.
 * @param type        The primitive type from the source vocabulary (e.g. "integer"), may be {@code null}.
 * @param description Free text from the description document, may be {@code null}.
 */
public record EndpointParameter(String name,
                                ParameterLocation location,
                                boolean required,
                                String type,
                                String description) {
}
