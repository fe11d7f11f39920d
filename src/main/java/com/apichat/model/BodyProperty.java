package com.apichat.model;

/**
 * A top-level property of a request body schema.
 *
 * @param name        The property name.
 * @param type        The declared type, may be {@code null}.
 * @param description The declared description, may be {@code null}.
 */
public record BodyProperty(String name, String type, String description) {
}
