package com.apichat.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of HTTP verbs an {@link ApiEndpoint} can be declared with.
 * The declaration order is the order in which operations of one path item are extracted.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    OPTIONS,
    HEAD;

    /**
     * Whether a request body is synthesized for this verb when a function is executed.
     *
     * @return {@code true} for POST, PUT and PATCH.
     */
    public boolean acceptsBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    /**
     * Resolves a verb case-insensitively.
     *
     * @param value The verb, e.g. "get" or "POST".
     * @return The matching verb, or an empty Optional for anything outside the fixed set.
     */
    public static Optional<HttpMethod> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(HttpMethod.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
