package com.apichat.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Where a parameter travels in the synthesized HTTP request.
 */
public enum ParameterLocation {
    PATH,
    QUERY,
    HEADER,
    COOKIE;

    /**
     * Maps the {@code in} value of an API description parameter to a location.
     *
     * @param in The declared location, e.g. "query".
     * @return The location, or an empty Optional for an unrecognized value.
     */
    public static Optional<ParameterLocation> fromString(String in) {
        if (in == null) {
            return Optional.empty();
        }
        return switch (in.trim().toLowerCase(Locale.ROOT)) {
            case "path" -> Optional.of(PATH);
            case "query" -> Optional.of(QUERY);
            case "header" -> Optional.of(HEADER);
            case "cookie" -> Optional.of(COOKIE);
            default -> Optional.empty();
        };
    }
}
