package com.apichat.model;

import java.util.List;

/**
 * The outcome of extracting endpoints from a parsed description document. Malformed path
 * items are skipped, so a document can come back with a partial endpoint list and errors.
 *
 * @param document The document with every endpoint that could be extracted.
 * @param errors   One message per skipped path item.
 */
public record ExtractionResult(ApiDocument document, List<String> errors) {

    public ExtractionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
