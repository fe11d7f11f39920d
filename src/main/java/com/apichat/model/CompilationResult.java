package com.apichat.model;

import java.util.List;

/**
 * The outcome of compiling a document into an agent. A successful result may still carry
 * non-fatal errors (skipped endpoints, renamed colliding functions).
 *
 * @param success Whether an agent was produced.
 * @param message A one-line summary.
 * @param agent   The compiled agent, {@code null} when {@code success} is false.
 * @param errors  Accumulated compilation errors.
 */
public record CompilationResult(boolean success, String message, CompiledAgent agent, List<String> errors) {

    public CompilationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CompilationResult failure(String message, List<String> errors) {
        return new CompilationResult(false, message, null, errors);
    }
}
