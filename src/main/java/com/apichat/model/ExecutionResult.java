package com.apichat.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * The normalized outcome of one function execution. Every failure mode of the execution engine
 * is encoded here; nothing is thrown past the engine.
 * <p>
 * A 4xx/5xx answer is not exceptional: {@code success} is false, but {@code body} still carries
 * the parsed error payload when the remote API sent one.
 */
@Value
@Builder
public class ExecutionResult {

    boolean success;

    /**
     * The HTTP status, 408 for a timeout and 0 when no response was received.
     */
    int statusCode;

    String url;

    String method;

    /**
     * Parsed JSON when the response was structured, a text node for anything else,
     * {@code null} when there was no response body.
     */
    JsonNode body;

    String errorMessage;

    @Builder.Default
    FailureType failureType = FailureType.NONE;

    public boolean isStructured() {
        return body != null && body.isContainerNode();
    }

    /**
     * True when an HTTP request actually left the process, whether or not it got an answer.
     */
    public boolean wasDispatched() {
        return url != null && failureType != FailureType.MALFORMED_REQUEST
                && failureType != FailureType.FUNCTION_NOT_FOUND
                && failureType != FailureType.BINDING_MISSING;
    }

    public static ExecutionResult failure(FailureType type, int statusCode, String method, String url, String message) {
        return ExecutionResult.builder()
                .success(false)
                .failureType(type)
                .statusCode(statusCode)
                .method(method)
                .url(url)
                .errorMessage(message)
                .build();
    }
}
