package com.apichat.model;

/**
 * Links a {@link FunctionSchema} back to the endpoint it was compiled from. Never sent to a
 * reasoning backend.
 *
 * @param documentId The id of the owning {@link ApiDocument}.
 * @param endpointId The {@link ApiEndpoint#id()} inside that document.
 */
public record ExecutionBinding(String documentId, String endpointId) {
}
