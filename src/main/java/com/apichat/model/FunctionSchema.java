package com.apichat.model;

/**
 * A callable unit exposed to a reasoning backend, compiled deterministically from one endpoint
 * and its overlay.
 *
 * @param name             Unique within one agent's function set.
 * @param description      Overlay description, else summary, else description, else "METHOD PATH".
 * @param parameters       The argument schema; never has an empty property set.
 * @param executionBinding Private link back to the endpoint. Provider adapters must not transmit it.
 */
public record FunctionSchema(String name,
                             String description,
                             ParameterSchema parameters,
                             ExecutionBinding executionBinding) {
}
