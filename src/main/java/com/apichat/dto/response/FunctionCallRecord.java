package com.apichat.dto.response;

import java.util.Map;

/**
 * One function call attempted during a chat exchange.
 *
 * @param name           The requested function.
 * @param arguments      The arguments the backend supplied.
 * @param success        Whether the call produced a successful result.
 * @param durationMillis Wall-clock time of the execution.
 * @param error          The error message of a failed call, else {@code null}.
 */
public record FunctionCallRecord(String name,
                                 Map<String, Object> arguments,
                                 boolean success,
                                 long durationMillis,
                                 String error) {
}
