package com.apichat.model.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A backend's request to call one function.
 *
 * @param callId    The backend-assigned id of the call, or a generated one when the backend has none.
 *                  Tool-use backends need it to pair the result with the request.
 * @param name      The requested function name.
 * @param arguments The decoded arguments; empty when the backend sent malformed JSON.
 */
public record FunctionInvocation(String callId, String name, Map<String, Object> arguments) {

    public FunctionInvocation {
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
