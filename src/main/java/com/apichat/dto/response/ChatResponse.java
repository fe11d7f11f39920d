package com.apichat.dto.response;

import com.apichat.model.conversation.ConversationMessage;
import java.util.List;

/**
 * The outcome of one chat exchange.
 *
 * @param message        The final assistant text.
 * @param conversationId A generated id for correlating log lines.
 * @param functionCalls  Function calls in the order they were attempted.
 * @param apiCalls       HTTP requests in the order they were issued.
 * @param iterations     Number of function dispatches performed.
 * @param transcript     The full conversation, ending with the final assistant message.
 */
public record ChatResponse(String message,
                           String conversationId,
                           List<FunctionCallRecord> functionCalls,
                           List<ApiCallRecord> apiCalls,
                           int iterations,
                           List<ConversationMessage> transcript) {

    public ChatResponse {
        functionCalls = List.copyOf(functionCalls);
        apiCalls = List.copyOf(apiCalls);
        transcript = List.copyOf(transcript);
    }
}
