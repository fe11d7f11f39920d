package com.apichat.model.conversation;

/**
 * The neutral form of one backend response: free text, a function invocation, or both
 * (some backends send explanatory text next to a tool request).
 *
 * @param content    The text content, may be {@code null} or blank.
 * @param invocation The requested function call, or {@code null} for a terminal text reply.
 */
public record AssistantReply(String content, FunctionInvocation invocation) {

    public static AssistantReply text(String content) {
        return new AssistantReply(content, null);
    }

    public boolean requestsFunction() {
        return invocation != null;
    }

    public boolean hasText() {
        return content != null && !content.isBlank();
    }
}
