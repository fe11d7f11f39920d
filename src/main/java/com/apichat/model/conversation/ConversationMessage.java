package com.apichat.model.conversation;

/**
 * One entry of a {@link Conversation}. Assistant entries carry either text or a
 * {@link FunctionInvocation}; function-result entries name the function they answer.
 *
 * @param role         Who authored the message.
 * @param content      The text content, may be {@code null} for an assistant invocation.
 * @param invocation   The requested call for an assistant invocation turn, else {@code null}.
 * @param functionName For function-result turns, the function whose result this is.
 * @param callId       For function-result turns, the call id of the answered invocation.
 */
public record ConversationMessage(MessageRole role,
                                  String content,
                                  FunctionInvocation invocation,
                                  String functionName,
                                  String callId) {

    public static ConversationMessage system(String content) {
        return new ConversationMessage(MessageRole.SYSTEM, content, null, null, null);
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageRole.USER, content, null, null, null);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, null, null, null);
    }

    public static ConversationMessage assistantInvocation(String content, FunctionInvocation invocation) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, invocation, null, null);
    }

    public static ConversationMessage functionResult(FunctionInvocation invocation, String content) {
        return new ConversationMessage(MessageRole.FUNCTION_RESULT, content, null, invocation.name(), invocation.callId());
    }

    public boolean carriesInvocation() {
        return invocation != null;
    }
}
