package com.apichat.model.conversation;

/**
 * The author of a {@link ConversationMessage}.
 */
public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    FUNCTION_RESULT
}
