package com.apichat.model.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, append-only message history for one chat exchange. Messages are never
 * replaced or edited; {@link #messages()} hands out a read-only view.
 */
public final class Conversation {

    private final List<ConversationMessage> messages = new ArrayList<>();

    public static Conversation seeded(String systemPreamble, String userMessage) {
        Conversation conversation = new Conversation();
        conversation.append(ConversationMessage.system(systemPreamble));
        conversation.append(ConversationMessage.user(userMessage));
        return conversation;
    }

    public Conversation append(ConversationMessage message) {
        messages.add(message);
        return this;
    }

    public List<ConversationMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<ConversationMessage> snapshot() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }
}
