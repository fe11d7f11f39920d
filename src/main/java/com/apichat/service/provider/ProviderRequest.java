package com.apichat.service.provider;

import com.apichat.model.AgentProfile;
import com.apichat.model.FunctionSchema;
import com.apichat.model.conversation.ConversationMessage;
import java.util.List;

/**
 * Everything one backend turn needs, in neutral form.
 *
 * @param model       The backend model name.
 * @param temperature Sampling temperature.
 * @param maxTokens   Generation limit for this turn.
 * @param credential  The backend key, {@code null} when none is configured.
 * @param messages    The full conversation so far, starting with the system preamble.
 * @param functions   The callable functions; their execution bindings are never transmitted.
 */
public record ProviderRequest(String model,
                              double temperature,
                              int maxTokens,
                              String credential,
                              List<ConversationMessage> messages,
                              List<FunctionSchema> functions) {

    public ProviderRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public static ProviderRequest of(AgentProfile profile,
                                     String credential,
                                     List<ConversationMessage> messages,
                                     List<FunctionSchema> functions) {
        return new ProviderRequest(profile.model(), profile.temperature(), profile.maxTokens(),
                credential, messages, functions);
    }

    public boolean hasCredential() {
        return credential != null && !credential.isBlank();
    }
}
