package com.apichat.service.api;

import com.apichat.dto.response.ChatResponse;
import com.apichat.model.CompiledAgent;

public interface ConversationService {

    /**
     * Runs one bounded chat exchange: the agent's backend is asked for a reply, requested
     * functions are executed and their results fed back, until the backend answers in text or
     * the iteration ceiling is reached.
     *
     * @param agent       The compiled agent.
     * @param userMessage The user's message.
     * @param credential  The decrypted backend key, {@code null} when none is stored.
     * @return The final text together with the function and API call records.
     * @throws com.apichat.exception.MissingCredentialException  if the backend needs a key and none was given.
     * @throws com.apichat.exception.BackendUnreachableException if the backend cannot be reached.
     * @throws com.apichat.exception.BackendRejectedException    if the backend refuses a request.
     * @throws com.apichat.exception.UnknownProviderException    if the agent names an unknown backend.
     * @throws com.apichat.exception.ApiAgentException           if the agent is not active.
     */
    ChatResponse chat(CompiledAgent agent, String userMessage, String credential);
}
