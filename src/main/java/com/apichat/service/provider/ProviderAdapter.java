package com.apichat.service.provider;

import com.apichat.exception.BackendRejectedException;
import com.apichat.exception.BackendUnreachableException;
import com.apichat.exception.MissingCredentialException;
import com.apichat.model.conversation.AssistantReply;

/**
 * Translates between the neutral conversation model and one reasoning backend's wire format.
 * <p>
 * Implementations are stateless; the same adapter serves every conversation.
 */
public interface ProviderAdapter {

    /**
     * The id agents select this backend by, e.g. "openai".
     */
    String providerId();

    ProviderCapability capability();

    boolean requiresCredential();

    /**
     * Sends the conversation and functions to the backend and normalizes its answer.
     *
     * @param request The neutral request.
     * @return The backend's reply: text, a function invocation, or both.
     * @throws MissingCredentialException  if a credential is required and none was supplied.
     *                                     No network call is made in that case.
     * @throws BackendUnreachableException if the backend cannot be reached or times out.
     * @throws BackendRejectedException    if the backend answers with a non-2xx status.
     */
    AssistantReply complete(ProviderRequest request);
}
