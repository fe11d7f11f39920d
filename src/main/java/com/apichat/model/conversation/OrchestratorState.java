package com.apichat.model.conversation;

/**
 * The states of one chat exchange. The loop alternates between the first two until the backend
 * answers in text or the iteration ceiling is reached.
 */
public enum OrchestratorState {
    AWAITING_BACKEND,
    DISPATCHING,
    DONE
}
