package com.apichat.model;

/**
 * Reasoning backend settings of an agent.
 *
 * @param provider    The provider id, e.g. "openai", "anthropic" or "ollama".
 * @param model       The model name passed to the backend.
 * @param temperature Sampling temperature between 0.0 and 1.0.
 * @param maxTokens   Upper bound of tokens the backend may generate per turn.
 */
public record AgentProfile(String provider, String model, double temperature, int maxTokens) {

    public static AgentProfile defaults() {
        return new AgentProfile("openai", "gpt-4-turbo-preview", 0.7, 4096);
    }
}
