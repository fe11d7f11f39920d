package com.apichat.dto.request;

/**
 * A reasoning backend credential to be stored encrypted.
 *
 * @param provider The backend id, e.g. "openai" or "anthropic".
 * @param key      The API key.
 */
public record BackendKeyRequest(String provider, String key) {
}
