package com.apichat.service.provider;

import com.apichat.exception.ApiAgentException;
import com.apichat.exception.BackendRejectedException;
import com.apichat.exception.BackendUnreachableException;
import com.apichat.exception.MissingCredentialException;
import com.apichat.util.NetworkFailures;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Shared transport for HTTP backends: one POST per turn, a uniform timeout, no retry, and the
 * translation of transport errors into the backend exception hierarchy.
 */
@Slf4j
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {

    private static final int ERROR_PREVIEW_LENGTH = 300;

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final Duration timeout;

    protected AbstractHttpProviderAdapter(WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    /**
     * A human readable backend name for messages, e.g. "OpenAI".
     */
    protected abstract String displayName();

    protected String unreachableMessage() {
        return "Could not connect to " + displayName() + ". Check your network connection and try again.";
    }

    protected void requireCredential(ProviderRequest request) {
        if (requiresCredential() && !request.hasCredential()) {
            throw new MissingCredentialException(providerId(),
                    displayName() + " API key required. Set one with 'backend-key --provider " + providerId() + "'.");
        }
    }

    /**
     * Posts {@code payload} as JSON and decodes the answer.
     *
     * @throws ApiAgentException for an empty or undecodable answer.
     */
    protected <T> T post(String endpoint, Consumer<HttpHeaders> headers, Object payload, Class<T> responseType) {
        log.debug("Sending request to {} at {}", displayName(), endpoint);
        T response;
        try {
            response = webClient.post()
                    .uri(endpoint)
                    .headers(headers)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(responseType)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("{} rejected the request with status {}", displayName(), status);
            throw new BackendRejectedException(providerId(), status,
                    displayName() + " rejected the request (HTTP " + status + "): " + preview(e.getResponseBodyAsString()), e);
        } catch (RuntimeException e) {
            if (NetworkFailures.isTimeout(e)) {
                throw new BackendUnreachableException(providerId(),
                        displayName() + " did not respond within " + timeout.toSeconds() + " seconds.", e);
            }
            if (NetworkFailures.isConnectionFailure(e)) {
                throw new BackendUnreachableException(providerId(), unreachableMessage(), e);
            }
            log.error("Error calling {}", displayName(), e);
            throw new ApiAgentException("An error occurred while communicating with " + displayName() + ".", e);
        }
        if (response == null) {
            throw new ApiAgentException("Received an empty response from " + displayName() + ".");
        }
        return response;
    }

    private static String preview(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        return body.length() > ERROR_PREVIEW_LENGTH ? body.substring(0, ERROR_PREVIEW_LENGTH) : body;
    }
}
