package com.apichat.cli;

import com.apichat.dto.request.BackendKeyRequest;
import com.apichat.dto.response.CommandResponse;
import com.apichat.exception.ApiAgentException;
import com.apichat.service.api.StateService;
import com.apichat.service.provider.ProviderAdapter;
import com.apichat.service.provider.ProviderRegistry;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Stores reasoning backend credentials.
 */
@ShellComponent
public class AuthCommand {

    private final StateService stateService;
    private final ProviderRegistry providerRegistry;

    public AuthCommand(StateService stateService, ProviderRegistry providerRegistry) {
        this.stateService = stateService;
        this.providerRegistry = providerRegistry;
    }

    /**
     * Saves the API key of a backend. The key is encrypted before it is written to disk.
     *
     * @param provider The backend id, e.g. "openai".
     * @param key      The API key.
     * @return A colored confirmation.
     */
    @ShellMethod(key = "backend-key", value = "Store the API key of a reasoning backend.")
    public String backendKey(
            @ShellOption(help = "The backend: openai, anthropic or ollama.") String provider,
            @ShellOption(help = "The API key.") String key
    ) {
        var request = new BackendKeyRequest(provider, key);
        try {
            ProviderAdapter adapter = providerRegistry.get(request.provider());
            if (!adapter.requiresCredential()) {
                return CommandResponse.error("Backend '" + adapter.providerId() + "' does not use an API key.").toAnsiString();
            }
            stateService.saveBackendCredential(adapter.providerId(), request.key());
            return CommandResponse.ok("Saved API key for backend '" + adapter.providerId() + "'.").toAnsiString();
        } catch (ApiAgentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }
}
