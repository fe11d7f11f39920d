package com.apichat.cli;

import com.apichat.dto.request.LearnApiRequest;
import com.apichat.dto.response.CommandResponse;
import com.apichat.model.ExtractionResult;
import com.apichat.service.api.OpenApiService;
import com.apichat.service.api.StateService;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Learns an API from its OpenAPI or Swagger description and stores the extracted endpoints
 * under an alias.
 */
@ShellComponent
public class LearnCommand {

    private final OpenApiService openApiService;
    private final StateService stateService;

    public LearnCommand(OpenApiService openApiService, StateService stateService) {
        this.openApiService = openApiService;
        this.stateService = stateService;
    }

    /**
     * Loads the description, extracts its endpoints and saves the document. Path items that
     * could not be extracted are listed as warnings; the rest of the document is still learned.
     *
     * @param alias  The alias the API is referred to by in later commands.
     * @param source The URL or file path of the description.
     * @return A colored summary.
     */
    @ShellMethod(key = "learn", value = "Learns an API from an OpenAPI or Swagger description.")
    public String learn(
            @ShellOption(help = "A unique alias for this API.") String alias,
            @ShellOption(help = "The URL or file path of the OpenAPI description.") String source
    ) {
        var request = new LearnApiRequest(alias, source);
        try {
            ExtractionResult result = openApiService.learn(request.alias(), request.source());
            stateService.saveDocument(result.document());

            StringBuilder message = new StringBuilder("Successfully learned API '")
                    .append(request.alias()).append("' (")
                    .append(result.document().title()).append(", ")
                    .append(result.document().endpoints().size()).append(" endpoints).");
            if (!result.document().hasBaseUrl()) {
                message.append("\nWarning: the description declares no server URL; calls cannot be executed.");
            }
            result.errors().forEach(error -> message.append("\nWarning: ").append(error));
            return CommandResponse.ok(message.toString()).toAnsiString();
        } catch (Exception e) {
            return CommandResponse.error("Failed to learn API: " + e.getMessage()).toAnsiString();
        }
    }
}
