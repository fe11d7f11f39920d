package com.apichat.service.impl;

import com.apichat.exception.ApiAgentException;
import com.apichat.model.ExtractionResult;
import com.apichat.service.api.OpenApiService;
import io.swagger.parser.OpenAPIParser;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OpenApiServiceImpl implements OpenApiService {

    private final EndpointExtractor endpointExtractor;

    public OpenApiServiceImpl(EndpointExtractor endpointExtractor) {
        this.endpointExtractor = endpointExtractor;
    }

    /**
     * {@inheritDoc}
     * This implementation uses swagger-parser, which also converts Swagger 2.0 documents to the
     * OpenAPI 3 model and resolves {@code $ref} references before extraction.
     */
    @Override
    public OpenAPI parse(String source) {
        log.info("Loading and parsing API description from: {}", source);
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(true);

        SwaggerParseResult result;
        try {
            result = new OpenAPIParser().readLocation(source, null, options);
        } catch (RuntimeException e) {
            throw new ApiAgentException("Failed to load the API description from the source: " + source, e);
        }
        if (result == null || result.getOpenAPI() == null) {
            String details = result != null && result.getMessages() != null ? String.join("; ", result.getMessages()) : "";
            throw new ApiAgentException("Failed to load or parse the API description from the source: " + source
                    + (details.isEmpty() ? "" : " (" + details + ")"));
        }
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.debug("Parser reported {} messages for {}: {}", result.getMessages().size(), source, result.getMessages());
        }
        return result.getOpenAPI();
    }

    @Override
    public ExtractionResult learn(String alias, String source) {
        return endpointExtractor.extract(alias, parse(source));
    }
}
