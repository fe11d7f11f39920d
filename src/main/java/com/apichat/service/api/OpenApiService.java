package com.apichat.service.api;

import com.apichat.model.ExtractionResult;
import io.swagger.v3.oas.models.OpenAPI;

public interface OpenApiService {

    /**
     * Loads an OpenAPI (3.x) or Swagger (2.0) description from a URL or local file path and
     * parses it into its tree form. Text parsing is delegated entirely to swagger-parser.
     *
     * @param source The URL or local file path of the description.
     * @return The parsed description tree.
     * @throws com.apichat.exception.ApiAgentException if the source cannot be read or parsed.
     */
    OpenAPI parse(String source);

    /**
     * Loads a description and extracts its endpoints into a document stored under the alias.
     *
     * @param alias  The id the extracted document will carry.
     * @param source The URL or local file path of the description.
     * @return The extracted document and the errors of any skipped path items.
     */
    ExtractionResult learn(String alias, String source);
}
