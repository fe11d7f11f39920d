package com.apichat.dto.request;

/**
 * The data required to learn an API from its description document.
 *
 * @param alias  A user-defined, unique alias; becomes the document id.
 * @param source The URL or local file path of the OpenAPI or Swagger document.
 */
public record LearnApiRequest(String alias, String source) {
}
