package com.apichat.dto.llm.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A function invocation. The arguments travel as a JSON-encoded string, which the model may
 * have produced malformed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenAiFunctionCall {
    private String name;
    private String arguments;
}
