package com.apichat.dto.llm.ollama;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Represents a request to a local Ollama chat endpoint. Streaming is always disabled.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OllamaChatRequest {
    private String model;
    private List<OllamaMessage> messages;
    private boolean stream = false;

    /**
     * Sampling options such as {@code temperature} and {@code num_predict}.
     */
    private Map<String, Object> options;
}
