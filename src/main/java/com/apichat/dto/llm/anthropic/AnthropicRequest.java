package com.apichat.dto.llm.anthropic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/**
 * Represents a Messages API request. The system prompt travels in its own field instead of
 * being part of {@link #messages}.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnthropicRequest {

    private String model;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Double temperature;

    private String system;

    private List<AnthropicMessage> messages;

    private List<AnthropicTool> tools;
}
