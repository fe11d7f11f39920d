package com.apichat.dto.llm.anthropic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnthropicResponse {
    private String id;
    private String model;
    private List<AnthropicContentBlock> content;

    @JsonProperty("stop_reason")
    private String stopReason;
}
