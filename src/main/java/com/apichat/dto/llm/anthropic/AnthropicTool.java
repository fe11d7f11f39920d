package com.apichat.dto.llm.anthropic;

import com.apichat.model.ParameterSchema;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnthropicTool {
    private String name;
    private String description;

    @JsonProperty("input_schema")
    private ParameterSchema inputSchema;
}
