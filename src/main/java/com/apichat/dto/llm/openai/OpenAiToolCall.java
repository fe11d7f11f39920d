package com.apichat.dto.llm.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenAiToolCall {
    private String id;
    private String type;
    private OpenAiFunctionCall function;
}
