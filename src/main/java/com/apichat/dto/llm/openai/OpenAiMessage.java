package com.apichat.dto.llm.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a single message in a conversation with an OpenAI-compatible backend, in both
 * directions.
 * <p>
 * Lombok annotations are used to reduce boilerplate code.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenAiMessage {

    /**
     * The role of the author: "system", "user", "assistant" or "function".
     */
    private String role;

    /**
     * The text content; {@code null} for an assistant message that only requests a function.
     */
    private String content;

    /**
     * For "function" messages, the name of the function whose result this is.
     */
    private String name;

    @JsonProperty("function_call")
    private OpenAiFunctionCall functionCall;

    /**
     * Only read from responses: newer models may answer with tool calls instead of a function call.
     */
    @JsonProperty("tool_calls")
    private List<OpenAiToolCall> toolCalls;

    public OpenAiMessage(String role, String content) {
        this.role = role;
        this.content = content;
    }
}
