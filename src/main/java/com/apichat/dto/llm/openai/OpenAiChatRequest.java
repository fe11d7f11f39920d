package com.apichat.dto.llm.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/**
 * Represents a chat completion request payload for an OpenAI-compatible backend.
 * <p>
 * Functions are sent through the {@code functions} field with {@code function_call} set to
 * {@code "auto"}, so the model decides whether to answer in text or request a call.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenAiChatRequest {

    /**
     * The identifier of the model to be used for this request (e.g., "gpt-4-turbo").
     */
    private String model;

    /**
     * The conversation history in chronological order.
     */
    private List<OpenAiMessage> messages;

    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    /**
     * The callable functions. Omitted entirely when the agent exposes none.
     */
    private List<OpenAiFunction> functions;

    @JsonProperty("function_call")
    private String functionCall;
}
