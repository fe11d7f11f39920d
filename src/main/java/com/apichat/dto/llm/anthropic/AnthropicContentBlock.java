package com.apichat.dto.llm.anthropic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * A content block of a message. Which fields are set depends on {@link #type}:
 * <ul>
 *   <li>{@code text}: {@link #text}</li>
 *   <li>{@code tool_use}: {@link #id}, {@link #name}, {@link #input}</li>
 *   <li>{@code tool_result}: {@link #toolUseId}, {@link #content}</li>
 * </ul>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnthropicContentBlock {

    public static final String TEXT = "text";
    public static final String TOOL_USE = "tool_use";
    public static final String TOOL_RESULT = "tool_result";

    private String type;
    private String text;
    private String id;
    private String name;
    private JsonNode input;

    @JsonProperty("tool_use_id")
    private String toolUseId;

    private String content;

    public static AnthropicContentBlock text(String text) {
        AnthropicContentBlock block = new AnthropicContentBlock();
        block.setType(TEXT);
        block.setText(text);
        return block;
    }

    public static AnthropicContentBlock toolUse(String id, String name, JsonNode input) {
        AnthropicContentBlock block = new AnthropicContentBlock();
        block.setType(TOOL_USE);
        block.setId(id);
        block.setName(name);
        block.setInput(input);
        return block;
    }

    public static AnthropicContentBlock toolResult(String toolUseId, String content) {
        AnthropicContentBlock block = new AnthropicContentBlock();
        block.setType(TOOL_RESULT);
        block.setToolUseId(toolUseId);
        block.setContent(content);
        return block;
    }
}
