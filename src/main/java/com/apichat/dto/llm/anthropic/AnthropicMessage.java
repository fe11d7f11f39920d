package com.apichat.dto.llm.anthropic;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnthropicMessage {

    /**
     * Either "user" or "assistant". Tool results are sent as user messages.
     */
    private String role;

    private List<AnthropicContentBlock> content;
}
