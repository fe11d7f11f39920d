package com.apichat.dto.llm.openai;

import com.apichat.model.ParameterSchema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The native function descriptor: name, description and parameter schema, nothing else.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpenAiFunction {
    private String name;
    private String description;
    private ParameterSchema parameters;
}
