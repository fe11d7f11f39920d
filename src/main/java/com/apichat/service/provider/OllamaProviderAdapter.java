package com.apichat.service.provider;

import com.apichat.dto.llm.ollama.OllamaChatRequest;
import com.apichat.dto.llm.ollama.OllamaChatResponse;
import com.apichat.dto.llm.ollama.OllamaMessage;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.FunctionSchema;
import com.apichat.model.conversation.AssistantReply;
import com.apichat.model.conversation.ConversationMessage;
import com.apichat.model.conversation.MessageRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Adapter for a local Ollama server. Ollama models are not trusted with function calling here:
 * the function list is appended to the system prompt as plain text, and every reply is
 * treated as a final answer.
 */
@Component
@Slf4j
public class OllamaProviderAdapter extends AbstractHttpProviderAdapter {

    public static final String PROVIDER_ID = "ollama";

    static final String FUNCTIONS_HEADER = "\n\nAvailable functions:\n";
    static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful assistant.";

    private final String endpoint;

    public OllamaProviderAdapter(WebClient webClient,
                                 ObjectMapper objectMapper,
                                 @Value("${agent.llm.timeout:60s}") Duration timeout,
                                 @Value("${agent.llm.ollama.endpoint:http://localhost:11434/api/chat}") String endpoint) {
        super(webClient, objectMapper, timeout);
        this.endpoint = endpoint;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public ProviderCapability capability() {
        return ProviderCapability.PROMPT_INJECTION_ONLY;
    }

    @Override
    public boolean requiresCredential() {
        return false;
    }

    @Override
    protected String displayName() {
        return "Ollama";
    }

    @Override
    protected String unreachableMessage() {
        return "Could not connect to Ollama at " + endpoint + ". Make sure Ollama is running locally ('ollama serve').";
    }

    @Override
    public AssistantReply complete(ProviderRequest request) {
        OllamaChatRequest wireRequest = toWireRequest(request);
        log.info("Sending {} messages to Ollama model {} ({} functions described in the prompt)",
                wireRequest.getMessages().size(), request.model(), request.functions().size());
        OllamaChatResponse response = post(endpoint, headers -> { }, wireRequest, OllamaChatResponse.class);
        if (response.getMessage() == null) {
            throw new ApiAgentException("Received an empty or invalid response from Ollama.");
        }
        return AssistantReply.text(response.getMessage().getContent());
    }

    OllamaChatRequest toWireRequest(ProviderRequest request) {
        String functionText = describeFunctions(request.functions());
        List<OllamaMessage> messages = new ArrayList<>();
        boolean systemSeen = false;
        for (ConversationMessage message : request.messages()) {
            if (message.role() == MessageRole.SYSTEM && !systemSeen) {
                messages.add(new OllamaMessage("system", message.content() + functionText));
                systemSeen = true;
            } else {
                messages.add(new OllamaMessage(roleOf(message.role()), message.content() == null ? "" : message.content()));
            }
        }
        if (!systemSeen && !functionText.isEmpty()) {
            messages.add(0, new OllamaMessage("system", DEFAULT_SYSTEM_PROMPT + functionText));
        }

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", request.temperature());
        options.put("num_predict", request.maxTokens());

        OllamaChatRequest wireRequest = new OllamaChatRequest();
        wireRequest.setModel(request.model());
        wireRequest.setMessages(messages);
        wireRequest.setStream(false);
        wireRequest.setOptions(options);
        return wireRequest;
    }

    static String describeFunctions(List<FunctionSchema> functions) {
        if (functions.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder(FUNCTIONS_HEADER);
        for (FunctionSchema function : functions) {
            text.append("\n- ").append(function.name()).append(": ").append(function.description());
        }
        return text.toString();
    }

    private static String roleOf(MessageRole role) {
        switch (role) {
            case SYSTEM:
                return "system";
            case ASSISTANT:
                return "assistant";
            case FUNCTION_RESULT:
                return "tool";
            case USER:
            default:
                return "user";
        }
    }
}
