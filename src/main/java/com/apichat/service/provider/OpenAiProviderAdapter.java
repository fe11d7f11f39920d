package com.apichat.service.provider;

import com.apichat.dto.llm.openai.OpenAiChatRequest;
import com.apichat.dto.llm.openai.OpenAiChatResponse;
import com.apichat.dto.llm.openai.OpenAiFunction;
import com.apichat.dto.llm.openai.OpenAiFunctionCall;
import com.apichat.dto.llm.openai.OpenAiMessage;
import com.apichat.dto.llm.openai.OpenAiToolCall;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.FunctionSchema;
import com.apichat.model.conversation.AssistantReply;
import com.apichat.model.conversation.ConversationMessage;
import com.apichat.model.conversation.FunctionInvocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Adapter for OpenAI-compatible chat completion backends with native function calling.
 * <p>
 * Assistant invocations are replayed as {@code function_call} messages with JSON-string
 * arguments, and results as {@code function} role messages carrying the function name.
 */
@Component
@Slf4j
public class OpenAiProviderAdapter extends AbstractHttpProviderAdapter {

    public static final String PROVIDER_ID = "openai";

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final String endpoint;

    public OpenAiProviderAdapter(WebClient webClient,
                                 ObjectMapper objectMapper,
                                 @Value("${agent.llm.timeout:60s}") Duration timeout,
                                 @Value("${agent.llm.openai.endpoint:https://api.openai.com/v1/chat/completions}") String endpoint) {
        super(webClient, objectMapper, timeout);
        this.endpoint = endpoint;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public ProviderCapability capability() {
        return ProviderCapability.NATIVE_FUNCTION_CALLING;
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    @Override
    protected String displayName() {
        return "OpenAI";
    }

    @Override
    public AssistantReply complete(ProviderRequest request) {
        requireCredential(request);
        OpenAiChatRequest wireRequest = toWireRequest(request);
        log.info("Sending {} messages and {} functions to OpenAI model {}",
                wireRequest.getMessages().size(), request.functions().size(), request.model());
        OpenAiChatResponse response = post(endpoint,
                headers -> headers.setBearerAuth(request.credential()),
                wireRequest,
                OpenAiChatResponse.class);
        return fromWireResponse(response);
    }

    OpenAiChatRequest toWireRequest(ProviderRequest request) {
        OpenAiChatRequest wireRequest = new OpenAiChatRequest();
        wireRequest.setModel(request.model());
        wireRequest.setTemperature(request.temperature());
        wireRequest.setMaxTokens(request.maxTokens());
        wireRequest.setMessages(request.messages().stream().map(this::toWireMessage).toList());
        if (!request.functions().isEmpty()) {
            wireRequest.setFunctions(request.functions().stream().map(OpenAiProviderAdapter::toWireFunction).toList());
            wireRequest.setFunctionCall("auto");
        }
        return wireRequest;
    }

    private static OpenAiFunction toWireFunction(FunctionSchema function) {
        return new OpenAiFunction(function.name(), function.description(), function.parameters());
    }

    private OpenAiMessage toWireMessage(ConversationMessage message) {
        switch (message.role()) {
            case SYSTEM:
                return new OpenAiMessage("system", message.content());
            case USER:
                return new OpenAiMessage("user", message.content());
            case FUNCTION_RESULT:
                OpenAiMessage result = new OpenAiMessage("function", message.content());
                result.setName(message.functionName());
                return result;
            case ASSISTANT:
            default:
                OpenAiMessage assistant = new OpenAiMessage("assistant", message.content());
                if (message.carriesInvocation()) {
                    FunctionInvocation invocation = message.invocation();
                    assistant.setFunctionCall(new OpenAiFunctionCall(invocation.name(), encodeArguments(invocation.arguments())));
                }
                return assistant;
        }
    }

    AssistantReply fromWireResponse(OpenAiChatResponse response) {
        if (response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null) {
            throw new ApiAgentException("Received an empty or invalid response from OpenAI.");
        }
        OpenAiMessage message = response.getChoices().get(0).getMessage();

        if (message.getFunctionCall() != null) {
            OpenAiFunctionCall call = message.getFunctionCall();
            String callId = "call_" + UUID.randomUUID();
            return new AssistantReply(message.getContent(),
                    new FunctionInvocation(callId, call.getName(), parseArguments(call.getArguments())));
        }
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            if (message.getToolCalls().size() > 1) {
                log.warn("OpenAI requested {} tool calls in one turn; only the first is executed", message.getToolCalls().size());
            }
            OpenAiToolCall toolCall = message.getToolCalls().get(0);
            String callId = toolCall.getId() != null ? toolCall.getId() : "call_" + UUID.randomUUID();
            OpenAiFunctionCall call = toolCall.getFunction();
            return new AssistantReply(message.getContent(),
                    new FunctionInvocation(callId, call.getName(), parseArguments(call.getArguments())));
        }
        return AssistantReply.text(message.getContent());
    }

    /**
     * Decodes the model's argument string. Anything that is not a JSON object becomes an empty
     * argument map; the remote API then reports what is missing.
     */
    Map<String, Object> parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(rawArguments);
            if (node == null || !node.isObject()) {
                log.warn("Function arguments are not a JSON object, using no arguments: {}", rawArguments);
                return Map.of();
            }
            return objectMapper.convertValue(node, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Malformed function arguments from OpenAI, using no arguments: {}", rawArguments);
            return Map.of();
        }
    }

    private String encodeArguments(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new ApiAgentException("Failed to encode function arguments for OpenAI.", e);
        }
    }
}
