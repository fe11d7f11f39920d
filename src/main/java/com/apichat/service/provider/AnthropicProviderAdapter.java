package com.apichat.service.provider;

import com.apichat.dto.llm.anthropic.AnthropicContentBlock;
import com.apichat.dto.llm.anthropic.AnthropicMessage;
import com.apichat.dto.llm.anthropic.AnthropicRequest;
import com.apichat.dto.llm.anthropic.AnthropicResponse;
import com.apichat.dto.llm.anthropic.AnthropicTool;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.conversation.AssistantReply;
import com.apichat.model.conversation.ConversationMessage;
import com.apichat.model.conversation.FunctionInvocation;
import com.apichat.model.conversation.MessageRole;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Adapter for the Anthropic Messages API with tool use.
 * <p>
 * The system preamble moves to the request's {@code system} field. An assistant invocation is
 * replayed as a {@code tool_use} block and its result as a user {@code tool_result} block with
 * the same id. Only the first {@code tool_use} block of a reply is honored.
 */
@Component
@Slf4j
public class AnthropicProviderAdapter extends AbstractHttpProviderAdapter {

    public static final String PROVIDER_ID = "anthropic";

    private static final TypeReference<LinkedHashMap<String, Object>> INPUT_TYPE = new TypeReference<>() {
    };

    private final String endpoint;
    private final String apiVersion;

    public AnthropicProviderAdapter(WebClient webClient,
                                    ObjectMapper objectMapper,
                                    @Value("${agent.llm.timeout:60s}") Duration timeout,
                                    @Value("${agent.llm.anthropic.endpoint:https://api.anthropic.com/v1/messages}") String endpoint,
                                    @Value("${agent.llm.anthropic.version:2023-06-01}") String apiVersion) {
        super(webClient, objectMapper, timeout);
        this.endpoint = endpoint;
        this.apiVersion = apiVersion;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public ProviderCapability capability() {
        return ProviderCapability.TOOL_USE;
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    @Override
    protected String displayName() {
        return "Anthropic";
    }

    @Override
    public AssistantReply complete(ProviderRequest request) {
        requireCredential(request);
        AnthropicRequest wireRequest = toWireRequest(request);
        log.info("Sending {} messages and {} tools to Anthropic model {}",
                wireRequest.getMessages().size(), request.functions().size(), request.model());
        AnthropicResponse response = post(endpoint,
                headers -> {
                    headers.set("x-api-key", request.credential());
                    headers.set("anthropic-version", apiVersion);
                },
                wireRequest,
                AnthropicResponse.class);
        return fromWireResponse(response);
    }

    AnthropicRequest toWireRequest(ProviderRequest request) {
        AnthropicRequest wireRequest = new AnthropicRequest();
        wireRequest.setModel(request.model());
        wireRequest.setMaxTokens(request.maxTokens());
        wireRequest.setTemperature(request.temperature());

        String system = request.messages().stream()
                .filter(m -> m.role() == MessageRole.SYSTEM)
                .map(ConversationMessage::content)
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            wireRequest.setSystem(system);
        }

        List<AnthropicMessage> messages = new ArrayList<>();
        for (ConversationMessage message : request.messages()) {
            if (message.role() != MessageRole.SYSTEM) {
                messages.add(toWireMessage(message));
            }
        }
        wireRequest.setMessages(messages);

        if (!request.functions().isEmpty()) {
            wireRequest.setTools(request.functions().stream()
                    .map(f -> new AnthropicTool(f.name(), f.description(), f.parameters()))
                    .toList());
        }
        return wireRequest;
    }

    private AnthropicMessage toWireMessage(ConversationMessage message) {
        switch (message.role()) {
            case FUNCTION_RESULT:
                return new AnthropicMessage("user",
                        List.of(AnthropicContentBlock.toolResult(message.callId(), message.content())));
            case ASSISTANT:
                List<AnthropicContentBlock> blocks = new ArrayList<>();
                if (message.content() != null && !message.content().isBlank()) {
                    blocks.add(AnthropicContentBlock.text(message.content()));
                }
                if (message.carriesInvocation()) {
                    FunctionInvocation invocation = message.invocation();
                    JsonNode input = objectMapper.valueToTree(invocation.arguments());
                    blocks.add(AnthropicContentBlock.toolUse(invocation.callId(), invocation.name(), input));
                }
                return new AnthropicMessage("assistant", blocks);
            case USER:
            default:
                return new AnthropicMessage("user", List.of(AnthropicContentBlock.text(message.content())));
        }
    }

    AssistantReply fromWireResponse(AnthropicResponse response) {
        if (response.getContent() == null) {
            throw new ApiAgentException("Received an empty or invalid response from Anthropic.");
        }
        StringBuilder text = new StringBuilder();
        FunctionInvocation invocation = null;
        for (AnthropicContentBlock block : response.getContent()) {
            if (AnthropicContentBlock.TEXT.equals(block.getType()) && block.getText() != null) {
                text.append(block.getText());
            } else if (AnthropicContentBlock.TOOL_USE.equals(block.getType())) {
                if (invocation == null) {
                    invocation = new FunctionInvocation(block.getId(), block.getName(), toArguments(block.getInput()));
                } else {
                    log.warn("Ignoring additional tool_use block '{}'; only the first is executed", block.getName());
                }
            }
        }
        return new AssistantReply(text.toString(), invocation);
    }

    private Map<String, Object> toArguments(JsonNode input) {
        if (input == null || !input.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(input, INPUT_TYPE);
    }
}
