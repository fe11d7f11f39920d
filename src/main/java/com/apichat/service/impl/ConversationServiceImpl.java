package com.apichat.service.impl;

import com.apichat.dto.response.ApiCallRecord;
import com.apichat.dto.response.ChatResponse;
import com.apichat.dto.response.FunctionCallRecord;
import com.apichat.exception.ApiAgentException;
import com.apichat.model.CompiledAgent;
import com.apichat.model.ExecutionResult;
import com.apichat.model.FailureType;
import com.apichat.model.conversation.AssistantReply;
import com.apichat.model.conversation.Conversation;
import com.apichat.model.conversation.ConversationMessage;
import com.apichat.model.conversation.FunctionInvocation;
import com.apichat.model.conversation.OrchestratorState;
import com.apichat.service.api.ConversationService;
import com.apichat.service.api.ExecutionEngine;
import com.apichat.service.provider.ProviderAdapter;
import com.apichat.service.provider.ProviderCapability;
import com.apichat.service.provider.ProviderRegistry;
import com.apichat.service.provider.ProviderRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Drives the turn loop between a reasoning backend and the execution engine.
 * <p>
 * Each exchange starts with the agent's preamble and the user message. Turns are strictly
 * sequential. At most {@code maxIterations} functions are dispatched per exchange, so the
 * backend is called at most {@code maxIterations + 1} times. Backend failures propagate to the
 * caller; function failures are written into the conversation for the backend to handle.
 */
@Service
@Slf4j
public class ConversationServiceImpl implements ConversationService {

    static final String FALLBACK_MESSAGE = "I completed the action but couldn't generate a response.";

    private final ProviderRegistry providerRegistry;
    private final ExecutionEngine executionEngine;
    private final int maxIterations;

    public ConversationServiceImpl(ProviderRegistry providerRegistry,
                                   ExecutionEngine executionEngine,
                                   @Value("${agent.orchestrator.max-iterations:10}") int maxIterations) {
        this.providerRegistry = providerRegistry;
        this.executionEngine = executionEngine;
        this.maxIterations = maxIterations;
    }

    @Override
    public ChatResponse chat(CompiledAgent agent, String userMessage, String credential) {
        if (!agent.active()) {
            throw new ApiAgentException("Agent '" + agent.name() + "' is not active. Use 'agent-activate' to enable it.");
        }
        ProviderAdapter adapter = providerRegistry.get(agent.profile().provider());
        String conversationId = UUID.randomUUID().toString();
        log.info("[{}] Starting chat with agent '{}' on {} ({})", conversationId, agent.name(),
                adapter.providerId(), agent.profile().model());
        if (adapter.capability() == ProviderCapability.PROMPT_INJECTION_ONLY) {
            log.info("[{}] Backend '{}' cannot call functions; the agent can describe operations but not execute them",
                    conversationId, adapter.providerId());
        }

        Conversation conversation = Conversation.seeded(agent.systemPreamble(), userMessage);
        List<FunctionCallRecord> functionCalls = new ArrayList<>();
        List<ApiCallRecord> apiCalls = new ArrayList<>();
        OrchestratorState state = OrchestratorState.AWAITING_BACKEND;
        AssistantReply reply = null;
        String lastText = null;
        int iterations = 0;

        while (state != OrchestratorState.DONE) {
            switch (state) {
                case AWAITING_BACKEND:
                    reply = adapter.complete(ProviderRequest.of(agent.profile(), credential,
                            conversation.snapshot(), agent.functions()));
                    if (reply.hasText()) {
                        lastText = reply.content();
                    }
                    if (!reply.requestsFunction()) {
                        state = OrchestratorState.DONE;
                    } else if (iterations >= maxIterations) {
                        log.warn("[{}] Iteration ceiling of {} reached; '{}' is not executed",
                                conversationId, maxIterations, reply.invocation().name());
                        state = OrchestratorState.DONE;
                    } else {
                        state = OrchestratorState.DISPATCHING;
                    }
                    break;
                case DISPATCHING:
                    iterations++;
                    dispatch(conversationId, agent, reply, conversation, functionCalls, apiCalls);
                    state = OrchestratorState.AWAITING_BACKEND;
                    break;
                default:
                    throw new IllegalStateException("Unexpected orchestrator state: " + state);
            }
        }

        String message = lastText != null ? lastText : FALLBACK_MESSAGE;
        conversation.append(ConversationMessage.assistant(message));
        log.info("[{}] Chat finished after {} function call(s)", conversationId, iterations);
        return new ChatResponse(message, conversationId, functionCalls, apiCalls, iterations, conversation.snapshot());
    }

    private void dispatch(String conversationId,
                          CompiledAgent agent,
                          AssistantReply reply,
                          Conversation conversation,
                          List<FunctionCallRecord> functionCalls,
                          List<ApiCallRecord> apiCalls) {
        FunctionInvocation invocation = reply.invocation();
        conversation.append(ConversationMessage.assistantInvocation(reply.content(), invocation));
        log.info("[{}] Backend requested function '{}' with arguments {}", conversationId, invocation.name(), invocation.arguments());

        long started = System.nanoTime();
        ExecutionResult result;
        String content;
        try {
            result = executionEngine.execute(agent, invocation.name(), invocation.arguments());
            content = executionEngine.formatForConversation(result);
        } catch (RuntimeException e) {
            log.error("[{}] Function '{}' failed unexpectedly", conversationId, invocation.name(), e);
            result = ExecutionResult.failure(FailureType.EXECUTION_ERROR, 0, null, null,
                    "Error executing function: " + e.getMessage());
            content = result.getErrorMessage();
        }
        long durationMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        functionCalls.add(new FunctionCallRecord(invocation.name(), invocation.arguments(), result.isSuccess(),
                durationMillis, result.getErrorMessage()));
        if (result.wasDispatched()) {
            apiCalls.add(new ApiCallRecord(result.getMethod(), result.getUrl(), result.getStatusCode(), result.isSuccess()));
        }
        conversation.append(ConversationMessage.functionResult(invocation, content));
    }
}
