package com.apichat.service.provider;

import com.apichat.dto.llm.anthropic.AnthropicContentBlock;
import com.apichat.dto.llm.anthropic.AnthropicMessage;
import com.apichat.dto.llm.anthropic.AnthropicRequest;
import com.apichat.exception.MissingCredentialException;
import com.apichat.model.conversation.AssistantReply;
import com.apichat.model.conversation.ConversationMessage;
import com.apichat.model.conversation.FunctionInvocation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.apichat.service.provider.OpenAiProviderAdapterTest.showPetById;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnthropicProviderAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer mockWebServer;
    private AnthropicProviderAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        adapter = new AnthropicProviderAdapter(WebClient.builder().build(), objectMapper, Duration.ofSeconds(5),
                mockWebServer.url("/v1/messages").toString(), "2023-06-01");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void complete_shouldMoveSystemPreambleAndSendTools() throws Exception {
        mockWebServer.enqueue(new MockResponse().addHeader("Content-Type", "application/json").setBody("""
                {"id":"msg_1","model":"claude-3","stop_reason":"end_turn",
                 "content":[{"type":"text","text":"Hello"}]}
                """));

        adapter.complete(new ProviderRequest("claude-3", 0.5, 1024, "ak-test", List.of(
                ConversationMessage.system("You can call the Petstore API."),
                ConversationMessage.user("Hi")), List.of(showPetById())));

        RecordedRequest recorded = mockWebServer.takeRequest();
        assertThat(recorded.getHeader("x-api-key")).isEqualTo("ak-test");
        assertThat(recorded.getHeader("anthropic-version")).isEqualTo("2023-06-01");
        String rawBody = recorded.getBody().readUtf8();
        JsonNode body = objectMapper.readTree(rawBody);
        assertThat(body.get("system").asText()).isEqualTo("You can call the Petstore API.");
        assertThat(body.get("max_tokens").asInt()).isEqualTo(1024);
        assertThat(body.get("messages")).hasSize(1);
        assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("user");
        assertThat(body.get("messages").get(0).get("content").get(0).get("text").asText()).isEqualTo("Hi");
        JsonNode tool = body.get("tools").get(0);
        assertThat(tool.get("name").asText()).isEqualTo("showPetById");
        assertThat(tool.get("input_schema").get("properties").has("petId")).isTrue();
        assertThat(rawBody).doesNotContain("executionBinding");
    }

    @Test
    void complete_shouldConcatenateTextAndHonorFirstToolUse() {
        mockWebServer.enqueue(new MockResponse().addHeader("Content-Type", "application/json").setBody("""
                {"stop_reason":"tool_use","content":[
                  {"type":"text","text":"Let me "},
                  {"type":"text","text":"check."},
                  {"type":"tool_use","id":"toolu_1","name":"showPetById","input":{"petId":"7"}},
                  {"type":"tool_use","id":"toolu_2","name":"showPetById","input":{"petId":"8"}}]}
                """));

        AssistantReply reply = adapter.complete(new ProviderRequest("claude-3", 0.5, 1024, "ak-test",
                List.of(ConversationMessage.user("Show pets 7 and 8")), List.of(showPetById())));

        assertThat(reply.content()).isEqualTo("Let me check.");
        assertThat(reply.invocation().callId()).isEqualTo("toolu_1");
        assertThat(reply.invocation().arguments()).containsExactly(Map.entry("petId", "7"));
    }

    @Test
    void complete_shouldRequireCredential() {
        assertThatThrownBy(() -> adapter.complete(new ProviderRequest("claude-3", 0.5, 1024, " ",
                List.of(ConversationMessage.user("Hi")), List.of())))
                .isInstanceOf(MissingCredentialException.class)
                .hasMessageContaining("backend-key --provider anthropic");
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void toWireRequest_shouldPairToolResultWithToolUse() {
        FunctionInvocation invocation = new FunctionInvocation("toolu_1", "showPetById", Map.of("petId", "7"));
        AnthropicRequest wire = adapter.toWireRequest(new ProviderRequest("claude-3", 0.5, 1024, "ak-test", List.of(
                ConversationMessage.system("Preamble"),
                ConversationMessage.user("Show pet 7"),
                ConversationMessage.assistantInvocation("Looking it up.", invocation),
                ConversationMessage.functionResult(invocation, "Error 404: HTTP 404")), List.of()));

        assertThat(wire.getTools()).isNull();
        assertThat(wire.getMessages()).hasSize(3);

        AnthropicMessage assistant = wire.getMessages().get(1);
        assertThat(assistant.getRole()).isEqualTo("assistant");
        assertThat(assistant.getContent()).extracting(AnthropicContentBlock::getType)
                .containsExactly(AnthropicContentBlock.TEXT, AnthropicContentBlock.TOOL_USE);
        AnthropicContentBlock toolUse = assistant.getContent().get(1);
        assertThat(toolUse.getId()).isEqualTo("toolu_1");
        assertThat(toolUse.getInput().get("petId").asText()).isEqualTo("7");

        AnthropicMessage result = wire.getMessages().get(2);
        assertThat(result.getRole()).isEqualTo("user");
        AnthropicContentBlock toolResult = result.getContent().get(0);
        assertThat(toolResult.getType()).isEqualTo(AnthropicContentBlock.TOOL_RESULT);
        assertThat(toolResult.getToolUseId()).isEqualTo("toolu_1");
        assertThat(toolResult.getContent()).isEqualTo("Error 404: HTTP 404");
    }
}
