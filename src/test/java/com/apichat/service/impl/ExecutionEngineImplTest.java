package com.apichat.service.impl;

import com.apichat.model.AgentProfile;
import com.apichat.model.ApiDocument;
import com.apichat.model.BodyProperty;
import com.apichat.model.CompiledAgent;
import com.apichat.model.ExecutionResult;
import com.apichat.model.FailureType;
import com.apichat.model.HttpMethod;
import com.apichat.model.ParameterLocation;
import com.apichat.model.RequestBodyModel;
import com.apichat.service.api.StateService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.apichat.service.impl.AgentCompilerServiceImplTest.endpoint;
import static com.apichat.service.impl.AgentCompilerServiceImplTest.param;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionEngineImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer mockWebServer;
    private ExecutionEngineImpl executionEngine;

    @Mock
    private StateService stateService;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        executionEngine = engineWithTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void execute_shouldSubstitutePathParameterAndParseJson() throws Exception {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"id\":7,\"name\":\"Rex\"}")
                .addHeader("Content-Type", "application/json"));

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "7"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatusCode()).isEqualTo(200);
        assertThat(result.getMethod()).isEqualTo("GET");
        assertThat(result.getUrl()).endsWith("/api/pets/7");
        assertThat(result.getBody().get("name").asText()).isEqualTo("Rex");

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/api/pets/7");
        assertThat(request.getHeader("User-Agent")).isEqualTo("test-agent/1.0");
        assertThat(request.getHeader("Content-Type")).isEqualTo("application/json");
    }

    @Test
    void execute_shouldReportHttpErrorButKeepStructuredBody() {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(404)
                .setBody("{\"error\":\"Pet not found\"}")
                .addHeader("Content-Type", "application/json"));

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "99"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getStatusCode()).isEqualTo(404);
        assertThat(result.getFailureType()).isEqualTo(FailureType.HTTP_STATUS);
        assertThat(result.getErrorMessage()).isEqualTo("HTTP 404: {\"error\":\"Pet not found\"}");
        assertThat(result.isStructured()).isTrue();
        assertThat(result.getBody().get("error").asText()).isEqualTo("Pet not found");
        assertThat(executionEngine.formatForConversation(result))
                .isEqualTo("Error 404: HTTP 404: {\"error\":\"Pet not found\"}");
    }

    @Test
    void execute_shouldSynthesizeBodyFromUnconsumedArguments() throws Exception {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\":1}"));

        ExecutionResult result = executionEngine.execute(agent(document), "createPet",
                Map.of("name", "Rex", "tag", "dog", "_no_params", "none"));

        assertThat(result.isSuccess()).isTrue();
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/pets");
        JsonNode sent = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(sent).isEqualTo(objectMapper.valueToTree(Map.of("name", "Rex", "tag", "dog")));
    }

    @Test
    void execute_shouldSendLiteralBodyVerbatim() throws Exception {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse().setResponseCode(204));

        ExecutionResult result = executionEngine.execute(agent(document), "replacePhotos",
                Map.of("petId", "3", "body", List.of("a.png", "b.png")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getBody()).isNull();
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/api/pets/3/photos");
        assertThat(request.getBody().readUtf8()).isEqualTo("[\"a.png\",\"b.png\"]");
    }

    @Test
    void execute_shouldPlaceQueryHeaderAndCookieArguments() throws Exception {
        ApiDocument document = document(mockWebServer.url("/api/").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse().setBody("[]"));

        executionEngine.execute(agent(document), "searchPets", Map.of(
                "tags", List.of("cat", "dog"),
                "limit", 5,
                "X-Request-Id", "req-1",
                "session", "abc"));

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/pets/search?tags=cat&tags=dog&limit=5");
        assertThat(request.getHeader("X-Request-Id")).isEqualTo("req-1");
        assertThat(request.getHeader("Cookie")).isEqualTo("session=abc");
        assertThat(request.getBodySize()).isZero();
    }

    @Test
    void execute_shouldPercentEncodeReservedCharactersInQueryValues() throws Exception {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse().setBody("[]"));

        ExecutionResult result = executionEngine.execute(agent(document), "findPets", Map.of(
                "q", "{\"status\":\"sold\"}",
                "owner", "+15551234 a&b=c"));

        assertThat(result.isSuccess()).isTrue();
        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getPath()).startsWith("/api/pets/find?");
        assertThat(request.getPath()).contains("owner=%2B15551234%20a%26b%3Dc");
        assertThat(request.getRequestUrl().queryParameter("q")).isEqualTo("{\"status\":\"sold\"}");
        assertThat(request.getRequestUrl().queryParameter("owner")).isEqualTo("+15551234 a&b=c");
        assertThat(request.getRequestUrl().queryParameterNames()).containsExactlyInAnyOrder("q", "owner");
    }

    @Test
    void execute_shouldNotAttachBodyToDelete() throws Exception {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse().setResponseCode(204));

        executionEngine.execute(agent(document), "deletePet", Map.of("petId", 4, "reason", "adopted"));

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("DELETE");
        assertThat(request.getPath()).isEqualTo("/api/pets/4");
        assertThat(request.getBodySize()).isZero();
    }

    @Test
    void execute_shouldKeepPlainTextResponse() {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse().setBody("pong").addHeader("Content-Type", "text/plain"));

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "1"));

        assertThat(result.isStructured()).isFalse();
        assertThat(result.getBody().asText()).isEqualTo("pong");
        assertThat(executionEngine.formatForConversation(result)).isEqualTo("pong");
    }

    @Test
    void execute_shouldReportTimeout() {
        executionEngine = engineWithTimeout(Duration.ofMillis(300));
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);
        mockWebServer.enqueue(new MockResponse().setBody("{}").setHeadersDelay(3, TimeUnit.SECONDS));

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "1"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureType()).isEqualTo(FailureType.TIMEOUT);
        assertThat(result.getStatusCode()).isEqualTo(408);
        assertThat(result.getErrorMessage()).isEqualTo("Request timeout - the API took too long to respond");
    }

    @Test
    void execute_shouldReportConnectionFailure() throws IOException {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String unreachable = closed.url("/api").toString();
        closed.shutdown();
        ApiDocument document = document(unreachable);
        when(stateService.getDocument("petstore")).thenReturn(document);

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "1"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureType()).isEqualTo(FailureType.CONNECTION);
        assertThat(result.getStatusCode()).isZero();
        assertThat(result.getErrorMessage()).startsWith("Could not connect to ");
        assertThat(result.wasDispatched()).isTrue();
    }

    @Test
    void execute_shouldReportMissingPathArgumentWithoutDispatching() {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of());

        assertThat(result.getFailureType()).isEqualTo(FailureType.MALFORMED_REQUEST);
        assertThat(result.getErrorMessage()).contains("petId");
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void execute_shouldRejectUnsupportedMethod() {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(document);

        ExecutionResult result = executionEngine.execute(agent(document), "pingOptions", Map.of());

        assertThat(result.getFailureType()).isEqualTo(FailureType.MALFORMED_REQUEST);
        assertThat(result.getErrorMessage()).isEqualTo("Unsupported HTTP method: OPTIONS");
    }

    @Test
    void execute_shouldReportMissingBaseUrlWithBarePath() {
        ApiDocument document = document(null);
        when(stateService.getDocument("petstore")).thenReturn(document);

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "7"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureType()).isEqualTo(FailureType.MALFORMED_REQUEST);
        assertThat(result.getUrl()).isEqualTo("/pets/7");
        assertThat(result.wasDispatched()).isFalse();
    }

    @Test
    void execute_shouldReportUnknownFunction() {
        ApiDocument document = document(mockWebServer.url("/api").toString());

        ExecutionResult result = executionEngine.execute(agent(document), "launchRocket", Map.of());

        assertThat(result.getFailureType()).isEqualTo(FailureType.FUNCTION_NOT_FOUND);
        assertThat(result.getErrorMessage()).isEqualTo("Function 'launchRocket' not found in agent's available functions");
        verifyNoInteractions(stateService);
    }

    @Test
    void execute_shouldReportBindingToDeletedDocument() {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        when(stateService.getDocument("petstore")).thenReturn(null);

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "1"));

        assertThat(result.getFailureType()).isEqualTo(FailureType.BINDING_MISSING);
        assertThat(result.getErrorMessage()).contains("petstore");
    }

    @Test
    void execute_shouldReportBindingToRemovedEndpoint() {
        ApiDocument document = document(mockWebServer.url("/api").toString());
        ApiDocument relearned = new ApiDocument("petstore", "Petstore", null, "2.0.0", "3.0.3", document.baseUrl(),
                List.of(endpoint("listPets", HttpMethod.GET, "/pets", List.of(), null)));
        when(stateService.getDocument("petstore")).thenReturn(relearned);

        ExecutionResult result = executionEngine.execute(agent(document), "showPetById", Map.of("petId", "1"));

        assertThat(result.getFailureType()).isEqualTo(FailureType.BINDING_MISSING);
        assertThat(result.getErrorMessage()).contains("GET /pets/{petId}");
    }

    @Test
    void joinUrl_shouldNormalizeSlashes() {
        assertThat(ExecutionEngineImpl.joinUrl("http://x.test/api/", "/pets")).isEqualTo("http://x.test/api/pets");
        assertThat(ExecutionEngineImpl.joinUrl("http://x.test/api", "pets")).isEqualTo("http://x.test/api/pets");
        assertThat(ExecutionEngineImpl.joinUrl("http://x.test/", "/pets")).isEqualTo("http://x.test/pets");
        assertThat(ExecutionEngineImpl.joinUrl(null, "/pets")).isEqualTo("/pets");
    }

    private ExecutionEngineImpl engineWithTimeout(Duration timeout) {
        return new ExecutionEngineImpl(WebClient.builder().build(), stateService, objectMapper,
                timeout, "test-agent/1.0", 200);
    }

    private CompiledAgent agent(ApiDocument document) {
        return new AgentCompilerServiceImpl().compile("pets", document, Map.of(), AgentProfile.defaults()).agent();
    }

    private static ApiDocument document(String baseUrl) {
        return new ApiDocument("petstore", "Petstore", null, "1.0.0", "3.0.3", baseUrl, List.of(
                endpoint("showPetById", HttpMethod.GET, "/pets/{petId}",
                        List.of(param("petId", ParameterLocation.PATH, true, "string")), null),
                endpoint("createPet", HttpMethod.POST, "/pets", List.of(),
                        new RequestBodyModel("application/json", true, null, List.of(
                                new BodyProperty("name", "string", null), new BodyProperty("tag", "string", null)))),
                endpoint("replacePhotos", HttpMethod.PUT, "/pets/{petId}/photos",
                        List.of(param("petId", ParameterLocation.PATH, true, "string")),
                        new RequestBodyModel("application/json", true, null, List.of())),
                endpoint("deletePet", HttpMethod.DELETE, "/pets/{petId}",
                        List.of(param("petId", ParameterLocation.PATH, true, "integer")), null),
                endpoint("searchPets", HttpMethod.GET, "/pets/search",
                        List.of(param("tags", ParameterLocation.QUERY, false, "array"),
                                param("limit", ParameterLocation.QUERY, false, "integer"),
                                param("X-Request-Id", ParameterLocation.HEADER, false, "string"),
                                param("session", ParameterLocation.COOKIE, false, "string")), null),
                endpoint("findPets", HttpMethod.GET, "/pets/find",
                        List.of(param("q", ParameterLocation.QUERY, false, "string"),
                                param("owner", ParameterLocation.QUERY, false, "string")), null),
                endpoint("pingOptions", HttpMethod.OPTIONS, "/ping", List.of(), null)));
    }
}
