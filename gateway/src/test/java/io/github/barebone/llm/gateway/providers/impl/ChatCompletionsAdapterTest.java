package io.github.barebone.llm.gateway.providers.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.common.model.ContentBlock;
import io.github.barebone.llm.common.model.Message;
import io.github.barebone.llm.common.model.ModelInfo;
import io.github.barebone.llm.common.model.ToolCall;
import io.github.barebone.llm.common.model.ToolDefinition;
import io.github.barebone.llm.events.ToolCallCompleted;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.BackendId;
import io.github.barebone.llm.gateway.FakeBackendServer;
import io.github.barebone.llm.gateway.providers.ApiKeyAuthorizer;
import io.github.barebone.llm.gateway.providers.CompletionRequest;
import io.github.barebone.llm.gateway.providers.EventStream;
import io.github.barebone.llm.gateway.providers.ProviderConfig;
import io.github.barebone.llm.gateway.providers.ProviderException;
import io.github.barebone.llm.gateway.providers.RateLimitedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.barebone.llm.gateway.FakeBackendServer.sse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ChatCompletionsAdapter.
 */
class ChatCompletionsAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private FakeBackendServer server;
    private ChatCompletionsAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeBackendServer();
        ProviderConfig config = ProviderConfig.builder()
                .backendId(BackendId.OPENROUTER)
                .apiKey("sk-or-test")
                .apiBaseUrl(server.baseUrl() + "/api/v1/")
                .defaultModel("openai/gpt-4o-mini")
                .build();
        adapter = new ChatCompletionsAdapter(config, ApiKeyAuthorizer.bearer("sk-or-test"), httpClient,
                objectMapper, "test-app");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    // ========== Unary Requests ==========

    @Test
    void testComplete_requestAndResponse() throws Exception {
        server.enqueueJson(200, "{\"model\":\"openai/gpt-4o-mini\",\"choices\":[{\"index\":0," +
                "\"message\":{\"role\":\"assistant\",\"content\":null,\"tool_calls\":[{\"id\":\"call_1\"," +
                "\"type\":\"function\",\"function\":{\"name\":\"search\",\"arguments\":\"{\\\"q\\\":\\\"java\\\"}\"}}]}," +
                "\"finish_reason\":\"tool_calls\"}],\"usage\":{\"prompt_tokens\":11,\"completion_tokens\":6,\"total_tokens\":17}}");

        CompletionRequest request = CompletionRequest.builder()
                .systemPrompt("You search.")
                .addMessage(Message.user("find java"))
                .tools(Collections.singletonList(new ToolDefinition("search", "Search the web", null)))
                .build();
        TurnCompleted turn = adapter.complete(request);

        assertEquals("", turn.getContent());
        assertEquals("tool_calls", turn.getStopReason());
        assertEquals("java", turn.getToolCalls().get(0).getArguments().get("q"));
        assertEquals(17, turn.getUsage().getTotalTokens());

        FakeBackendServer.RecordedRequest recorded = server.getRequest(0);
        assertEquals("/api/v1/chat/completions", recorded.getPath());
        assertEquals("Bearer sk-or-test", recorded.getHeader("Authorization"));
        assertEquals("https://github.com/test-app", recorded.getHeader("HTTP-Referer"));
        assertEquals("test-app", recorded.getHeader("X-Title"));

        JsonNode body = objectMapper.readTree(recorded.getBody());
        assertEquals("openai/gpt-4o-mini", body.path("model").asText());
        assertEquals("system", body.path("messages").get(0).path("role").asText());
        assertEquals("You search.", body.path("messages").get(0).path("content").asText());
        assertEquals("function", body.path("tools").get(0).path("type").asText());
        assertEquals("search", body.path("tools").get(0).path("function").path("name").asText());
        assertFalse(body.has("stream"));
    }

    @Test
    void testComplete_missingFinishReasonDefaultsToStop() throws Exception {
        server.enqueueJson(200, "{\"choices\":[{\"message\":{\"content\":\"hi\"}}]}");

        TurnCompleted turn = adapter.complete(CompletionRequest.builder().addMessage(Message.user("hi")).build());

        assertEquals("hi", turn.getContent());
        assertEquals("stop", turn.getStopReason());
        assertEquals(0, turn.getUsage().getTotalTokens());
    }

    @Test
    void testComplete_trailingGarbageInArgumentsBecomesEmpty() throws Exception {
        server.enqueueJson(200, "{\"choices\":[{\"message\":{\"tool_calls\":[{\"id\":\"call_1\"," +
                "\"type\":\"function\",\"function\":{\"name\":\"search\",\"arguments\":\"{\\\"q\\\":\\\"java\\\"}}\"}}]}," +
                "\"finish_reason\":\"tool_calls\"}]}");

        TurnCompleted turn = adapter.complete(CompletionRequest.builder().addMessage(Message.user("find")).build());

        assertEquals("search", turn.getToolCalls().get(0).getName());
        assertTrue(turn.getToolCalls().get(0).getArguments().isEmpty());
    }

    // ========== Streaming ==========

    @Test
    void testStream_toolCallTurn() throws Exception {
        server.enqueueSse(
                ": OPENROUTER PROCESSING\n\n",
                sse("{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_7\",\"type\":\"function\"," +
                        "\"function\":{\"name\":\"get_weather\",\"arguments\":\"\"}}]},\"finish_reason\":null}]}"),
                sse("{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":" +
                        "\"{\\\"city\\\":\\\"Oslo\\\"}\"}}]},\"finish_reason\":null}]}"),
                sse("{\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}"),
                sse("{\"choices\":[],\"usage\":{\"prompt_tokens\":5,\"completion_tokens\":9,\"total_tokens\":14}}"),
                sse("[DONE]"));

        ToolCallCompleted call = null;
        TurnCompleted turn = null;
        try (EventStream stream = adapter.stream(CompletionRequest.builder().addMessage(Message.user("weather?")).build())) {
            while (stream.hasNext()) {
                Object event = stream.next();
                if (event instanceof ToolCallCompleted) {
                    call = (ToolCallCompleted) event;
                } else if (event instanceof TurnCompleted) {
                    turn = (TurnCompleted) event;
                }
            }
        }

        assertNotNull(call);
        assertEquals("Oslo", call.getArguments().get("city"));
        assertNotNull(turn);
        assertEquals(14, turn.getUsage().getTotalTokens());

        JsonNode body = objectMapper.readTree(server.getRequest(0).getBody());
        assertTrue(body.path("stream").asBoolean());
        assertTrue(body.path("stream_options").path("include_usage").asBoolean());
    }

    @Test
    void testRateLimited() {
        server.enqueue(429, "application/json", "{\"error\":{\"message\":\"Rate limit exceeded\",\"code\":429}}",
                Collections.singletonMap("Retry-After", "1.5"));

        RateLimitedException e = assertThrows(RateLimitedException.class,
                () -> adapter.stream(CompletionRequest.builder().addMessage(Message.user("x")).build()));
        assertEquals(1500, e.getRetryAfter().orElseThrow().toMillis());
    }

    @Test
    void testForbiddenIsAuthenticationFailure() {
        server.enqueueJson(403, "{\"error\":{\"message\":\"Key disabled\"}}");

        ProviderException e = assertThrows(ProviderException.class,
                () -> adapter.complete(CompletionRequest.builder().addMessage(Message.user("x")).build()));
        assertEquals(403, e.getStatusCode());
        assertTrue(e.getMessage().contains("Key disabled"));
    }

    // ========== Model Listing ==========

    @Test
    void testListModels() throws Exception {
        server.enqueueJson(200, "{\"data\":[{\"id\":\"anthropic/claude-sonnet-4\",\"name\":\"Claude Sonnet 4\"," +
                "\"description\":\"Balanced\",\"context_length\":200000},{\"id\":\"bare/model\"}]}");

        List<ModelInfo> models = adapter.listModels();

        assertEquals(2, models.size());
        assertEquals("Claude Sonnet 4", models.get(0).getName());
        assertEquals(200000, models.get(0).getContextLength());
        assertEquals("bare/model", models.get(1).getName());
        assertEquals(4096, models.get(1).getContextLength());
        assertEquals("GET", server.getRequest(0).getMethod());
        assertEquals("/api/v1/models", server.getRequest(0).getPath());
    }

    // ========== Message Translation ==========

    @Test
    void testConvertMessage_assistantWithToolCalls() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("city", "Oslo");
        Message assistant = Message.assistant("", Collections.singletonList(new ToolCall("call_1", "get_weather", arguments)));

        ObjectNode converted = adapter.convertMessage(assistant);

        assertEquals("assistant", converted.path("role").asText());
        assertFalse(converted.has("content"));
        JsonNode call = converted.path("tool_calls").get(0);
        assertEquals("call_1", call.path("id").asText());
        assertEquals("{\"city\":\"Oslo\"}", call.path("function").path("arguments").asText());
    }

    @Test
    void testConvertMessage_toolResult() {
        ObjectNode converted = adapter.convertMessage(Message.toolResult("call_1", "get_weather", "Rainy"));

        assertEquals("tool", converted.path("role").asText());
        assertEquals("call_1", converted.path("tool_call_id").asText());
        assertEquals("Rainy", converted.path("content").asText());
    }

    @Test
    void testConvertMessage_userImageParts() {
        Message user = Message.user(Arrays.asList(
                ContentBlock.text("Describe"),
                ContentBlock.image("https://example.com/a.png")));

        JsonNode content = adapter.convertMessage(user).path("content");

        assertEquals("text", content.get(0).path("type").asText());
        assertEquals("image_url", content.get(1).path("type").asText());
        assertEquals("https://example.com/a.png", content.get(1).path("image_url").path("url").asText());
    }
}
