package io.github.barebone.llm.gateway.providers.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.common.model.ContentBlock;
import io.github.barebone.llm.common.model.Message;
import io.github.barebone.llm.common.model.ModelInfo;
import io.github.barebone.llm.common.model.ToolCall;
import io.github.barebone.llm.common.model.ToolDefinition;
import io.github.barebone.llm.common.model.Usage;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.BackendId;
import io.github.barebone.llm.gateway.providers.AbstractBackendAdapter;
import io.github.barebone.llm.gateway.providers.CompletionRequest;
import io.github.barebone.llm.gateway.providers.EventStream;
import io.github.barebone.llm.gateway.providers.ProviderConfig;
import io.github.barebone.llm.gateway.providers.ProviderException;
import io.github.barebone.llm.gateway.providers.RequestAuthorizer;
import io.github.barebone.llm.gateway.providers.stream.ChatCompletionsStreamNormalizer;
import io.github.barebone.llm.gateway.providers.stream.SseEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;

/**
 * Adapter for OpenAI-compatible Chat Completions endpoints, used for OpenRouter.
 */
public class ChatCompletionsAdapter extends AbstractBackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionsAdapter.class);

    private static final String DEFAULT_API_BASE = "https://openrouter.ai/api/v1";
    private static final String DEFAULT_MODEL = "anthropic/claude-sonnet-4";
    private static final int DEFAULT_CONTEXT_LENGTH = 4096;

    public static final String DEFAULT_APP_NAME = "llm-gateway";

    private final String appName;

    public ChatCompletionsAdapter(ProviderConfig config, RequestAuthorizer authorizer,
                                  HttpClient httpClient, ObjectMapper objectMapper) {
        this(config, authorizer, httpClient, objectMapper, DEFAULT_APP_NAME);
    }

    public ChatCompletionsAdapter(ProviderConfig config, RequestAuthorizer authorizer,
                                  HttpClient httpClient, ObjectMapper objectMapper, String appName) {
        super(config, authorizer, httpClient, objectMapper);
        this.appName = appName != null ? appName : DEFAULT_APP_NAME;
        logger.info("Chat Completions adapter initialized for {}", apiBase());
    }

    @Override
    public BackendId getBackendId() {
        return BackendId.OPENROUTER;
    }

    @Override
    protected String defaultApiBase() {
        return DEFAULT_API_BASE;
    }

    @Override
    protected String defaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    protected void addBackendHeaders(HttpRequest.Builder builder, boolean streaming) {
        // OpenRouter app attribution
        builder.header("HTTP-Referer", "https://github.com/" + appName);
        builder.header("X-Title", appName);
        if (streaming) {
            builder.header("Accept", "text/event-stream");
        }
    }

    @Override
    public TurnCompleted complete(CompletionRequest request) throws GatewayException {
        String model = resolveModel(request);
        ObjectNode apiRequest = buildApiRequest(request, model, false);

        logger.debug("Sending chat completion: model={}, messages={}", model, request.getMessages().size());

        HttpResponse<InputStream> response = post("/chat/completions", apiRequest, false);
        return parseResponse(readBody(response.body()), model);
    }

    @Override
    public EventStream stream(CompletionRequest request) throws GatewayException {
        String model = resolveModel(request);
        ObjectNode apiRequest = buildApiRequest(request, model, true);

        logger.debug("Opening chat completion stream: model={}", model);

        HttpResponse<InputStream> response = post("/chat/completions", apiRequest, true);
        String backendId = getBackendId().getId();
        return new SseEventStream(backendId, response.body(),
                new ChatCompletionsStreamNormalizer(backendId, model, objectMapper));
    }

    /**
     * Lists the models the endpoint offers.
     */
    @Override
    public List<ModelInfo> listModels() throws GatewayException {
        JsonNode root = getJson("/models");
        List<ModelInfo> models = new ArrayList<>();
        for (JsonNode model : root.path("data")) {
            String id = model.path("id").asText();
            models.add(new ModelInfo(
                    id,
                    model.path("name").asText(id),
                    model.path("description").asText(""),
                    model.path("context_length").asInt(DEFAULT_CONTEXT_LENGTH)));
        }
        logger.debug("Listed {} models from {}", models.size(), getBackendId());
        return models;
    }

    /**
     * Builds the Chat Completions request body.
     */
    ObjectNode buildApiRequest(CompletionRequest request, String model, boolean streaming) {
        ObjectNode apiRequest = objectMapper.createObjectNode();

        apiRequest.put("model", model);
        apiRequest.put("max_tokens", resolveMaxTokens(request));

        Double temperature = resolveTemperature(request);
        if (temperature != null) {
            apiRequest.put("temperature", temperature);
        }

        if (streaming) {
            apiRequest.put("stream", true);
            apiRequest.putObject("stream_options").put("include_usage", true);
        }

        ArrayNode messages = apiRequest.putArray("messages");
        if (request.hasSystemPrompt()) {
            messages.addObject().put("role", "system").put("content", request.getSystemPrompt());
        }
        for (Message message : request.getMessages()) {
            messages.add(convertMessage(message));
        }

        if (request.hasTools()) {
            ArrayNode tools = apiRequest.putArray("tools");
            for (ToolDefinition tool : request.getTools()) {
                tools.add(convertTool(tool));
            }
        }

        return apiRequest;
    }

    /**
     * Converts a message to Chat Completions format.
     */
    ObjectNode convertMessage(Message message) {
        ObjectNode msg = objectMapper.createObjectNode();

        switch (message.getRole()) {
            case SYSTEM:
                msg.put("role", "system");
                msg.put("content", message.getText());
                break;
            case TOOL_RESULT:
                msg.put("role", "tool");
                msg.put("tool_call_id", message.getToolCallId());
                msg.put("content", message.getText());
                break;
            case ASSISTANT:
                msg.put("role", "assistant");
                String text = message.getText();
                if (!text.isEmpty() || !message.hasToolCalls()) {
                    msg.put("content", text);
                }
                if (message.hasToolCalls()) {
                    ArrayNode toolCalls = msg.putArray("tool_calls");
                    for (ToolCall toolCall : message.getToolCalls()) {
                        ObjectNode call = toolCalls.addObject();
                        call.put("id", toolCall.getId());
                        call.put("type", "function");
                        ObjectNode function = call.putObject("function");
                        function.put("name", toolCall.getName());
                        function.put("arguments", objectMapper.valueToTree(toolCall.getArguments()).toString());
                    }
                }
                break;
            default:
                msg.put("role", "user");
                if (message.hasBlocks()) {
                    ArrayNode content = msg.putArray("content");
                    for (ContentBlock block : message.getBlocks()) {
                        if (block.isImage()) {
                            ObjectNode image = content.addObject();
                            image.put("type", "image_url");
                            image.putObject("image_url").put("url", block.getImageUrl());
                        } else {
                            content.addObject().put("type", "text").put("text", block.getText());
                        }
                    }
                } else {
                    msg.put("content", message.getText());
                }
        }

        return msg;
    }

    private ObjectNode convertTool(ToolDefinition tool) {
        ObjectNode toolNode = objectMapper.createObjectNode();
        toolNode.put("type", "function");
        ObjectNode function = toolNode.putObject("function");
        function.put("name", tool.getName());
        function.put("description", tool.getDescription() != null ? tool.getDescription() : "");
        function.set("parameters", objectMapper.valueToTree(tool.getParameters()));
        return toolNode;
    }

    private TurnCompleted parseResponse(String responseBody, String requestedModel) throws ProviderException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ProviderException(getBackendId().getId(), "Failed to parse chat completion response", 200, false, e);
        }

        JsonNode choice = root.path("choices").path(0);
        JsonNode message = choice.path("message");

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode toolCall : message.path("tool_calls")) {
            JsonNode function = toolCall.path("function");
            String name = function.path("name").asText();
            toolCalls.add(new ToolCall(toolCall.path("id").asText(), name,
                    parseToolArguments(function.path("arguments"), name)));
        }

        JsonNode usage = root.path("usage");
        String finishReason = choice.path("finish_reason").asText(null);
        return TurnCompleted.builder()
                .content(message.path("content").asText(""))
                .toolCalls(toolCalls)
                .stopReason(finishReason != null ? finishReason : "stop")
                .usage(Usage.of(usage.path("prompt_tokens").asInt(),
                        usage.path("completion_tokens").asInt(),
                        usage.path("total_tokens").asInt()))
                .model(root.path("model").asText(requestedModel))
                .backendId(getBackendId().getId())
                .build();
    }
}
