package io.github.barebone.llm.gateway.providers.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.common.GatewayConstants;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.common.model.ContentBlock;
import io.github.barebone.llm.common.model.Message;
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
import io.github.barebone.llm.gateway.providers.stream.AnthropicStreamNormalizer;
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
 * Adapter for the Anthropic Messages API.
 * <p>
 * Works with an API key ({@code x-api-key}) or with an OAuth token from a
 * Claude subscription. OAuth requests carry the beta headers the subscription
 * endpoint requires and a fixed identity block ahead of the caller's system prompt.
 */
public class AnthropicAdapter extends AbstractBackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(AnthropicAdapter.class);

    private static final String DEFAULT_API_BASE = "https://api.anthropic.com/v1";
    private static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    static final String OAUTH_BETA = "claude-code-20250219,oauth-2025-04-20,fine-grained-tool-streaming-2025-05-14";
    static final String OAUTH_USER_AGENT = "claude-cli/2.1.2 (external, cli)";
    static final String OAUTH_IDENTITY = "You are Claude Code, Anthropic's official CLI for Claude.";

    public AnthropicAdapter(ProviderConfig config, RequestAuthorizer authorizer,
                            HttpClient httpClient, ObjectMapper objectMapper) {
        super(config, authorizer, httpClient, objectMapper);
        logger.info("Anthropic adapter initialized ({} auth)", authorizer.isOAuth() ? "OAuth" : "API key");
    }

    @Override
    public BackendId getBackendId() {
        return BackendId.ANTHROPIC;
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
        builder.header("anthropic-version", ANTHROPIC_VERSION);
        if (streaming) {
            builder.header("Accept", "text/event-stream");
        }
        if (authorizer.isOAuth()) {
            builder.header("anthropic-beta", OAUTH_BETA);
            builder.header("anthropic-dangerous-direct-browser-access", "true");
            builder.header("User-Agent", OAUTH_USER_AGENT);
            builder.header("x-app", "cli");
        }
    }

    @Override
    public TurnCompleted complete(CompletionRequest request) throws GatewayException {
        String model = resolveModel(request);
        ObjectNode apiRequest = buildApiRequest(request, model, false);

        logger.debug("Sending request to Anthropic: model={}, messages={}, tools={}",
                model, request.getMessages().size(), request.hasTools() ? request.getTools().size() : 0);

        HttpResponse<InputStream> response = post("/messages", apiRequest, false);
        return parseResponse(readBody(response.body()), model);
    }

    @Override
    public EventStream stream(CompletionRequest request) throws GatewayException {
        String model = resolveModel(request);
        ObjectNode apiRequest = buildApiRequest(request, model, true);

        logger.debug("Opening Anthropic stream: model={}", model);

        HttpResponse<InputStream> response = post("/messages", apiRequest, true);
        String backendId = getBackendId().getId();
        return new SseEventStream(backendId, response.body(),
                new AnthropicStreamNormalizer(backendId, model, objectMapper));
    }

    /**
     * Builds the Messages API request body.
     */
    ObjectNode buildApiRequest(CompletionRequest request, String model, boolean streaming) {
        ObjectNode apiRequest = objectMapper.createObjectNode();

        apiRequest.put("model", model);
        apiRequest.put("max_tokens", resolveMaxTokens(request));
        if (streaming) {
            apiRequest.put("stream", true);
        }

        // System prompt, plus any system messages found in the conversation
        StringBuilder system = new StringBuilder();
        if (request.hasSystemPrompt()) {
            system.append(request.getSystemPrompt());
        }
        for (Message message : request.getMessages()) {
            if (message.getRole() == Message.Role.SYSTEM && !message.getText().isEmpty()) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.getText());
            }
        }
        if (authorizer.isOAuth()) {
            ArrayNode blocks = apiRequest.putArray("system");
            blocks.addObject().put("type", "text").put("text", OAUTH_IDENTITY);
            if (system.length() > 0) {
                blocks.addObject().put("type", "text").put("text", system.toString());
            }
        } else if (system.length() > 0) {
            apiRequest.put("system", system.toString());
        }

        Double temperature = resolveTemperature(request);
        if (temperature != null) {
            apiRequest.put("temperature", temperature);
        }

        apiRequest.set("messages", convertMessages(request.getMessages()));

        if (request.hasTools()) {
            ArrayNode tools = apiRequest.putArray("tools");
            for (ToolDefinition tool : request.getTools()) {
                tools.add(convertTool(tool));
            }
        }

        return apiRequest;
    }

    /**
     * Converts the conversation. Consecutive tool results share one user turn.
     */
    ArrayNode convertMessages(List<Message> messages) {
        ArrayNode result = objectMapper.createArrayNode();
        ArrayNode pendingResults = null;

        for (Message message : messages) {
            switch (message.getRole()) {
                case SYSTEM:
                    continue;
                case TOOL_RESULT:
                    if (pendingResults == null) {
                        ObjectNode msg = result.addObject();
                        msg.put("role", "user");
                        pendingResults = msg.putArray("content");
                    }
                    ObjectNode toolResult = pendingResults.addObject();
                    toolResult.put("type", "tool_result");
                    toolResult.put("tool_use_id", message.getToolCallId());
                    toolResult.put("content", message.getText());
                    if (message.isError()) {
                        toolResult.put("is_error", true);
                    }
                    continue;
                case ASSISTANT:
                    pendingResults = null;
                    ObjectNode assistant = convertAssistant(message);
                    if (assistant != null) {
                        result.add(assistant);
                    }
                    continue;
                default:
                    pendingResults = null;
                    result.add(convertUser(message));
            }
        }
        return result;
    }

    private ObjectNode convertUser(Message message) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("role", "user");

        if (!message.hasBlocks()) {
            msg.put("content", message.getText());
            return msg;
        }

        ArrayNode content = msg.putArray("content");
        for (ContentBlock block : message.getBlocks()) {
            if (block.isImage()) {
                ObjectNode image = content.addObject();
                image.put("type", "image");
                ObjectNode source = image.putObject("source");
                if (block.isDataUrl()) {
                    source.put("type", "base64");
                    source.put("media_type", block.getMediaType());
                    source.put("data", block.getBase64Data());
                } else {
                    source.put("type", "url");
                    source.put("url", block.getImageUrl());
                }
            } else {
                content.addObject().put("type", "text").put("text", block.getText());
            }
        }
        return msg;
    }

    private ObjectNode convertAssistant(Message message) {
        String text = message.getText();
        if (text.isEmpty() && !message.hasToolCalls()) {
            // The API rejects empty assistant turns
            return null;
        }

        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("role", "assistant");
        if (!message.hasToolCalls()) {
            msg.put("content", text);
            return msg;
        }

        // Text first, then tool calls
        ArrayNode content = msg.putArray("content");
        if (!text.isEmpty()) {
            content.addObject().put("type", "text").put("text", text);
        }
        for (ToolCall toolCall : message.getToolCalls()) {
            ObjectNode toolUse = content.addObject();
            toolUse.put("type", "tool_use");
            toolUse.put("id", toolCall.getId());
            toolUse.put("name", toolCall.getName());
            toolUse.set("input", objectMapper.valueToTree(toolCall.getArguments()));
        }
        return msg;
    }

    /**
     * Converts a tool definition to Anthropic format.
     */
    private ObjectNode convertTool(ToolDefinition tool) {
        ObjectNode toolNode = objectMapper.createObjectNode();
        toolNode.put("name", tool.getName());
        toolNode.put("description", tool.getDescription());
        toolNode.set("input_schema", objectMapper.valueToTree(tool.getParameters()));
        return toolNode;
    }

    /**
     * Parses a unary Messages API response.
     */
    private TurnCompleted parseResponse(String responseBody, String requestedModel) throws ProviderException {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ProviderException(getBackendId().getId(), "Failed to parse Anthropic response", 200, false, e);
        }

        StringBuilder textContent = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();

        for (JsonNode block : root.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                textContent.append(block.path("text").asText());
            } else if ("tool_use".equals(type)) {
                String name = block.path("name").asText();
                toolCalls.add(new ToolCall(block.path("id").asText(), name,
                        parseToolArguments(block.path("input"), name)));
            }
        }

        JsonNode usage = root.path("usage");
        return TurnCompleted.builder()
                .content(textContent.toString())
                .toolCalls(toolCalls)
                .stopReason(root.path("stop_reason").asText(GatewayConstants.STOP_END_TURN))
                .usage(Usage.of(usage.path("input_tokens").asInt(), usage.path("output_tokens").asInt()))
                .model(root.path("model").asText(requestedModel))
                .backendId(getBackendId().getId())
                .build();
    }
}
