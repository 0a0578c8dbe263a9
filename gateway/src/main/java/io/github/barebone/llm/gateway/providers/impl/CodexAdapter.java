package io.github.barebone.llm.gateway.providers.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.common.model.ContentBlock;
import io.github.barebone.llm.common.model.Message;
import io.github.barebone.llm.common.model.ToolCall;
import io.github.barebone.llm.common.model.ToolDefinition;
import io.github.barebone.llm.events.TurnCompleted;
import io.github.barebone.llm.gateway.BackendId;
import io.github.barebone.llm.gateway.providers.AbstractBackendAdapter;
import io.github.barebone.llm.gateway.providers.CompletionRequest;
import io.github.barebone.llm.gateway.providers.EventStream;
import io.github.barebone.llm.gateway.providers.ProviderConfig;
import io.github.barebone.llm.gateway.providers.RequestAuthorizer;
import io.github.barebone.llm.gateway.providers.StreamDrainer;
import io.github.barebone.llm.gateway.providers.stream.CodexStreamNormalizer;
import io.github.barebone.llm.gateway.providers.stream.SseEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Adapter for the ChatGPT Codex backend, which speaks the Responses API.
 * <p>
 * Requests are always streamed; {@link #complete(CompletionRequest)} drains the
 * stream. The backend has no output limit parameter, so max tokens is ignored.
 * Authorization needs a ChatGPT OAuth token and the account id it belongs to.
 */
public class CodexAdapter extends AbstractBackendAdapter {

    private static final Logger logger = LoggerFactory.getLogger(CodexAdapter.class);

    private static final String DEFAULT_API_BASE = "https://chatgpt.com/backend-api";
    private static final String DEFAULT_MODEL = "gpt-5-codex";
    private static final String DEFAULT_INSTRUCTIONS = "You are a helpful assistant.";

    public static final String DEFAULT_ORIGINATOR = "pi";
    public static final String ACCOUNT_ID_HEADER = "chatgpt-account-id";

    private final String originator;
    private final String userAgent;

    public CodexAdapter(ProviderConfig config, RequestAuthorizer authorizer,
                        HttpClient httpClient, ObjectMapper objectMapper) {
        this(config, authorizer, httpClient, objectMapper, DEFAULT_ORIGINATOR);
    }

    public CodexAdapter(ProviderConfig config, RequestAuthorizer authorizer,
                        HttpClient httpClient, ObjectMapper objectMapper, String originator) {
        super(config, authorizer, httpClient, objectMapper);
        this.originator = originator != null ? originator : DEFAULT_ORIGINATOR;
        this.userAgent = String.format("llm-gateway (%s %s; %s)",
                System.getProperty("os.name"), System.getProperty("os.version"), System.getProperty("os.arch"));
        logger.info("Codex adapter initialized for {}", apiBase());
    }

    @Override
    public BackendId getBackendId() {
        return BackendId.OPENAI_CODEX;
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
        builder.header("OpenAI-Beta", "responses=experimental");
        builder.header("originator", originator);
        builder.header("User-Agent", userAgent);
        builder.header("Accept", "text/event-stream");
    }

    @Override
    public TurnCompleted complete(CompletionRequest request) throws GatewayException {
        try (EventStream events = stream(request)) {
            return StreamDrainer.drain(events, getBackendId().getId());
        }
    }

    @Override
    public EventStream stream(CompletionRequest request) throws GatewayException {
        String model = resolveModel(request);
        ObjectNode apiRequest = buildApiRequest(request, model);

        logger.debug("Opening Codex stream: model={}, items={}", model, request.getMessages().size());

        HttpResponse<InputStream> response = post("/codex/responses", apiRequest, true);
        String backendId = getBackendId().getId();
        return new SseEventStream(backendId, response.body(),
                new CodexStreamNormalizer(backendId, model, objectMapper));
    }

    /**
     * Builds the Responses API request body.
     */
    ObjectNode buildApiRequest(CompletionRequest request, String model) {
        ObjectNode apiRequest = objectMapper.createObjectNode();

        apiRequest.put("model", model);
        apiRequest.put("store", false);
        apiRequest.put("stream", true);
        apiRequest.put("instructions", request.hasSystemPrompt() ?
                request.getSystemPrompt() : DEFAULT_INSTRUCTIONS);

        ArrayNode input = apiRequest.putArray("input");
        for (Message message : request.getMessages()) {
            convertMessage(message, input);
        }

        if (request.hasTools()) {
            ArrayNode tools = apiRequest.putArray("tools");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode toolNode = tools.addObject();
                toolNode.put("type", "function");
                toolNode.put("name", tool.getName());
                toolNode.put("description", tool.getDescription() != null ? tool.getDescription() : "");
                toolNode.set("parameters", objectMapper.valueToTree(tool.getParameters()));
            }
        }

        apiRequest.putObject("text").put("verbosity", "medium");
        apiRequest.putArray("include").add("reasoning.encrypted_content");

        Double temperature = resolveTemperature(request);
        if (temperature != null) {
            apiRequest.put("temperature", temperature);
        }

        return apiRequest;
    }

    /**
     * Appends the input items for one message. Assistant turns produce a
     * message item followed by one function_call item per tool call.
     */
    void convertMessage(Message message, ArrayNode input) {
        switch (message.getRole()) {
            case TOOL_RESULT:
                ObjectNode output = input.addObject();
                output.put("type", "function_call_output");
                output.put("call_id", message.getToolCallId());
                output.put("output", message.getText());
                break;
            case ASSISTANT:
                String text = message.getText();
                if (!text.isEmpty()) {
                    ObjectNode item = input.addObject();
                    item.put("type", "message");
                    item.put("role", "assistant");
                    item.putArray("content").addObject().put("type", "output_text").put("text", text);
                }
                for (ToolCall toolCall : message.getToolCalls()) {
                    ObjectNode call = input.addObject();
                    call.put("type", "function_call");
                    call.put("call_id", toolCall.getId());
                    call.put("name", toolCall.getName());
                    call.put("arguments", objectMapper.valueToTree(toolCall.getArguments()).toString());
                }
                break;
            default:
                ObjectNode inputMessage = input.addObject();
                inputMessage.put("type", "message");
                inputMessage.put("role", message.getRole() == Message.Role.SYSTEM ? "developer" : "user");
                ArrayNode content = inputMessage.putArray("content");
                if (message.hasBlocks()) {
                    for (ContentBlock block : message.getBlocks()) {
                        if (block.isImage()) {
                            content.addObject().put("type", "input_image").put("image_url", block.getImageUrl());
                        } else {
                            content.addObject().put("type", "input_text").put("text", block.getText());
                        }
                    }
                } else {
                    content.addObject().put("type", "input_text").put("text", message.getText());
                }
        }
    }
}
