package com.equitiesai.providers.chat;

import com.equitiesai.models.ChatMessage;
import com.equitiesai.models.CompletionResult;
import com.equitiesai.models.ModelDescriptor;
import com.equitiesai.models.ProviderDescriptor;
import com.equitiesai.models.StreamChunk;
import com.equitiesai.models.TokenUsage;
import com.equitiesai.models.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API. System prompts go in the top-level {@code system} field and
 * the key in {@code x-api-key}.
 */
public class AnthropicChatProvider extends AbstractChatProvider {

    static final String API_VERSION = "2023-06-01";
    static final String BETA_FEATURES = "context-1m-2025-08-07";
    static final String THINKING_ENABLED = "enabled";
    static final int DEFAULT_THINKING_BUDGET = 10_000;

    public AnthropicChatProvider(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }

    @Override
    public String endpoint(ProviderDescriptor provider, ModelDescriptor model, String apiKey, boolean stream) {
        return provider.getBaseUrl() + "/messages";
    }

    @Override
    public Map<String, String> buildHeaders(String apiKey) {
        Map<String, String> headers = jsonHeaders();
        if (hasKey(apiKey)) {
            headers.put("x-api-key", apiKey);
        }
        headers.put("anthropic-version", API_VERSION);
        headers.put("anthropic-beta", BETA_FEATURES);
        return headers;
    }

    @Override
    public ObjectNode buildRequest(ModelDescriptor model, List<ChatMessage> messages,
                                   ResolvedOptions options, boolean stream) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model.getApiModel());
        payload.put("max_tokens", options.getMaxTokens());

        List<String> systemParts = new ArrayList<>();
        ArrayNode wireMessages = payload.putArray("messages");
        for (ChatMessage message : messages) {
            if (message.getRole() == ChatMessage.Role.SYSTEM) {
                systemParts.add(message.getContent());
                continue;
            }
            ObjectNode msg = wireMessages.addObject();
            msg.put("role", message.getRole().wireName());
            msg.put("content", message.getContent());
        }
        if (!systemParts.isEmpty()) {
            payload.put("system", String.join("\n\n", systemParts));
        }

        String level = options.getReasoningLevel();
        if (model.acceptsReasoningLevel(level) && THINKING_ENABLED.equalsIgnoreCase(level)) {
            int budget = options.getThinkingBudget() != null
                ? options.getThinkingBudget()
                : DEFAULT_THINKING_BUDGET;
            int maxTokens = options.getMaxTokens();
            // max_tokens counts thinking too and must stay above the budget.
            if (maxTokens <= budget) {
                maxTokens = budget + maxTokens;
                if (model.getMaxOutput() > 0 && maxTokens > model.getMaxOutput()) {
                    maxTokens = model.getMaxOutput();
                    if (budget >= maxTokens) {
                        budget = maxTokens / 2;
                    }
                }
                payload.put("max_tokens", maxTokens);
            }
            ObjectNode thinking = payload.putObject("thinking");
            thinking.put("type", THINKING_ENABLED);
            thinking.put("budget_tokens", budget);
        }

        if (options.hasTools()) {
            ArrayNode tools = payload.putArray("tools");
            for (ToolDefinition tool : options.getTools()) {
                writeTool(tools.addObject(), tool, "input_schema");
            }
        }

        if (stream) {
            payload.put("stream", true);
        }
        return payload;
    }

    @Override
    public CompletionResult parseResponse(JsonNode response) {
        String text = null;
        String thinking = null;
        JsonNode blocks = response.path("content");
        if (blocks.isArray()) {
            for (JsonNode block : blocks) {
                String type = block.path("type").asText("");
                if (text == null && "text".equals(type)) {
                    text = textOrNull(block.path("text"));
                } else if (thinking == null && "thinking".equals(type)) {
                    thinking = textOrNull(block.path("thinking"));
                }
            }
        }
        JsonNode usage = response.path("usage");
        return new CompletionResult(
            text,
            thinking,
            new TokenUsage(
                intOrNull(usage.path("input_tokens")),
                intOrNull(usage.path("output_tokens")),
                null),
            textOrNull(response.path("stop_reason"))
        );
    }

    @Override
    public StreamChunk extractChunk(JsonNode frame) {
        String type = frame.path("type").asText("");
        switch (type) {
            case "content_block_delta":
                return chunk(textOrNull(frame.path("delta").path("text")), null);
            case "message_delta":
                return chunk("", textOrNull(frame.path("delta").path("stop_reason")));
            default:
                return StreamChunk.empty();
        }
    }

    @Override
    public boolean isEndOfStream(JsonNode frame) {
        return "message_stop".equals(frame.path("type").asText(""));
    }
}
