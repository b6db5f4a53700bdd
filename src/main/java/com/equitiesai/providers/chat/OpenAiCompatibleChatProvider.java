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

import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions API.
 * Handles: openai, openrouter. Mistral and xAI extend it with their extras.
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    private final String providerName;

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, String providerName) {
        super(mapper);
        this.providerName = providerName;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public String endpoint(ProviderDescriptor provider, ModelDescriptor model, String apiKey, boolean stream) {
        return provider.getBaseUrl() + "/chat/completions";
    }

    @Override
    public Map<String, String> buildHeaders(String apiKey) {
        Map<String, String> headers = jsonHeaders();
        if (hasKey(apiKey)) {
            headers.put("Authorization", "Bearer " + apiKey);
        }
        return headers;
    }

    @Override
    public ObjectNode buildRequest(ModelDescriptor model, List<ChatMessage> messages,
                                   ResolvedOptions options, boolean stream) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", model.getApiModel());

        ArrayNode wireMessages = payload.putArray("messages");
        for (ChatMessage message : messages) {
            ObjectNode msg = wireMessages.addObject();
            msg.put("role", message.getRole().wireName());
            msg.put("content", message.getContent());
        }

        payload.put("temperature", options.getTemperature());
        payload.put("max_tokens", options.getMaxTokens());
        addSamplingFields(payload, options);

        if (model.acceptsReasoningLevel(options.getReasoningLevel())) {
            payload.putObject("reasoning").put("effort", options.getReasoningLevel());
        }

        ArrayNode tools = mapper.createArrayNode();
        for (ToolDefinition tool : options.getTools()) {
            ObjectNode entry = tools.addObject();
            entry.put("type", "function");
            writeTool(entry.putObject("function"), tool, "parameters");
        }
        addProviderTools(tools, model, options);
        if (tools.size() > 0) {
            payload.set("tools", tools);
        }

        if (stream) {
            payload.put("stream", true);
        }
        return payload;
    }

    /**
     * Hook for providers that send extra sampling parameters.
     */
    protected void addSamplingFields(ObjectNode payload, ResolvedOptions options) {
    }

    /**
     * Hook for provider-specific built-in tools, appended after caller tools.
     */
    protected void addProviderTools(ArrayNode tools, ModelDescriptor model, ResolvedOptions options) {
    }

    @Override
    public CompletionResult parseResponse(JsonNode response) {
        JsonNode choice = firstElement(response.path("choices"));
        JsonNode message = choice.path("message");
        String reasoning = textOrNull(message.path("reasoning"));
        if (reasoning == null) {
            reasoning = textOrNull(message.path("reasoning_content"));
        }
        JsonNode usage = response.path("usage");
        return new CompletionResult(
            textOrNull(message.path("content")),
            reasoning,
            new TokenUsage(
                intOrNull(usage.path("prompt_tokens")),
                intOrNull(usage.path("completion_tokens")),
                intOrNull(usage.path("completion_tokens_details").path("reasoning_tokens"))),
            textOrNull(choice.path("finish_reason"))
        );
    }

    @Override
    public StreamChunk extractChunk(JsonNode frame) {
        JsonNode choice = firstElement(frame.path("choices"));
        String content = textOrNull(choice.path("delta").path("content"));
        return chunk(content, textOrNull(choice.path("finish_reason")));
    }
}
