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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Google Gemini generateContent API. The key travels as a query parameter and the
 * model id is part of the URL path.
 */
public class GeminiChatProvider extends AbstractChatProvider {

    static final double DEFAULT_TOP_P = 0.95;

    public GeminiChatProvider(ObjectMapper mapper) {
        super(mapper);
    }

    @Override
    public String getProviderName() {
        return "google";
    }

    @Override
    public String endpoint(ProviderDescriptor provider, ModelDescriptor model, String apiKey, boolean stream) {
        StringBuilder url = new StringBuilder(provider.getBaseUrl())
            .append("/models/")
            .append(model.getApiModel())
            .append(stream ? ":streamGenerateContent?alt=sse" : ":generateContent");
        if (apiKey != null && !apiKey.isBlank()) {
            url.append(stream ? '&' : '?')
                .append("key=")
                .append(URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    @Override
    public Map<String, String> buildHeaders(String apiKey) {
        hasKey(apiKey);
        return jsonHeaders();
    }

    @Override
    public ObjectNode buildRequest(ModelDescriptor model, List<ChatMessage> messages,
                                   ResolvedOptions options, boolean stream) {
        ObjectNode payload = mapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        for (ChatMessage message : messages) {
            ObjectNode content = contents.addObject();
            content.put("role", message.getRole() == ChatMessage.Role.ASSISTANT ? "model" : "user");
            content.putArray("parts").addObject().put("text", message.getContent());
        }

        ObjectNode generationConfig = payload.putObject("generationConfig");
        generationConfig.put("temperature", options.getTemperature());
        generationConfig.put("maxOutputTokens", options.getMaxTokens());
        generationConfig.put("topP", options.getTopP() != null ? options.getTopP() : DEFAULT_TOP_P);

        String level = options.getReasoningLevelOrDefault();
        if (model.acceptsReasoningLevel(level)) {
            generationConfig.putObject("thinkingConfig")
                .put("thinkingLevel", level.toUpperCase(Locale.ROOT));
        }

        if (options.hasTools()) {
            ArrayNode declarations = payload.putArray("tools").addObject().putArray("functionDeclarations");
            for (ToolDefinition tool : options.getTools()) {
                writeTool(declarations.addObject(), tool, "parameters");
            }
        }
        return payload;
    }

    @Override
    public CompletionResult parseResponse(JsonNode response) {
        JsonNode candidate = firstElement(response.path("candidates"));
        JsonNode parts = candidate.path("content").path("parts");
        String content = null;
        String thinking = null;
        if (parts.isArray()) {
            for (JsonNode part : parts) {
                boolean thought = part.path("thought").asBoolean(false);
                if (thought && thinking == null) {
                    thinking = textOrNull(part.path("text"));
                } else if (!thought && content == null) {
                    content = textOrNull(part.path("text"));
                }
            }
        }
        JsonNode usage = response.path("usageMetadata");
        return new CompletionResult(
            content,
            thinking,
            new TokenUsage(
                intOrNull(usage.path("promptTokenCount")),
                intOrNull(usage.path("candidatesTokenCount")),
                intOrNull(usage.path("thoughtsTokenCount"))),
            textOrNull(candidate.path("finishReason"))
        );
    }

    @Override
    public StreamChunk extractChunk(JsonNode frame) {
        JsonNode candidate = firstElement(frame.path("candidates"));
        JsonNode part = firstElement(candidate.path("content").path("parts"));
        return chunk(part.path("text").asText(""), textOrNull(candidate.path("finishReason")));
    }
}
