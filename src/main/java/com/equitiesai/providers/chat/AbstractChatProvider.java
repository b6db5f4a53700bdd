package com.equitiesai.providers.chat;

import com.equitiesai.AppLogger;
import com.equitiesai.models.StreamChunk;
import com.equitiesai.models.ToolDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Abstract base class for chat providers with shared JSON helpers.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    protected final ObjectMapper mapper;

    protected AbstractChatProvider(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Headers every provider sends, with the credential-free content type first.
     */
    protected Map<String, String> jsonHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        return headers;
    }

    protected boolean hasKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            AppLogger.get().warn("No API key set for provider: " + getProviderName());
            return false;
        }
        return true;
    }

    /**
     * Write the common name/description/schema triple under the given schema field name.
     */
    protected ObjectNode writeTool(ObjectNode target, ToolDefinition tool, String schemaField) {
        target.put("name", tool.getName());
        if (tool.getDescription() != null) {
            target.put("description", tool.getDescription());
        }
        if (tool.getParameters() != null && !tool.getParameters().isNull()) {
            target.set(schemaField, tool.getParameters().deepCopy());
        }
        return target;
    }

    protected static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    protected static Integer intOrNull(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return node.intValue();
    }

    protected static JsonNode firstElement(JsonNode array) {
        if (array != null && array.isArray() && array.size() > 0) {
            return array.get(0);
        }
        return MissingNode.getInstance();
    }

    protected static StreamChunk chunk(String content, String finishReason) {
        return new StreamChunk(content, finishReason);
    }
}
