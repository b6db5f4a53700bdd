package com.equitiesai.controllers;

import com.equitiesai.AppLogger;
import com.equitiesai.models.ChatMessage;
import com.equitiesai.models.CompletionOptions;
import com.equitiesai.models.StreamChunk;
import com.equitiesai.providers.AuthException;
import com.equitiesai.providers.ChatGateway;
import com.equitiesai.providers.ConfigurationException;
import com.equitiesai.providers.GatewayException;
import com.equitiesai.providers.HttpStatusException;
import com.equitiesai.providers.NetworkException;
import com.equitiesai.providers.RequestTimeoutException;
import com.equitiesai.providers.stream.EventStreamDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Controller exposing the chat gateway: provider listing, configuration, unary and
 * streamed completions, and usage totals.
 */
public class AiController implements Controller {

    private final ChatGateway gateway;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public AiController(ChatGateway gateway, ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/ai/providers", this::listProviders);
        app.get("/api/ai/config", this::getConfig);
        app.post("/api/ai/config", this::updateConfig);
        app.post("/api/ai/chat", this::chat);
        app.post("/api/ai/chat/stream", this::chatStream);
        app.get("/api/ai/usage", this::getUsage);
    }

    private void listProviders(Context ctx) {
        ctx.json(gateway.listProviders());
    }

    private void getConfig(Context ctx) {
        ctx.json(gateway.getProviderInfo());
    }

    private void updateConfig(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            String provider = text(json, "provider");
            if (provider == null) {
                ctx.status(400).json(Map.of("error", "Provider is required"));
                return;
            }
            gateway.configure(provider, text(json, "model"), text(json, "apiKey"));
            if (json.has("temperature") || json.has("maxTokens") || json.has("reasoningLevel")
                || json.has("timeoutMs")) {
                gateway.updateGenerationDefaults(
                    json.has("temperature") ? json.get("temperature").asDouble() : null,
                    json.has("maxTokens") ? json.get("maxTokens").asInt() : null,
                    text(json, "reasoningLevel"),
                    json.has("timeoutMs") ? json.get("timeoutMs").asInt() : null);
            }
            ctx.json(gateway.getProviderInfo());
        } catch (Exception e) {
            respondError(ctx, e, "update AI configuration");
        }
    }

    private void chat(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            ctx.json(gateway.complete(readMessages(json), readOptions(json)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.status(503).json(Controller.errorBody(e, "interrupted"));
        } catch (Exception e) {
            respondError(ctx, e, "complete chat");
        }
    }

    private void chatStream(Context ctx) {
        EventStreamDecoder decoder;
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            decoder = gateway.completeStreaming(readMessages(json), readOptions(json));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.status(503).json(Controller.errorBody(e, "interrupted"));
            return;
        } catch (Exception e) {
            respondError(ctx, e, "start chat stream");
            return;
        }

        ctx.contentType("text/event-stream");
        ctx.header("Cache-Control", "no-cache");
        try (decoder) {
            OutputStream out = ctx.outputStream();
            try {
                while (decoder.hasNext()) {
                    StreamChunk chunk = decoder.next();
                    writeEvent(out, objectMapper.writeValueAsString(chunk));
                }
            } catch (GatewayException e) {
                logger.warn("Chat stream ended with error: " + e.getMessage());
                writeEvent(out, objectMapper.writeValueAsString(Controller.errorBody(e, typeOf(e))));
            }
            writeEvent(out, "[DONE]");
        } catch (IOException e) {
            logger.info("Chat stream client disconnected: " + e.getMessage());
        }
    }

    private void getUsage(Context ctx) {
        ctx.json(gateway.getUsage());
    }

    private static void writeEvent(OutputStream out, String payload) throws IOException {
        out.write(("data: " + payload + "\n\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private List<ChatMessage> readMessages(JsonNode json) {
        JsonNode messages = json.path("messages");
        if (!messages.isArray() || messages.size() == 0) {
            throw new IllegalArgumentException("messages must be a non-empty array");
        }
        return Arrays.asList(objectMapper.convertValue(messages, ChatMessage[].class));
    }

    private CompletionOptions readOptions(JsonNode json) {
        JsonNode options = json.path("options");
        if (!options.isObject()) {
            return CompletionOptions.none();
        }
        return objectMapper.convertValue(options, CompletionOptions.class);
    }

    private void respondError(Context ctx, Exception e, String action) {
        if (e instanceof ConfigurationException || e instanceof IllegalArgumentException) {
            ctx.status(400).json(Controller.errorBody(e, typeOf(e)));
        } else if (e instanceof AuthException) {
            ctx.status(401).json(Controller.errorBody(e, typeOf(e)));
        } else if (e instanceof RequestTimeoutException) {
            ctx.status(504).json(Controller.errorBody(e, typeOf(e)));
        } else if (e instanceof HttpStatusException) {
            ctx.status(502).json(Controller.errorBody(e, typeOf(e)));
        } else if (e instanceof NetworkException) {
            ctx.status(503).json(Controller.errorBody(e, typeOf(e)));
        } else if (e instanceof IOException) {
            ctx.status(400).json(Controller.errorBody(e, "invalid_request"));
        } else {
            logger.error("Failed to " + action + ": " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e, "internal"));
        }
    }

    private static String typeOf(Exception e) {
        if (e instanceof ConfigurationException) {
            return "configuration";
        } else if (e instanceof AuthException) {
            return "auth";
        } else if (e instanceof RequestTimeoutException) {
            return "timeout";
        } else if (e instanceof HttpStatusException) {
            return "http";
        } else if (e instanceof NetworkException) {
            return "network";
        } else if (e instanceof IllegalArgumentException) {
            return "invalid_request";
        }
        return "internal";
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
