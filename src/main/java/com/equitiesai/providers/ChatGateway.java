package com.equitiesai.providers;

import com.equitiesai.AppLogger;
import com.equitiesai.models.ChatMessage;
import com.equitiesai.models.ClientConfig;
import com.equitiesai.models.CompletionOptions;
import com.equitiesai.models.CompletionResult;
import com.equitiesai.models.ModelDescriptor;
import com.equitiesai.models.ProviderDescriptor;
import com.equitiesai.models.ProviderInfo;
import com.equitiesai.models.ProviderSummary;
import com.equitiesai.providers.chat.ChatProvider;
import com.equitiesai.providers.chat.ChatProviderFactory;
import com.equitiesai.providers.chat.ResolvedOptions;
import com.equitiesai.providers.stream.EventStreamDecoder;
import com.equitiesai.settings.CredentialSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for chat completions across providers. Holds the active
 * provider/model selection and this instance's credentials.
 *
 * <p>Configuration changes are expected to come from one caller at a time. Completion
 * calls may run concurrently; each works from the selection that was active when it
 * started.</p>
 */
public class ChatGateway {

    private final ObjectMapper mapper;
    private final ProviderCatalog catalog;
    private final ConfigurationResolver resolver;
    private final ChatProviderFactory providerFactory;
    private final ChatDispatcher dispatcher;
    private final CredentialSet credentials;
    private final UsageTracker usageTracker;
    private final AppLogger logger;

    private volatile Selection active;

    public ChatGateway(ObjectMapper mapper, ProviderCatalog catalog, CredentialSet credentials) {
        this(mapper, catalog, credentials, new ChatDispatcher(mapper), new UsageTracker());
    }

    public ChatGateway(ObjectMapper mapper, ProviderCatalog catalog, CredentialSet credentials,
                       ChatDispatcher dispatcher, UsageTracker usageTracker) {
        this.mapper = mapper;
        this.catalog = catalog;
        this.resolver = new ConfigurationResolver(catalog);
        this.providerFactory = new ChatProviderFactory(mapper);
        this.dispatcher = dispatcher;
        this.credentials = credentials;
        this.usageTracker = usageTracker;
        this.logger = AppLogger.get();
        this.active = select(resolver.defaults());
    }

    /**
     * Switch provider and model, optionally storing a new key for the provider. On a
     * {@link ConfigurationException} nothing changes, including the stored key. When the
     * key cannot be persisted the selection stays as it was.
     */
    public ProviderInfo configure(String providerId, String modelId, String apiKey) {
        Selection next = select(resolver.resolve(active.config, providerId, modelId));
        if (apiKey != null && !apiKey.isBlank()) {
            credentials.set(providerId, apiKey);
        }
        active = next;
        logger.info("AI provider set to " + providerId + "/" + next.model.getId());
        return getProviderInfo();
    }

    public ProviderInfo configure(String providerId, String modelId) {
        return configure(providerId, modelId, null);
    }

    /**
     * Replace generation defaults. Null arguments keep the current value.
     */
    public ClientConfig updateGenerationDefaults(Double temperature, Integer maxTokens, String reasoningLevel,
                                                 Integer timeoutMs) {
        ClientConfig config = active.config;
        if (temperature != null) {
            config = config.withTemperature(temperature);
        }
        if (maxTokens != null && maxTokens > 0) {
            config = config.withMaxTokens(maxTokens);
        }
        if (reasoningLevel != null) {
            config = config.withReasoningLevel(reasoningLevel.isBlank() ? null : reasoningLevel);
        }
        if (timeoutMs != null && timeoutMs > 0) {
            config = config.withTimeoutMs(timeoutMs);
        }
        active = select(config);
        return config;
    }

    public void setApiKey(String providerId, String apiKey) {
        catalog.provider(providerId);
        credentials.set(providerId, apiKey);
    }

    public boolean hasApiKey(String providerId) {
        return credentials.has(providerId);
    }

    public ClientConfig getConfig() {
        return active.config;
    }

    public ProviderInfo getProviderInfo() {
        Selection current = active;
        return new ProviderInfo(current.provider, current.model);
    }

    public List<ProviderSummary> listProviders() {
        return catalog.listProviders();
    }

    public UsageTracker.Snapshot getUsage() {
        return usageTracker.snapshot();
    }

    /**
     * Unary completion. A 2xx response that is not valid JSON yields an empty result.
     */
    public CompletionResult complete(List<ChatMessage> messages, CompletionOptions options)
        throws InterruptedException {
        requireMessages(messages);
        Selection current = active;
        ResolvedOptions resolved = ResolvedOptions.merge(current.config, options);
        String providerId = current.provider.getId();
        String apiKey = credentials.get(providerId);

        ObjectNode body = current.chat.buildRequest(current.model, messages, resolved, false);
        Map<String, String> headers = current.chat.buildHeaders(apiKey);
        String url = current.chat.endpoint(current.provider, current.model, apiKey, false);

        String raw = dispatcher.send(providerId, url, headers, toJson(body), resolved.getTimeoutMs());

        CompletionResult result;
        try {
            result = current.chat.parseResponse(readJson(providerId, raw));
        } catch (ResponseParseException e) {
            logger.warn(e.getMessage() + "; returning empty completion");
            result = CompletionResult.empty();
        }
        usageTracker.record(providerId, current.model, result.getUsage());
        return result;
    }

    public CompletionResult complete(List<ChatMessage> messages) throws InterruptedException {
        return complete(messages, null);
    }

    /**
     * Incremental completion. The returned decoder must be closed by the caller if it
     * stops before the end of the stream.
     */
    public EventStreamDecoder completeStreaming(List<ChatMessage> messages, CompletionOptions options)
        throws InterruptedException {
        requireMessages(messages);
        Selection current = active;
        ResolvedOptions resolved = ResolvedOptions.merge(current.config, options);
        String providerId = current.provider.getId();
        String apiKey = credentials.get(providerId);

        ObjectNode body = current.chat.buildRequest(current.model, messages, resolved, true);
        Map<String, String> headers = current.chat.buildHeaders(apiKey);
        String url = current.chat.endpoint(current.provider, current.model, apiKey, true);

        InputStream stream = dispatcher.openStream(providerId, url, headers, toJson(body));
        return new EventStreamDecoder(providerId, stream, current.chat, mapper);
    }

    public EventStreamDecoder completeStreaming(List<ChatMessage> messages) throws InterruptedException {
        return completeStreaming(messages, null);
    }

    private Selection select(ClientConfig config) {
        ProviderDescriptor provider = catalog.provider(config.getProviderId());
        ModelDescriptor model = catalog.model(config.getProviderId(), config.getModelId());
        return new Selection(config, provider, model, providerFactory.getProvider(provider.getId()));
    }

    private JsonNode readJson(String providerId, String raw) {
        try {
            JsonNode json = mapper.readTree(raw == null ? "" : raw);
            if (json == null || !json.isObject()) {
                throw new ResponseParseException(providerId, "Response from " + providerId + " is not a JSON object", null);
            }
            return json;
        } catch (IOException e) {
            throw new ResponseParseException(providerId, "Malformed response from " + providerId, e);
        }
    }

    private String toJson(ObjectNode body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request body", e);
        }
    }

    private static void requireMessages(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required.");
        }
        for (ChatMessage message : messages) {
            if (message == null || message.getRole() == null) {
                throw new IllegalArgumentException("Every message needs a role.");
            }
        }
    }

    private static final class Selection {
        final ClientConfig config;
        final ProviderDescriptor provider;
        final ModelDescriptor model;
        final ChatProvider chat;

        Selection(ClientConfig config, ProviderDescriptor provider, ModelDescriptor model, ChatProvider chat) {
            this.config = config;
            this.provider = provider;
            this.model = model;
            this.chat = chat;
        }
    }
}
