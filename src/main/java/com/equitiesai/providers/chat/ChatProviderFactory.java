package com.equitiesai.providers.chat;

import com.equitiesai.providers.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for creating and caching chat provider instances, keyed by provider id.
 */
public class ChatProviderFactory {

    private final ObjectMapper mapper;
    private final Map<String, ChatProvider> providerCache = new ConcurrentHashMap<>();

    public ChatProviderFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Get the chat provider for the given provider id.
     *
     * @throws ConfigurationException if no wire format is known for the id
     */
    public ChatProvider getProvider(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            throw ConfigurationException.unknownProvider(providerId);
        }
        return providerCache.computeIfAbsent(providerId, this::createProvider);
    }

    private ChatProvider createProvider(String providerId) {
        switch (providerId) {
            case "google":
                return new GeminiChatProvider(mapper);
            case "anthropic":
                return new AnthropicChatProvider(mapper);
            case "mistral":
                return new MistralChatProvider(mapper);
            case "xai":
                return new XAiChatProvider(mapper);
            case "openai":
            case "openrouter":
                return new OpenAiCompatibleChatProvider(mapper, providerId);
            default:
                throw ConfigurationException.unknownProvider(providerId);
        }
    }
}
