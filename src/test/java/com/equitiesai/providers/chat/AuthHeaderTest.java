package com.equitiesai.providers.chat;

import com.equitiesai.providers.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuthHeaderTest {

    private final ChatProviderFactory factory = new ChatProviderFactory(new ObjectMapper());

    @Test
    void bearerForOpenAiFamily() {
        for (String id : new String[] {"openai", "openrouter", "mistral", "xai"}) {
            Map<String, String> headers = factory.getProvider(id).buildHeaders("key-" + id);
            assertEquals("application/json", headers.get("Content-Type"));
            assertEquals("Bearer key-" + id, headers.get("Authorization"), id);
        }
    }

    @Test
    void anthropicUsesApiKeyHeaderAndVersion() {
        Map<String, String> headers = factory.getProvider("anthropic").buildHeaders("sk-ant");
        assertEquals("sk-ant", headers.get("x-api-key"));
        assertEquals("2023-06-01", headers.get("anthropic-version"));
        assertEquals("context-1m-2025-08-07", headers.get("anthropic-beta"));
        assertFalse(headers.containsKey("Authorization"));
    }

    @Test
    void geminiSendsNoAuthHeader() {
        Map<String, String> headers = factory.getProvider("google").buildHeaders("g-key");
        assertEquals(Map.of("Content-Type", "application/json"), headers);
    }

    @Test
    void missingKeyOmitsCredentialHeader() {
        assertFalse(factory.getProvider("openai").buildHeaders(null).containsKey("Authorization"));
        assertFalse(factory.getProvider("anthropic").buildHeaders("").containsKey("x-api-key"));
    }

    @Test
    void factoryCachesAndRejectsUnknown() {
        assertSame(factory.getProvider("xai"), factory.getProvider("xai"));
        assertEquals("openrouter", factory.getProvider("openrouter").getProviderName());
        assertThrows(ConfigurationException.class, () -> factory.getProvider("cohere"));
    }
}
