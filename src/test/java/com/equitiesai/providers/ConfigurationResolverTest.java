package com.equitiesai.providers;

import com.equitiesai.models.ClientConfig;
import com.equitiesai.models.ModelDescriptor;
import com.equitiesai.models.ProviderDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationResolverTest {

    private final ProviderCatalog catalog = ProviderCatalog.loadDefault(new ObjectMapper());
    private final ConfigurationResolver resolver = new ConfigurationResolver(catalog);

    @Test
    void defaultsAreGeminiFlash() {
        ClientConfig config = resolver.defaults();
        assertEquals("google", config.getProviderId());
        assertEquals("gemini-3-flash", config.getModelId());
        assertEquals(0.7, config.getTemperature());
        assertEquals(8192, config.getMaxTokens());
        assertEquals("medium", config.getReasoningLevel());
        assertEquals(120_000, config.getTimeoutMs());
    }

    @Test
    void switchingProviderWithoutModelUsesItsDefault() {
        ClientConfig start = resolver.resolve(resolver.defaults(), "openai", "gpt-5");
        ClientConfig switched = resolver.resolve(start, "anthropic", null);
        assertEquals("anthropic", switched.getProviderId());
        assertEquals("claude-opus-4.5", switched.getModelId());

        assertEquals("grok-4", resolver.resolve(start, "xai", " ").getModelId());
    }

    @Test
    void explicitModelKeepsGenerationSettings() {
        ClientConfig tuned = resolver.defaults().withTemperature(0.1).withMaxTokens(512);
        ClientConfig resolved = resolver.resolve(tuned, "mistral", "codestral-latest");
        assertEquals("codestral-latest", resolved.getModelId());
        assertEquals(0.1, resolved.getTemperature());
        assertEquals(512, resolved.getMaxTokens());
    }

    @Test
    void unknownSelectionsAreRejected() {
        ClientConfig start = resolver.defaults();
        assertThrows(ConfigurationException.class, () -> resolver.resolve(start, "cohere", null));
        assertThrows(ConfigurationException.class, () -> resolver.resolve(start, "google", "gpt-5"));
        assertThrows(ConfigurationException.class, () -> resolver.resolve(start, null, null));
    }

    @Test
    void catalogWithoutGoogleFallsBackToFirstProvider() {
        ModelDescriptor only = new ModelDescriptor("m1", null, "M1", 1000, 100, null, null, null, null, false);
        ProviderCatalog custom = new ProviderCatalog(List.of(
            new ProviderDescriptor("local", "Local", "http://localhost:1234/v1", List.of(only))));
        ClientConfig config = new ConfigurationResolver(custom).defaults();
        assertEquals("local", config.getProviderId());
        assertEquals("m1", config.getModelId());
    }
}
