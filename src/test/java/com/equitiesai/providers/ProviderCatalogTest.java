package com.equitiesai.providers;

import com.equitiesai.models.ModelDescriptor;
import com.equitiesai.models.ProviderDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderCatalogTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProviderCatalog catalog = ProviderCatalog.loadDefault(mapper);

    private static ModelDescriptor model(String id, boolean isDefault) {
        return new ModelDescriptor(id, null, id, 1000, 100, null, null, List.of("text"), null, isDefault);
    }

    @Test
    void bundledCatalogHasSixProviders() {
        for (String id : new String[] {"google", "openai", "anthropic", "mistral", "xai", "openrouter"}) {
            assertTrue(catalog.hasProvider(id), id);
        }
        assertEquals(6, catalog.providers().size());
        assertFalse(catalog.hasProvider("cohere"));
    }

    @Test
    void defaultModelPerProvider() {
        Map<String, String> expected = Map.of(
            "google", "gemini-3-flash",
            "openai", "gpt-5.2",
            "anthropic", "claude-opus-4.5",
            "mistral", "mistral-large-latest",
            "xai", "grok-4",
            "openrouter", "auto");
        expected.forEach((provider, model) -> assertEquals(model, catalog.defaultModel(provider).getId(), provider));
    }

    @Test
    void flaggedDefaultWinsOverDeclarationOrder() {
        ProviderDescriptor provider = new ProviderDescriptor("p", "P", "https://p.example/",
            List.of(model("first", false), model("flagged", true)));
        assertEquals("flagged", provider.getDefaultModel().getId());
        assertEquals("https://p.example", provider.getBaseUrl());
    }

    @Test
    void invalidProviderDescriptors() {
        assertThrows(IllegalArgumentException.class, () -> new ProviderDescriptor("p", "P", "https://p",
            List.of(model("a", true), model("b", true))));
        assertThrows(IllegalArgumentException.class, () -> new ProviderDescriptor("p", "P", "https://p",
            List.of(model("a", false), model("a", false))));
        assertThrows(IllegalArgumentException.class, () -> new ProviderDescriptor("p", "P", "https://p", List.of()));
    }

    @Test
    void unknownLookupsRaiseConfigurationErrors() {
        ConfigurationException provider = assertThrows(ConfigurationException.class, () -> catalog.provider("cohere"));
        assertEquals(ConfigurationException.Reason.UNKNOWN_PROVIDER, provider.getReason());
        assertEquals("Unknown provider: cohere", provider.getMessage());

        ConfigurationException model = assertThrows(ConfigurationException.class,
            () -> catalog.model("openai", "gpt-2"));
        assertEquals(ConfigurationException.Reason.UNKNOWN_MODEL, model.getReason());
        assertEquals("Unknown model: gpt-2 for provider openai", model.getMessage());
    }

    @Test
    void modelMetadata() {
        ModelDescriptor opus = catalog.model("anthropic", "claude-opus-4.5");
        assertEquals("claude-opus-4-5-20251101", opus.getApiModel());
        assertTrue(opus.acceptsReasoningLevel("Enabled"));
        assertFalse(opus.acceptsReasoningLevel("medium"));
        assertFalse(opus.acceptsReasoningLevel(null));

        ModelDescriptor grok = catalog.model("xai", "grok-4");
        assertTrue(grok.hasCapability(ModelDescriptor.CAP_SEARCH));
        assertEquals("grok-4", grok.getApiModel());
    }

    @Test
    void listingSerializesWithoutSecrets() throws Exception {
        String json = mapper.writeValueAsString(catalog.listProviders());
        assertTrue(json.contains("\"id\":\"gemini-3-flash\""));
        assertTrue(json.contains("\"default\":true"));
        assertFalse(json.contains("apiKey"));
        assertFalse(json.contains("baseUrl"));
        assertEquals(6, catalog.listProviders().size());
    }

    @Test
    void baseUrlOverride() {
        ProviderCatalog local = catalog.withBaseUrl("openai", "http://localhost:9999/v1/");
        assertEquals("http://localhost:9999/v1", local.provider("openai").getBaseUrl());
        assertEquals("https://api.openai.com/v1", catalog.provider("openai").getBaseUrl());
        assertThrows(ConfigurationException.class, () -> catalog.withBaseUrl("cohere", "http://x"));
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalStateException.class, () -> ProviderCatalog.load(mapper, "/no-such-catalog.json"));
    }
}
