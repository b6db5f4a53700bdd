package com.equitiesai.providers;

import com.equitiesai.models.ModelDescriptor;
import com.equitiesai.models.ProviderDescriptor;
import com.equitiesai.models.ProviderSummary;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only registry of providers and their models. Safe to share between threads.
 */
public final class ProviderCatalog {

    public static final String DEFAULT_RESOURCE = "/providers.json";

    private final Map<String, ProviderDescriptor> providers;

    public ProviderCatalog(Collection<ProviderDescriptor> descriptors) {
        Map<String, ProviderDescriptor> byId = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : descriptors) {
            if (byId.put(descriptor.getId(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate provider " + descriptor.getId());
            }
        }
        if (byId.isEmpty()) {
            throw new IllegalArgumentException("Catalog declares no providers");
        }
        this.providers = Collections.unmodifiableMap(byId);
    }

    /**
     * Load the bundled catalog from the classpath.
     */
    public static ProviderCatalog loadDefault(ObjectMapper mapper) {
        return load(mapper, DEFAULT_RESOURCE);
    }

    public static ProviderCatalog load(ObjectMapper mapper, String resource) {
        try (InputStream in = ProviderCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Provider catalog not found on classpath: " + resource);
            }
            CatalogFile file = mapper.readValue(in, CatalogFile.class);
            return new ProviderCatalog(file.providers);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read provider catalog " + resource, e);
        }
    }

    public ProviderDescriptor provider(String providerId) {
        ProviderDescriptor provider = providerId == null ? null : providers.get(providerId);
        if (provider == null) {
            throw ConfigurationException.unknownProvider(providerId);
        }
        return provider;
    }

    public ModelDescriptor model(String providerId, String modelId) {
        ModelDescriptor model = modelId == null ? null : provider(providerId).getModels().get(modelId);
        if (model == null) {
            throw ConfigurationException.unknownModel(providerId, modelId);
        }
        return model;
    }

    public ModelDescriptor defaultModel(String providerId) {
        return provider(providerId).getDefaultModel();
    }

    public boolean hasProvider(String providerId) {
        return providerId != null && providers.containsKey(providerId);
    }

    public Collection<ProviderDescriptor> providers() {
        return providers.values();
    }

    public List<ProviderSummary> listProviders() {
        List<ProviderSummary> list = new ArrayList<>();
        for (ProviderDescriptor provider : providers.values()) {
            list.add(new ProviderSummary(provider));
        }
        return list;
    }

    /**
     * Copy of this catalog with one provider's base URL replaced.
     */
    public ProviderCatalog withBaseUrl(String providerId, String baseUrl) {
        provider(providerId);
        List<ProviderDescriptor> copy = new ArrayList<>();
        for (ProviderDescriptor provider : providers.values()) {
            copy.add(provider.getId().equals(providerId) ? provider.withBaseUrl(baseUrl) : provider);
        }
        return new ProviderCatalog(copy);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class CatalogFile {
        final List<ProviderDescriptor> providers;

        @JsonCreator
        CatalogFile(@JsonProperty("providers") List<ProviderDescriptor> providers) {
            this.providers = providers == null ? List.of() : providers;
        }
    }
}
