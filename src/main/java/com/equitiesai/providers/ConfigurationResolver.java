package com.equitiesai.providers;

import com.equitiesai.models.ClientConfig;
import com.equitiesai.models.ModelDescriptor;

/**
 * Validates provider/model selections against the catalog and produces new
 * {@link ClientConfig} snapshots.
 */
public class ConfigurationResolver {

    private final ProviderCatalog catalog;

    public ConfigurationResolver(ProviderCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Built-in defaults, falling back to the first catalog provider when the catalog
     * does not carry the default provider.
     */
    public ClientConfig defaults() {
        ClientConfig base = new ClientConfig(
            ClientConfig.DEFAULT_PROVIDER,
            ClientConfig.DEFAULT_MODEL,
            ClientConfig.DEFAULT_TEMPERATURE,
            ClientConfig.DEFAULT_MAX_TOKENS,
            ClientConfig.DEFAULT_REASONING_LEVEL,
            ClientConfig.DEFAULT_TIMEOUT_MS);
        if (catalog.hasProvider(ClientConfig.DEFAULT_PROVIDER)) {
            boolean knownModel = catalog.provider(ClientConfig.DEFAULT_PROVIDER)
                .getModels().containsKey(ClientConfig.DEFAULT_MODEL);
            return resolve(base, ClientConfig.DEFAULT_PROVIDER, knownModel ? ClientConfig.DEFAULT_MODEL : null);
        }
        String first = catalog.providers().iterator().next().getId();
        return resolve(base, first, null);
    }

    /**
     * Select a provider and model on top of {@code current}. A null or blank model id
     * selects the provider's default model, never the model of the previous provider.
     *
     * @throws ConfigurationException for an unknown provider or model
     */
    public ClientConfig resolve(ClientConfig current, String providerId, String modelId) {
        catalog.provider(providerId);
        ModelDescriptor model = modelId == null || modelId.isBlank()
            ? catalog.defaultModel(providerId)
            : catalog.model(providerId, modelId);
        return current.withSelection(providerId, model.getId());
    }
}
