package com.equitiesai.models;

/**
 * Immutable snapshot of the active provider/model and generation defaults. New
 * provider/model pairs are produced only through
 * {@link com.equitiesai.providers.ConfigurationResolver}, which validates them.
 */
public final class ClientConfig {

    public static final String DEFAULT_PROVIDER = "google";
    public static final String DEFAULT_MODEL = "gemini-3-flash";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 8192;
    public static final String DEFAULT_REASONING_LEVEL = "medium";
    public static final int DEFAULT_TIMEOUT_MS = 120_000;

    private final String providerId;
    private final String modelId;
    private final double temperature;
    private final int maxTokens;
    private final String reasoningLevel;
    private final int timeoutMs;

    public ClientConfig(String providerId, String modelId, double temperature, int maxTokens,
                        String reasoningLevel, int timeoutMs) {
        this.providerId = providerId;
        this.modelId = modelId;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.reasoningLevel = reasoningLevel;
        this.timeoutMs = timeoutMs;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModelId() {
        return modelId;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public String getReasoningLevel() {
        return reasoningLevel;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public ClientConfig withSelection(String newProviderId, String newModelId) {
        return new ClientConfig(newProviderId, newModelId, temperature, maxTokens, reasoningLevel, timeoutMs);
    }

    public ClientConfig withTemperature(double value) {
        return new ClientConfig(providerId, modelId, value, maxTokens, reasoningLevel, timeoutMs);
    }

    public ClientConfig withMaxTokens(int value) {
        return new ClientConfig(providerId, modelId, temperature, value, reasoningLevel, timeoutMs);
    }

    public ClientConfig withReasoningLevel(String value) {
        return new ClientConfig(providerId, modelId, temperature, maxTokens, value, timeoutMs);
    }

    public ClientConfig withTimeoutMs(int value) {
        return new ClientConfig(providerId, modelId, temperature, maxTokens, reasoningLevel, value);
    }

    @Override
    public String toString() {
        return "ClientConfig{" + providerId + "/" + modelId
            + ", temperature=" + temperature
            + ", maxTokens=" + maxTokens
            + ", reasoningLevel=" + reasoningLevel
            + ", timeoutMs=" + timeoutMs + "}";
    }
}
