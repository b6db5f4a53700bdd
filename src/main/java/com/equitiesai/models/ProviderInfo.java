package com.equitiesai.models;

import java.util.List;

/**
 * What the caller sees after configuring: the active provider and model with the
 * metadata a selection UI shows. Carries no credentials.
 */
public class ProviderInfo {
    private final String provider;
    private final String providerName;
    private final String model;
    private final String modelName;
    private final List<String> capabilities;
    private final int contextWindow;
    private final Pricing pricing;

    public ProviderInfo(ProviderDescriptor provider, ModelDescriptor model) {
        this.provider = provider.getId();
        this.providerName = provider.getName();
        this.model = model.getId();
        this.modelName = model.getName();
        this.capabilities = List.copyOf(model.getCapabilities());
        this.contextWindow = model.getContextWindow();
        this.pricing = new Pricing(model.getInputPrice(), model.getOutputPrice());
    }

    public String getProvider() {
        return provider;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getModel() {
        return model;
    }

    public String getModelName() {
        return modelName;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public int getContextWindow() {
        return contextWindow;
    }

    public Pricing getPricing() {
        return pricing;
    }

    public static class Pricing {
        private final Double input;
        private final Double output;

        public Pricing(Double input, Double output) {
            this.input = input;
            this.output = output;
        }

        public Double getInput() {
            return input;
        }

        public Double getOutput() {
            return output;
        }
    }
}
