package com.equitiesai.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Listing entry used to populate provider/model pickers.
 */
public class ProviderSummary {
    private final String id;
    private final String name;
    private final List<ModelSummary> models;

    public ProviderSummary(ProviderDescriptor provider) {
        this.id = provider.getId();
        this.name = provider.getName();
        List<ModelSummary> list = new ArrayList<>();
        for (ModelDescriptor model : provider.getModels().values()) {
            list.add(new ModelSummary(model));
        }
        this.models = List.copyOf(list);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<ModelSummary> getModels() {
        return models;
    }

    public static class ModelSummary {
        private final String id;
        private final String name;
        private final int contextWindow;
        private final List<String> capabilities;
        private final boolean isDefault;

        ModelSummary(ModelDescriptor model) {
            this.id = model.getId();
            this.name = model.getName();
            this.contextWindow = model.getContextWindow();
            this.capabilities = List.copyOf(model.getCapabilities());
            this.isDefault = model.isDefaultModel();
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public int getContextWindow() {
            return contextWindow;
        }

        public List<String> getCapabilities() {
            return capabilities;
        }

        @JsonProperty("default")
        public boolean isDefault() {
            return isDefault;
        }
    }
}
