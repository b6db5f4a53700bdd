package com.equitiesai.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Catalog entry for one model of a provider. Prices are per million tokens; a null
 * price means the provider prices the model per route ("varies").
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelDescriptor {

    public static final String CAP_THINKING = "thinking";
    public static final String CAP_REASONING = "reasoning";
    public static final String CAP_TOOLS = "tools";
    public static final String CAP_SEARCH = "search";
    public static final String CAP_VISION = "vision";

    private final String id;
    private final String apiModel;
    private final String name;
    private final int contextWindow;
    private final int maxOutput;
    private final Double inputPrice;
    private final Double outputPrice;
    private final Set<String> capabilities;
    private final List<String> reasoningLevels;
    private final boolean defaultModel;

    @JsonCreator
    public ModelDescriptor(@JsonProperty("id") String id,
                           @JsonProperty("apiModel") String apiModel,
                           @JsonProperty("name") String name,
                           @JsonProperty("contextWindow") int contextWindow,
                           @JsonProperty("maxOutput") int maxOutput,
                           @JsonProperty("inputPrice") Double inputPrice,
                           @JsonProperty("outputPrice") Double outputPrice,
                           @JsonProperty("capabilities") List<String> capabilities,
                           @JsonProperty("reasoningLevels") List<String> reasoningLevels,
                           @JsonProperty("default") boolean defaultModel) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Model id is required");
        }
        this.id = id;
        this.apiModel = apiModel == null || apiModel.isBlank() ? id : apiModel;
        this.name = name == null ? id : name;
        this.contextWindow = contextWindow;
        this.maxOutput = maxOutput;
        this.inputPrice = inputPrice;
        this.outputPrice = outputPrice;
        this.capabilities = capabilities == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
        this.reasoningLevels = reasoningLevels == null ? List.of() : List.copyOf(reasoningLevels);
        this.defaultModel = defaultModel;
    }

    public String getId() {
        return id;
    }

    /** Identifier sent on the wire, which may differ from the catalog key. */
    public String getApiModel() {
        return apiModel;
    }

    public String getName() {
        return name;
    }

    public int getContextWindow() {
        return contextWindow;
    }

    public int getMaxOutput() {
        return maxOutput;
    }

    public Double getInputPrice() {
        return inputPrice;
    }

    public Double getOutputPrice() {
        return outputPrice;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public List<String> getReasoningLevels() {
        return reasoningLevels;
    }

    /**
     * True when the model enumerates {@code level} as an accepted reasoning/thinking
     * setting. Case-insensitive.
     */
    public boolean acceptsReasoningLevel(String level) {
        if (level == null || level.isBlank()) {
            return false;
        }
        for (String candidate : reasoningLevels) {
            if (candidate.equalsIgnoreCase(level.trim())) {
                return true;
            }
        }
        return false;
    }

    @JsonProperty("default")
    public boolean isDefaultModel() {
        return defaultModel;
    }
}
