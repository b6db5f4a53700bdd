package com.equitiesai.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class ProviderDescriptor {
    private final String id;
    private final String name;
    private final String baseUrl;
    private final Map<String, ModelDescriptor> models;

    @JsonCreator
    public ProviderDescriptor(@JsonProperty("id") String id,
                              @JsonProperty("name") String name,
                              @JsonProperty("baseUrl") String baseUrl,
                              @JsonProperty("models") List<ModelDescriptor> models) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Provider id is required");
        }
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("Provider " + id + " declares no models");
        }
        Map<String, ModelDescriptor> byId = new LinkedHashMap<>();
        int defaults = 0;
        for (ModelDescriptor model : models) {
            if (byId.put(model.getId(), model) != null) {
                throw new IllegalArgumentException("Duplicate model " + model.getId() + " for provider " + id);
            }
            if (model.isDefaultModel()) {
                defaults++;
            }
        }
        if (defaults > 1) {
            throw new IllegalArgumentException("Provider " + id + " flags more than one default model");
        }
        this.id = id;
        this.name = name == null ? id : name;
        this.baseUrl = stripTrailingSlashes(baseUrl);
        this.models = Collections.unmodifiableMap(byId);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /** Models in declaration order. */
    public Map<String, ModelDescriptor> getModels() {
        return models;
    }

    /**
     * The model flagged default, or the first declared model when none is flagged.
     */
    public ModelDescriptor getDefaultModel() {
        for (ModelDescriptor model : models.values()) {
            if (model.isDefaultModel()) {
                return model;
            }
        }
        return models.values().iterator().next();
    }

    /** Copy of this provider pointing at another base URL (local proxies, tests). */
    public ProviderDescriptor withBaseUrl(String newBaseUrl) {
        return new ProviderDescriptor(id, name, newBaseUrl, List.copyOf(models.values()));
    }

    private static String stripTrailingSlashes(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is required");
        }
        String url = baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
