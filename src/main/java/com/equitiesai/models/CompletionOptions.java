package com.equitiesai.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Per-call overrides. Every field is optional; unset fields fall back to the active
 * {@link ClientConfig}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompletionOptions {
    private Double temperature;
    private Integer maxTokens;
    private Double topP;
    private String reasoningLevel;
    private Integer thinkingBudget;
    private List<ToolDefinition> tools;
    private Boolean enableSearch;
    private Integer timeoutMs;

    public CompletionOptions() {}

    public static CompletionOptions none() {
        return new CompletionOptions();
    }

    public Double getTemperature() {
        return temperature;
    }

    public CompletionOptions setTemperature(Double temperature) {
        this.temperature = temperature;
        return this;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public CompletionOptions setMaxTokens(Integer maxTokens) {
        this.maxTokens = maxTokens;
        return this;
    }

    public Double getTopP() {
        return topP;
    }

    public CompletionOptions setTopP(Double topP) {
        this.topP = topP;
        return this;
    }

    public String getReasoningLevel() {
        return reasoningLevel;
    }

    public CompletionOptions setReasoningLevel(String reasoningLevel) {
        this.reasoningLevel = reasoningLevel;
        return this;
    }

    public Integer getThinkingBudget() {
        return thinkingBudget;
    }

    public CompletionOptions setThinkingBudget(Integer thinkingBudget) {
        this.thinkingBudget = thinkingBudget;
        return this;
    }

    public List<ToolDefinition> getTools() {
        return tools;
    }

    public CompletionOptions setTools(List<ToolDefinition> tools) {
        this.tools = tools;
        return this;
    }

    public Boolean getEnableSearch() {
        return enableSearch;
    }

    public CompletionOptions setEnableSearch(Boolean enableSearch) {
        this.enableSearch = enableSearch;
        return this;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public CompletionOptions setTimeoutMs(Integer timeoutMs) {
        this.timeoutMs = timeoutMs;
        return this;
    }
}
