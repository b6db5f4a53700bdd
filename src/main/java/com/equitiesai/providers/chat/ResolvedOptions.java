package com.equitiesai.providers.chat;

import com.equitiesai.models.ClientConfig;
import com.equitiesai.models.CompletionOptions;
import com.equitiesai.models.ToolDefinition;

import java.util.List;

/**
 * Per-call options merged over the active configuration. Call options win.
 */
public final class ResolvedOptions {
    private final double temperature;
    private final int maxTokens;
    private final Double topP;
    private final String reasoningLevel;
    private final String defaultReasoningLevel;
    private final Integer thinkingBudget;
    private final List<ToolDefinition> tools;
    private final boolean enableSearch;
    private final int timeoutMs;

    private ResolvedOptions(double temperature, int maxTokens, Double topP, String reasoningLevel,
                            String defaultReasoningLevel, Integer thinkingBudget, List<ToolDefinition> tools, boolean enableSearch,
                            int timeoutMs) {
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.topP = topP;
        this.reasoningLevel = reasoningLevel;
        this.defaultReasoningLevel = defaultReasoningLevel;
        this.thinkingBudget = thinkingBudget;
        this.tools = tools;
        this.enableSearch = enableSearch;
        this.timeoutMs = timeoutMs;
    }

    public static ResolvedOptions merge(ClientConfig config, CompletionOptions options) {
        CompletionOptions o = options != null ? options : CompletionOptions.none();
        List<ToolDefinition> tools = o.getTools() == null || o.getTools().isEmpty()
            ? List.of()
            : List.copyOf(o.getTools());
        return new ResolvedOptions(
            o.getTemperature() != null ? o.getTemperature() : config.getTemperature(),
            o.getMaxTokens() != null && o.getMaxTokens() > 0 ? o.getMaxTokens() : config.getMaxTokens(),
            o.getTopP(),
            blankToNull(o.getReasoningLevel()),
            blankToNull(config.getReasoningLevel()),
            o.getThinkingBudget() != null && o.getThinkingBudget() > 0 ? o.getThinkingBudget() : null,
            tools,
            Boolean.TRUE.equals(o.getEnableSearch()),
            o.getTimeoutMs() != null && o.getTimeoutMs() > 0 ? o.getTimeoutMs() : config.getTimeoutMs()
        );
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    /** Caller-supplied nucleus sampling, or null to use the provider default. */
    public Double getTopP() {
        return topP;
    }

    /** Level the caller asked for on this call, or null. */
    public String getReasoningLevel() {
        return reasoningLevel;
    }

    /**
     * Caller level, else the configured default. Only Gemini's thinking level applies the
     * configured default; other families send reasoning controls only when asked.
     */
    public String getReasoningLevelOrDefault() {
        return reasoningLevel != null ? reasoningLevel : defaultReasoningLevel;
    }

    public Integer getThinkingBudget() {
        return thinkingBudget;
    }

    public List<ToolDefinition> getTools() {
        return tools;
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }

    public boolean isEnableSearch() {
        return enableSearch;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
