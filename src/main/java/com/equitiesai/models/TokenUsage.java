package com.equitiesai.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Token counts as reported by a provider. A null field means the provider did not
 * report it, which is different from zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenUsage {
    private final Integer inputTokens;
    private final Integer outputTokens;
    private final Integer reasoningTokens;

    public TokenUsage(Integer inputTokens, Integer outputTokens, Integer reasoningTokens) {
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
        this.reasoningTokens = reasoningTokens;
    }

    public static TokenUsage unreported() {
        return new TokenUsage(null, null, null);
    }

    public Integer getInputTokens() {
        return inputTokens;
    }

    public Integer getOutputTokens() {
        return outputTokens;
    }

    public Integer getReasoningTokens() {
        return reasoningTokens;
    }
}
