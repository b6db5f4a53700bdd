package com.equitiesai.models;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionResult {
    private final String content;
    private final String reasoning;
    private final TokenUsage usage;
    private final String finishReason;

    public CompletionResult(String content, String reasoning, TokenUsage usage, String finishReason) {
        this.content = content != null ? content : "";
        this.reasoning = reasoning;
        this.usage = usage != null ? usage : TokenUsage.unreported();
        this.finishReason = finishReason;
    }

    public static CompletionResult empty() {
        return new CompletionResult("", null, TokenUsage.unreported(), null);
    }

    public String getContent() {
        return content;
    }

    public String getReasoning() {
        return reasoning;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public String getFinishReason() {
        return finishReason;
    }
}
