package com.equitiesai.providers;

public class RequestTimeoutException extends GatewayException {
    private final long timeoutMs;

    public RequestTimeoutException(String providerId, long timeoutMs) {
        super(providerId, "Request to " + providerId + " timed out after " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
