package com.equitiesai.providers;

/**
 * Base of the gateway's typed failures. Messages never contain credentials.
 */
public class GatewayException extends RuntimeException {
    private final String providerId;

    public GatewayException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public GatewayException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
