package com.equitiesai.providers;

/**
 * Unknown provider or model. Raised before any network I/O.
 */
public class ConfigurationException extends GatewayException {

    public enum Reason {
        UNKNOWN_PROVIDER,
        UNKNOWN_MODEL
    }

    private final Reason reason;

    public ConfigurationException(Reason reason, String providerId, String message) {
        super(providerId, message);
        this.reason = reason;
    }

    public static ConfigurationException unknownProvider(String providerId) {
        return new ConfigurationException(Reason.UNKNOWN_PROVIDER, providerId,
            "Unknown provider: " + providerId);
    }

    public static ConfigurationException unknownModel(String providerId, String modelId) {
        return new ConfigurationException(Reason.UNKNOWN_MODEL, providerId,
            "Unknown model: " + modelId + " for provider " + providerId);
    }

    public Reason getReason() {
        return reason;
    }
}
