package com.equitiesai.providers;

/**
 * The provider answered with a non-2xx status.
 */
public class HttpStatusException extends GatewayException {
    private final int statusCode;

    public HttpStatusException(String providerId, int statusCode, String message) {
        super(providerId, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
