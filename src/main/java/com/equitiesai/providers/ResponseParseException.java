package com.equitiesai.providers;

/**
 * A successful response whose body is not a JSON object. {@link ChatGateway} logs it and
 * returns an empty completion instead of propagating.
 */
public class ResponseParseException extends GatewayException {

    public ResponseParseException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }
}
