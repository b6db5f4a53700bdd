package com.equitiesai.providers;

/**
 * Transport failure with no usable response (DNS, refused or reset connection,
 * broken stream).
 */
public class NetworkException extends GatewayException {

    public NetworkException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }
}
