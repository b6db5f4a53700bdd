package com.equitiesai.providers;

/**
 * The provider rejected the request's credential (401/403).
 */
public class AuthException extends HttpStatusException {

    public AuthException(String providerId, int statusCode, String message) {
        super(providerId, statusCode, message);
    }
}
