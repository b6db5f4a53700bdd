package com.equitiesai.providers.chat;

import java.util.Map;

/**
 * Produces the request headers that carry a provider's credential. A null or blank key
 * yields headers without credentials; the provider decides whether that is acceptable.
 */
public interface AuthHeaderBuilder {

    Map<String, String> buildHeaders(String apiKey);
}
