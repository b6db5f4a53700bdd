package com.equitiesai.providers.chat;

import com.equitiesai.models.ModelDescriptor;
import com.equitiesai.models.ProviderDescriptor;

/**
 * Everything the gateway needs to talk to one provider family: request shape,
 * credential presentation, endpoint layout and response/stream parsing.
 */
public interface ChatProvider extends RequestTranslator, AuthHeaderBuilder, ResponseTranslator, StreamExtractor {

    /**
     * Get the provider id this instance handles.
     */
    String getProviderName();

    /**
     * Full request URL for a unary or streaming call.
     *
     * @param apiKey only used by providers that carry the credential in the URL
     */
    String endpoint(ProviderDescriptor provider, ModelDescriptor model, String apiKey, boolean stream);
}
