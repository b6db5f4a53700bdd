package com.equitiesai.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Mistral speaks the OpenAI wire format and always sends {@code top_p}.
 */
public class MistralChatProvider extends OpenAiCompatibleChatProvider {

    static final double DEFAULT_TOP_P = 0.95;

    public MistralChatProvider(ObjectMapper mapper) {
        super(mapper, "mistral");
    }

    @Override
    protected void addSamplingFields(ObjectNode payload, ResolvedOptions options) {
        payload.put("top_p", options.getTopP() != null ? options.getTopP() : DEFAULT_TOP_P);
    }
}
