package com.equitiesai.providers.chat;

import com.equitiesai.models.ChatMessage;
import com.equitiesai.models.ModelDescriptor;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Converts normalized messages plus merged options into a provider's request body.
 */
public interface RequestTranslator {

    /**
     * @param stream true when the body is for the incremental (event-stream) endpoint
     */
    ObjectNode buildRequest(ModelDescriptor model, List<ChatMessage> messages,
                            ResolvedOptions options, boolean stream);
}
