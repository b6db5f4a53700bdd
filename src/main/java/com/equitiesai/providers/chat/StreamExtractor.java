package com.equitiesai.providers.chat;

import com.equitiesai.models.StreamChunk;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Per-frame counterpart of {@link ResponseTranslator} for event streams.
 */
public interface StreamExtractor {

    /** Textual payload that ends the stream without being parsed. */
    String DONE_SENTINEL = "[DONE]";

    StreamChunk extractChunk(JsonNode frame);

    /**
     * True for a parsed frame that ends the stream and carries no delta of its own.
     */
    default boolean isEndOfStream(JsonNode frame) {
        return false;
    }
}
