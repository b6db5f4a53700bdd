package com.equitiesai.providers.chat;

import com.equitiesai.models.CompletionResult;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Extracts a normalized result from a provider's unary response. Implementations never
 * throw on a missing path; they return empty content and unset usage fields.
 */
public interface ResponseTranslator {

    CompletionResult parseResponse(JsonNode response);
}
