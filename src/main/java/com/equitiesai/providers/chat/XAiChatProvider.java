package com.equitiesai.providers.chat;

import com.equitiesai.models.ModelDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * xAI Grok: OpenAI wire format plus the built-in live search tool.
 */
public class XAiChatProvider extends OpenAiCompatibleChatProvider {

    public XAiChatProvider(ObjectMapper mapper) {
        super(mapper, "xai");
    }

    @Override
    protected void addProviderTools(ArrayNode tools, ModelDescriptor model, ResolvedOptions options) {
        if (options.isEnableSearch() && model.hasCapability(ModelDescriptor.CAP_SEARCH)) {
            tools.addObject().put("type", "live_search");
        }
    }
}
