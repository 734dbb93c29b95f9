package com.lucidreview.orchestration.model;

import java.util.List;

public record ModelRequest(
        String modelId,
        String systemPrompt,
        List<ConversationMessage> messages,
        List<ModelToolSpec> tools
) {

    public ModelRequest {
        messages = List.copyOf(messages);
        tools = List.copyOf(tools);
    }
}
