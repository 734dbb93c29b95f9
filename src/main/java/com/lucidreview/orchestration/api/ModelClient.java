package com.lucidreview.orchestration.api;

import com.lucidreview.orchestration.model.ModelRequest;
import com.lucidreview.orchestration.model.ModelResponse;

/**
 * Conversational model used by the run loop. One call is one turn: the model either answers
 * ({@code end_turn}) or asks for tools to be invoked ({@code tool_use}).
 */
public interface ModelClient {

    /**
     * Sends the full conversation to the model and blocks until it responds.
     *
     * @param request model id, system prompt, accumulated history and tool specifications.
     * @return the model's content blocks, stop reason and token usage.
     */
    ModelResponse converse(ModelRequest request);
}
