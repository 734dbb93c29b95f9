package com.lucidreview.orchestration.api;

import com.lucidreview.orchestration.model.PromptSelection;

public interface SystemPromptProvider {

    /**
     * Resolves the active system prompt and its version. Implementations must not throw;
     * when nothing is configured they return the built-in prompt with a {@code null} version.
     */
    PromptSelection activePrompt();
}
