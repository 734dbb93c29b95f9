package com.lucidreview.orchestration.model;

import org.springframework.lang.Nullable;

public record PromptSelection(
        String prompt,
        @Nullable String version
) {
}
