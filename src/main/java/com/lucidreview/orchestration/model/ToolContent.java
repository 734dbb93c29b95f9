package com.lucidreview.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolContent(
        String type,
        @Nullable String text
) {

    public static ToolContent text(String text) {
        return new ToolContent("text", text);
    }
}
