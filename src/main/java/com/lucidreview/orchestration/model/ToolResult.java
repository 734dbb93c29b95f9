package com.lucidreview.orchestration.model;

import java.util.List;
import java.util.Optional;

public record ToolResult(
        List<ToolContent> content,
        boolean error
) {

    public ToolResult {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public Optional<String> firstText() {
        return content.stream()
                .filter(item -> "text".equals(item.type()))
                .map(ToolContent::text)
                .filter(text -> text != null)
                .findFirst();
    }
}
