package com.lucidreview.orchestration.model;

import java.util.List;

public record TurnTrace(
        TurnView turn,
        List<ToolCallView> toolCalls
) {
}
