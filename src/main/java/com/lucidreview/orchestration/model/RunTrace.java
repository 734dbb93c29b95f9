package com.lucidreview.orchestration.model;

import java.util.List;

public record RunTrace(
        RunView run,
        List<TurnTrace> turns
) {
}
