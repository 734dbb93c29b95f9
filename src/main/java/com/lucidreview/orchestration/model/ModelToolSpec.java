package com.lucidreview.orchestration.model;

import java.util.Map;

/**
 * Tool specification in the shape the model invocation client expects.
 */
public record ModelToolSpec(
        String name,
        String description,
        Map<String, Object> inputSchema
) {
}
