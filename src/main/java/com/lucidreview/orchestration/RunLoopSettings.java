package com.lucidreview.orchestration;

import com.lucidreview.config.ReviewAgentProperties;

/**
 * Per-run knobs of {@link AgentRunLoop}, resolved once from configuration.
 */
public record RunLoopSettings(
        String modelId,
        int maxTurns,
        String determinationTool,
        int toolCallAttempts
) {

    public RunLoopSettings {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be at least 1");
        }
        toolCallAttempts = Math.max(1, toolCallAttempts);
    }

    public static RunLoopSettings from(ReviewAgentProperties properties) {
        return new RunLoopSettings(
                properties.getModelId(),
                properties.getMaxTurns(),
                properties.getDeterminationTool(),
                properties.getTools().getCallAttempts());
    }
}
