package com.lucidreview.orchestration.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lucidreview.orchestration.model.ToolResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.lucidreview.orchestration.OrchestrationConstants.PURPOSE_DETERMINATION;

/**
 * Pulls the structured determination out of the determination tool's result. Anything that
 * does not parse as a JSON object yields an empty result; the run carries on undetermined.
 */
@Component
@RequiredArgsConstructor
public class DeterminationExtractor {

    private final JsonProcessingService jsonProcessingService;

    public Optional<JsonNode> extract(ToolResult result) {
        if (result == null || result.error()) {
            return Optional.empty();
        }
        return result.firstText()
                .map(text -> jsonProcessingService.parseJsonObject(PURPOSE_DETERMINATION, text));
    }
}
