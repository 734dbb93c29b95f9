package com.lucidreview.orchestration.service;

import com.lucidreview.orchestration.api.SystemPromptProvider;
import com.lucidreview.orchestration.model.PromptSelection;
import com.lucidreview.repository.PromptVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import static com.lucidreview.orchestration.OrchestrationConstants.FALLBACK_SYSTEM_PROMPT;

@Service
@RequiredArgsConstructor
@Slf4j
public class DefaultSystemPromptProvider implements SystemPromptProvider {

    private final PromptVersionRepository promptVersionRepository;

    @Override
    public PromptSelection activePrompt() {
        try {
            return promptVersionRepository.findFirstByActiveTrueOrderByCreatedAtDesc()
                    .filter(row -> StringUtils.hasText(row.getSystemPrompt()))
                    .map(row -> new PromptSelection(row.getSystemPrompt(), row.getVersion()))
                    .orElseGet(DefaultSystemPromptProvider::fallback);
        } catch (Exception ex) {
            log.warn("Active prompt lookup failed, using built-in prompt: {}", ex.getMessage());
            return fallback();
        }
    }

    public static PromptSelection fallback() {
        return new PromptSelection(FALLBACK_SYSTEM_PROMPT, null);
    }
}
