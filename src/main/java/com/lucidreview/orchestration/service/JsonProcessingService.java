package com.lucidreview.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lucidreview.orchestration.model.ContentBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final TypeReference<List<ContentBlock>> CONTENT_BLOCKS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Parses a JSON object out of free text. Returns {@code null} when the text is empty, is not
     * valid JSON, or is valid JSON that is not an object.
     */
    public @Nullable JsonNode parseJsonObject(String label, @Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            log.debug("Empty payload for {}. Unable to parse JSON.", label);
            return null;
        }
        String json = extractJsonObject(raw);
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                log.debug("Payload for {} is not a JSON object. Snippet: {}", label, truncate(raw, 240));
                return null;
            }
            return node;
        } catch (Exception ex) {
            log.debug("Failed to parse {} payload as JSON. Snippet: {}", label, truncate(raw, 240));
            return null;
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    public @Nullable String toJsonOrNull(@Nullable Object value) {
        return value == null ? null : toJson(value);
    }

    public String writeContentBlocks(List<ContentBlock> blocks) {
        try {
            return objectMapper.writerFor(CONTENT_BLOCKS).writeValueAsString(blocks);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize turn content", ex);
        }
    }

    public List<ContentBlock> readContentBlocks(@Nullable String json) {
        if (!StringUtils.hasText(json)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, CONTENT_BLOCKS);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored turn content is not valid JSON", ex);
        }
    }

    public @Nullable JsonNode readTree(@Nullable String json) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            log.warn("Stored JSON could not be read back: {}", truncate(json, 120));
            return objectMapper.getNodeFactory().textNode(json);
        }
    }

    public Map<String, Object> readObject(@Nullable String json) {
        if (!StringUtils.hasText(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, JSON_OBJECT);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Expected a JSON object: " + truncate(json, 120), ex);
        }
    }

    public <T> T readValue(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Unreadable " + type.getSimpleName() + ": " + truncate(json, 120), ex);
        }
    }

    public <T> T convert(Object value, TypeReference<T> type) {
        return objectMapper.convertValue(value, type);
    }

    private String extractJsonObject(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        if (firstBrace >= 0 && lastBrace > firstBrace) {
            return trimmed.substring(firstBrace, lastBrace + 1);
        }
        return trimmed;
    }

    private String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
