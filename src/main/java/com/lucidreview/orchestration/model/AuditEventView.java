package com.lucidreview.orchestration.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AuditEventView(
        UUID id,
        String caseNumber,
        String eventType,
        String actorType,
        String actorId,
        JsonNode detail,
        OffsetDateTime createdAt
) {
}
