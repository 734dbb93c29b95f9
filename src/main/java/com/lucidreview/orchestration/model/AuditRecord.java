package com.lucidreview.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.Map;

public record AuditRecord(
        @Nullable String caseNumber,
        AuditEventType eventType,
        ActorType actorType,
        @Nullable String actorId,
        Map<String, Object> detail
) {

    public enum ActorType {
        SYSTEM, USER, LLM
    }
}
