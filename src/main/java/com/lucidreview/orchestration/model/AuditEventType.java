package com.lucidreview.orchestration.model;

public enum AuditEventType {
    AGENT_RUN_QUEUED,
    AGENT_RUN_STARTED,
    AGENT_RUN_COMPLETED,
    AGENT_RUN_FAILED,
    AGENT_RUN_CANCELLED
}
