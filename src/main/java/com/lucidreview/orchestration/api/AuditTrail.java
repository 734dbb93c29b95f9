package com.lucidreview.orchestration.api;

import com.lucidreview.orchestration.model.AuditEventView;
import com.lucidreview.orchestration.model.AuditRecord;

import java.util.List;

/**
 * Compliance audit log. Recording is fire-and-forget: a failed write is logged and dropped,
 * never surfaced to the caller.
 */
public interface AuditTrail {

    void record(AuditRecord event);

    List<AuditEventView> forCase(String caseNumber);
}
