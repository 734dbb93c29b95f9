package com.lucidreview.repository;

import com.lucidreview.entity.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link AuditEvent} entities.
 */
public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findByCaseNumberOrderByCreatedAtAsc(String caseNumber);
}
