package com.lucidreview.orchestration.service;

import com.lucidreview.entity.AuditEvent;
import com.lucidreview.orchestration.api.AuditTrail;
import com.lucidreview.orchestration.model.AuditEventView;
import com.lucidreview.orchestration.model.AuditRecord;
import com.lucidreview.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService implements AuditTrail {

    private final AuditEventRepository auditEventRepository;
    private final JsonProcessingService jsonProcessingService;

    @Override
    public void record(AuditRecord event) {
        BestEffort.run("audit " + event.eventType(), () -> {
            auditEventRepository.save(AuditEvent.builder()
                    .caseNumber(event.caseNumber())
                    .eventType(event.eventType().name())
                    .actorType(event.actorType().name())
                    .actorId(event.actorId())
                    .detailJson(jsonProcessingService.toJsonOrNull(event.detail()))
                    .build());
            log.debug("Audit {} recorded for case {}", event.eventType(), event.caseNumber());
        });
    }

    @Override
    public List<AuditEventView> forCase(String caseNumber) {
        return auditEventRepository.findByCaseNumberOrderByCreatedAtAsc(caseNumber).stream()
                .map(row -> new AuditEventView(
                        row.getId(),
                        row.getCaseNumber(),
                        row.getEventType(),
                        row.getActorType(),
                        row.getActorId(),
                        jsonProcessingService.readTree(row.getDetailJson()),
                        row.getCreatedAt()))
                .toList();
    }
}
