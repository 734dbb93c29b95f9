package com.lucidreview.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "agent_run", indexes = {
        @Index(name = "idx_agent_run_case", columnList = "case_number"),
        @Index(name = "idx_agent_run_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentRun {

    @Id
    private UUID id;

    @Column(name = "case_number", length = 50, nullable = false)
    private String caseNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private RunStatus status;

    @Column(name = "model_id", length = 100, nullable = false)
    private String modelId;

    @Column(name = "prompt_version", length = 50)
    private String promptVersion;

    @Builder.Default
    @Column(name = "total_turns", nullable = false)
    private int totalTurns = 0;

    @Column(name = "determination", columnDefinition = "TEXT")
    private String determination;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Builder.Default
    @Column(name = "input_tokens_total", nullable = false)
    private long inputTokensTotal = 0;

    @Builder.Default
    @Column(name = "output_tokens_total", nullable = false)
    private long outputTokensTotal = 0;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}
