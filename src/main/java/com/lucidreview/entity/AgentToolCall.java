package com.lucidreview.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "agent_tool_call", indexes = {
        @Index(name = "idx_agent_tool_call_run", columnList = "run_id"),
        @Index(name = "idx_agent_tool_call_name", columnList = "tool_name")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentToolCall {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private AgentRun run;

    @Column(name = "turn_number", nullable = false)
    private int turnNumber;

    @Column(name = "call_index", nullable = false)
    private int callIndex;

    @Column(name = "tool_use_id", length = 100, nullable = false)
    private String toolUseId;

    @Column(name = "tool_name", length = 100, nullable = false)
    private String toolName;

    @Column(name = "input", columnDefinition = "TEXT", nullable = false)
    private String input;

    @Column(name = "output", columnDefinition = "TEXT")
    private String output;

    @Column(name = "latency_ms")
    private Long latencyMs;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
