package com.lucidreview.repository;

import com.lucidreview.entity.AgentToolCall;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link AgentToolCall} entities.
 */
public interface AgentToolCallRepository extends JpaRepository<AgentToolCall, UUID> {

    List<AgentToolCall> findByRun_IdOrderByTurnNumberAscCallIndexAsc(UUID runId);
}
