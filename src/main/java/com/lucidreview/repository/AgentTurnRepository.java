package com.lucidreview.repository;

import com.lucidreview.entity.AgentTurn;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link AgentTurn} entities.
 */
public interface AgentTurnRepository extends JpaRepository<AgentTurn, UUID> {

    List<AgentTurn> findByRun_IdOrderByTurnNumberAsc(UUID runId);
}
