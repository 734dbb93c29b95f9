package com.lucidreview.repository;

import com.lucidreview.entity.PromptVersion;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link PromptVersion} entities.
 */
public interface PromptVersionRepository extends JpaRepository<PromptVersion, UUID> {

    Optional<PromptVersion> findFirstByActiveTrueOrderByCreatedAtDesc();
}
