package com.hronboard.backend.modules.checklist.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.checklist.domain.SharedChecklist;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SharedChecklistRepository extends JpaRepository<SharedChecklist, UUID> {

    Optional<SharedChecklist> findBySlug(String slug);

    boolean existsBySlug(String slug);
}
