package com.hronboard.backend.modules.template.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.template.domain.TemplateCategory;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TemplateCategoryRepository extends JpaRepository<TemplateCategory, UUID> {

    List<TemplateCategory> findByActiveTrueOrderBySortOrderAsc();

    Optional<TemplateCategory> findByName(String name);

    boolean existsByNameAndActiveTrue(String name);
}
