package com.hronboard.backend.modules.template.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.template.domain.ChecklistTemplate;
import com.hronboard.backend.modules.template.domain.TemplateStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChecklistTemplateRepository extends JpaRepository<ChecklistTemplate, UUID>, ChecklistTemplateRepositoryCustom {

    @Query("""
            select distinct ct
              from ChecklistTemplate ct
              left join fetch ct.createdBy
              left join fetch ct.approvedBy
              left join fetch ct.items
             where ct.id = :templateId
            """)
    Optional<ChecklistTemplate> findDetailedById(@Param("templateId") UUID templateId);

    @Query("""
            select ct.category as category, count(ct) as templateCount
              from ChecklistTemplate ct
             where ct.status = :status
             group by ct.category
            """)
    List<CategoryCountProjection> countByCategoryAndStatus(@Param("status") TemplateStatus status);

    interface CategoryCountProjection {

        String getCategory();

        long getTemplateCount();
    }
}
