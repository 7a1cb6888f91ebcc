package com.hronboard.backend.modules.template.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.hronboard.backend.modules.template.domain.TemplateVersionHistory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TemplateVersionHistoryRepository extends JpaRepository<TemplateVersionHistory, UUID> {

    @Query("""
            select h
              from TemplateVersionHistory h
              left join fetch h.createdBy
             where h.template.id = :templateId
             order by h.versionNumber desc, h.createdAt desc
            """)
    List<TemplateVersionHistory> findByTemplateId(@Param("templateId") UUID templateId);
}
