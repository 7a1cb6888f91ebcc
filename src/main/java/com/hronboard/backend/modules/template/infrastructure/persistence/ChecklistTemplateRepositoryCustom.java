package com.hronboard.backend.modules.template.infrastructure.persistence;

import com.hronboard.backend.modules.template.domain.ChecklistTemplate;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface ChecklistTemplateRepositoryCustom {

    Page<ChecklistTemplate> searchTemplates(ChecklistTemplateSearchCondition condition, Pageable pageable);
}
