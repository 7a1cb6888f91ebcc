package com.hronboard.backend.modules.template.infrastructure.persistence;

import com.hronboard.backend.modules.template.domain.TemplateStatus;

public record ChecklistTemplateSearchCondition(
        TemplateStatus status,
        String category,
        String keyword,
        TemplateSortField sortField,
        boolean ascending
) {

    public ChecklistTemplateSearchCondition {
        sortField = sortField == null ? TemplateSortField.UPDATED_AT : sortField;
    }
}
