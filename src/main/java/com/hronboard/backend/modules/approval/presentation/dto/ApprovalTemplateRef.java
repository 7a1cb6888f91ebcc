package com.hronboard.backend.modules.approval.presentation.dto;

import java.util.UUID;

import com.hronboard.backend.modules.template.domain.ChecklistTemplate;
import com.hronboard.backend.modules.template.domain.TemplateCategory;
import com.hronboard.backend.modules.template.domain.TemplateStatus;
import com.hronboard.backend.modules.template.presentation.dto.CategoryDisplay;

public record ApprovalTemplateRef(
        UUID id,
        String name,
        String description,
        CategoryDisplay category,
        int version,
        TemplateStatus status
) {

    public static ApprovalTemplateRef of(ChecklistTemplate template, TemplateCategory category) {
        return new ApprovalTemplateRef(
                template.getId(),
                template.getName(),
                template.getDescription(),
                CategoryDisplay.of(template.getCategory(), category),
                template.getVersion(),
                template.getStatus()
        );
    }
}
