package com.hronboard.backend.modules.template.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.hronboard.backend.modules.template.domain.TemplateItem;

public record TemplateItemResponse(
        UUID id,
        String title,
        String description,
        String category,
        boolean required,
        int estimatedDurationMinutes,
        int sortOrder,
        String assigneeRole,
        Integer dueDaysFromStart,
        List<String> dependencies,
        String instructions,
        String successCriteria,
        boolean attachmentsRequired,
        boolean approvalRequired
) {

    public static TemplateItemResponse from(TemplateItem item) {
        return new TemplateItemResponse(
                item.getId(),
                item.getTitle(),
                item.getDescription(),
                item.getCategory(),
                item.isRequired(),
                item.getEstimatedDurationMinutes(),
                item.getSortOrder(),
                item.getAssigneeRole(),
                item.getDueDaysFromStart(),
                List.copyOf(item.getDependencies()),
                item.getInstructions(),
                item.getSuccessCriteria(),
                item.isAttachmentsRequired(),
                item.isApprovalRequired()
        );
    }
}
