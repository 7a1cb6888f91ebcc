package com.hronboard.backend.modules.template.presentation.dto;

import java.util.List;

import com.hronboard.backend.modules.auth.presentation.dto.UserSummaryResponse;
import com.hronboard.backend.modules.template.domain.ChecklistTemplate;
import com.hronboard.backend.modules.template.domain.TemplateCategory;

public final class TemplateDtoMapper {

    private TemplateDtoMapper() {
    }

    public static TemplateSummaryResponse toSummary(ChecklistTemplate template, TemplateCategory category, long itemCount) {
        return new TemplateSummaryResponse(
                template.getId(),
                template.getName(),
                template.getDescription(),
                CategoryDisplay.of(template.getCategory(), category),
                template.getVersion(),
                template.getStatus(),
                UserSummaryResponse.from(template.getCreatedBy()),
                UserSummaryResponse.from(template.getApprovedBy()),
                template.getApprovedAt(),
                List.copyOf(template.getTags()),
                template.getEstimatedDurationMinutes(),
                itemCount,
                template.getCreatedAt(),
                template.getUpdatedAt()
        );
    }

    public static TemplateDetailResponse toDetail(ChecklistTemplate template, TemplateCategory category, boolean includeItems) {
        List<TemplateItemResponse> items = includeItems
                ? template.getItems().stream().map(TemplateItemResponse::from).toList()
                : null;
        return new TemplateDetailResponse(
                template.getId(),
                template.getName(),
                template.getDescription(),
                CategoryDisplay.of(template.getCategory(), category),
                template.getVersion(),
                template.getStatus(),
                UserSummaryResponse.from(template.getCreatedBy()),
                UserSummaryResponse.from(template.getApprovedBy()),
                template.getApprovedAt(),
                template.getTemplateData(),
                List.copyOf(template.getTags()),
                List.copyOf(template.getTargetRoles()),
                List.copyOf(template.getTargetDepartments()),
                List.copyOf(template.getComplianceFrameworks()),
                template.getEstimatedDurationMinutes(),
                items,
                template.getCreatedAt(),
                template.getUpdatedAt()
        );
    }
}
