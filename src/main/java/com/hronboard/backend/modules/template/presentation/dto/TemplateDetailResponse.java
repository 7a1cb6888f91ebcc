package com.hronboard.backend.modules.template.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hronboard.backend.modules.auth.presentation.dto.UserSummaryResponse;
import com.hronboard.backend.modules.template.domain.TemplateStatus;

/**
 * {@code items} is omitted when the caller asked for the template without its items.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemplateDetailResponse(
        UUID id,
        String name,
        String description,
        CategoryDisplay category,
        int version,
        TemplateStatus status,
        UserSummaryResponse createdBy,
        UserSummaryResponse approvedBy,
        OffsetDateTime approvedAt,
        Map<String, Object> templateData,
        List<String> tags,
        List<String> targetRoles,
        List<String> targetDepartments,
        List<String> complianceFrameworks,
        Integer estimatedDurationMinutes,
        List<TemplateItemResponse> items,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
