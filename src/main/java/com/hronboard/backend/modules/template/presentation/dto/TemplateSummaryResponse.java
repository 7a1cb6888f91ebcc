package com.hronboard.backend.modules.template.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hronboard.backend.modules.auth.presentation.dto.UserSummaryResponse;
import com.hronboard.backend.modules.template.domain.TemplateStatus;

public record TemplateSummaryResponse(
        UUID id,
        String name,
        String description,
        CategoryDisplay category,
        int version,
        TemplateStatus status,
        UserSummaryResponse createdBy,
        UserSummaryResponse approvedBy,
        OffsetDateTime approvedAt,
        List<String> tags,
        Integer estimatedDurationMinutes,
        long itemCount,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
