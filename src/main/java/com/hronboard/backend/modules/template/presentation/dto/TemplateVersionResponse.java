package com.hronboard.backend.modules.template.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.hronboard.backend.modules.auth.presentation.dto.UserSummaryResponse;
import com.hronboard.backend.modules.template.domain.TemplateVersionHistory;

public record TemplateVersionResponse(
        UUID id,
        int versionNumber,
        String name,
        String description,
        Map<String, Object> templateData,
        String changesSummary,
        UserSummaryResponse createdBy,
        OffsetDateTime createdAt
) {

    public static TemplateVersionResponse from(TemplateVersionHistory history) {
        return new TemplateVersionResponse(
                history.getId(),
                history.getVersionNumber(),
                history.getName(),
                history.getDescription(),
                history.getTemplateData(),
                history.getChangesSummary(),
                UserSummaryResponse.from(history.getCreatedBy()),
                history.getCreatedAt()
        );
    }
}
