package com.hronboard.backend.modules.template.presentation.dto;

import java.util.List;
import java.util.Map;

import com.hronboard.backend.modules.template.application.TemplatePatch;

import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Every field is optional; {@code items}, when present, replaces the whole item list.
 */
public record UpdateTemplateRequest(
        @Size(min = 1, max = 200) String name,
        String description,
        @Size(min = 1, max = 50) String category,
        Map<String, Object> templateData,
        List<String> tags,
        List<String> targetRoles,
        List<String> targetDepartments,
        List<String> complianceFrameworks,
        @PositiveOrZero Integer estimatedDurationMinutes,
        @Valid List<TemplateItemRequest> items,
        @Size(max = 500) String changesSummary
) {

    public TemplatePatch toPatch() {
        return new TemplatePatch(
                name,
                description,
                category,
                templateData,
                tags,
                targetRoles,
                targetDepartments,
                complianceFrameworks,
                estimatedDurationMinutes,
                items,
                changesSummary
        );
    }
}
