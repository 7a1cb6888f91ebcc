package com.hronboard.backend.modules.template.application;

import java.util.List;
import java.util.Map;

import com.hronboard.backend.modules.template.presentation.dto.TemplateItemRequest;

/**
 * Partial template update. A {@code null} field is left untouched.
 */
public record TemplatePatch(
        String name,
        String description,
        String category,
        Map<String, Object> templateData,
        List<String> tags,
        List<String> targetRoles,
        List<String> targetDepartments,
        List<String> complianceFrameworks,
        Integer estimatedDurationMinutes,
        List<TemplateItemRequest> items,
        String changesSummary
) {

    public boolean isEmpty() {
        return name == null
                && description == null
                && category == null
                && templateData == null
                && tags == null
                && targetRoles == null
                && targetDepartments == null
                && complianceFrameworks == null
                && estimatedDurationMinutes == null
                && items == null;
    }
}
