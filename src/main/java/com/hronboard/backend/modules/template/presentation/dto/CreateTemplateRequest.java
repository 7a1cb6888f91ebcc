package com.hronboard.backend.modules.template.presentation.dto;

import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateTemplateRequest(
        @NotBlank @Size(max = 200) String name,
        String description,
        @NotBlank @Size(max = 50) String category,
        Map<String, Object> templateData,
        List<String> tags,
        List<String> targetRoles,
        List<String> targetDepartments,
        List<String> complianceFrameworks,
        @PositiveOrZero Integer estimatedDurationMinutes,
        @Valid List<TemplateItemRequest> items
) {
}
