package com.hronboard.backend.modules.template.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record TemplateItemRequest(
        @NotBlank @Size(max = 200) String title,
        String description,
        @Size(max = 50) String category,
        Boolean required,
        @PositiveOrZero Integer estimatedDurationMinutes,
        @PositiveOrZero Integer sortOrder,
        @Size(max = 50) String assigneeRole,
        @PositiveOrZero Integer dueDaysFromStart,
        List<String> dependencies,
        String instructions,
        String successCriteria,
        Boolean attachmentsRequired,
        Boolean approvalRequired
) {
}
