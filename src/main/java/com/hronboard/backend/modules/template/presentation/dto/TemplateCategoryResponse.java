package com.hronboard.backend.modules.template.presentation.dto;

public record TemplateCategoryResponse(
        String name,
        String displayName,
        String description,
        String icon,
        String color,
        int sortOrder,
        long templateCount
) {
}
