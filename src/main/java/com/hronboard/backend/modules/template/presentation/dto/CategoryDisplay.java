package com.hronboard.backend.modules.template.presentation.dto;

import com.hronboard.backend.modules.template.domain.TemplateCategory;

public record CategoryDisplay(String name, String displayName, String icon, String color) {

    public static CategoryDisplay of(String name, TemplateCategory category) {
        if (category == null) {
            return new CategoryDisplay(name, name, null, null);
        }
        return new CategoryDisplay(category.getName(), category.getDisplayName(), category.getIcon(), category.getColor());
    }
}
