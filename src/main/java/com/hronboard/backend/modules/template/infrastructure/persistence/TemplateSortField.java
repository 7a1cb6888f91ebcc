package com.hronboard.backend.modules.template.infrastructure.persistence;

import java.util.Arrays;
import java.util.Optional;

/**
 * Columns a template listing may be ordered by. Anything else falls back to {@link #UPDATED_AT}.
 */
public enum TemplateSortField {

    NAME("name", "ct.name"),
    CATEGORY("category", "ct.category"),
    STATUS("status", "ct.status"),
    VERSION("version", "ct.version"),
    ESTIMATED_DURATION("estimatedDurationMinutes", "ct.estimated_duration_minutes"),
    CREATED_AT("createdAt", "ct.created_at"),
    UPDATED_AT("updatedAt", "ct.updated_at");

    private final String key;
    private final String column;

    TemplateSortField(String key, String column) {
        this.key = key;
        this.column = column;
    }

    public String getKey() {
        return key;
    }

    String getColumn() {
        return column;
    }

    /**
     * Accepts both the camelCase key and its snake_case column spelling.
     */
    public static Optional<TemplateSortField> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace("_", "").toLowerCase();
        return Arrays.stream(values())
                .filter(field -> field.key.toLowerCase().equals(normalized))
                .findFirst();
    }
}
