package com.hronboard.backend.modules.checklist.presentation.dto;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ShareChecklistRequest(
        @NotNull(message = "Valid checklist array is required")
        @Size(max = 500) List<@NotNull Map<String, Object>> checklist,
        @Size(max = 200) String role,
        @Size(max = 200) String department
) {
}
