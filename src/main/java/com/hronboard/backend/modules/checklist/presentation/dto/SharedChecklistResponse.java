package com.hronboard.backend.modules.checklist.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import com.hronboard.backend.modules.checklist.domain.SharedChecklist;

public record SharedChecklistResponse(
        List<Map<String, Object>> checklist,
        String role,
        String department,
        OffsetDateTime createdAt
) {

    public static SharedChecklistResponse from(SharedChecklist shared) {
        return new SharedChecklistResponse(
                List.copyOf(shared.getItems()),
                shared.getRole(),
                shared.getDepartment(),
                shared.getCreatedAt()
        );
    }
}
