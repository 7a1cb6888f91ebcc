package com.hronboard.backend.modules.checklist.presentation.dto;

public record ShareChecklistResponse(String slug, String shareUrl) {
}
