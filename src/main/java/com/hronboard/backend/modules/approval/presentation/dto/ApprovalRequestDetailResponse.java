package com.hronboard.backend.modules.approval.presentation.dto;

import com.hronboard.backend.modules.template.presentation.dto.TemplateDetailResponse;

public record ApprovalRequestDetailResponse(ApprovalRequestResponse request, TemplateDetailResponse template) {
}
