package com.hronboard.backend.modules.approval.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hronboard.backend.modules.approval.domain.ApprovalRequest;
import com.hronboard.backend.modules.approval.domain.ApprovalStatus;
import com.hronboard.backend.modules.auth.presentation.dto.UserSummaryResponse;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalRequestResponse(
        UUID id,
        UUID templateId,
        ApprovalTemplateRef template,
        ApprovalStatus status,
        String comments,
        String changesRequested,
        UserSummaryResponse requestedBy,
        UserSummaryResponse assignedTo,
        OffsetDateTime respondedAt,
        OffsetDateTime createdAt
) {

    public static ApprovalRequestResponse of(ApprovalRequest request, ApprovalTemplateRef template) {
        return new ApprovalRequestResponse(
                request.getId(),
                request.getTemplate().getId(),
                template,
                request.getStatus(),
                request.getComments(),
                request.getChangesRequested(),
                UserSummaryResponse.from(request.getRequestedBy()),
                UserSummaryResponse.from(request.getAssignedTo()),
                request.getRespondedAt(),
                request.getCreatedAt()
        );
    }
}
