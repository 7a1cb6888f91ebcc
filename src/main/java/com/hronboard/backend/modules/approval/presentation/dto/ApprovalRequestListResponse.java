package com.hronboard.backend.modules.approval.presentation.dto;

import java.util.List;

import com.hronboard.backend.global.common.PageInfo;

public record ApprovalRequestListResponse(List<ApprovalRequestResponse> approvalRequests, PageInfo pagination) {
}
