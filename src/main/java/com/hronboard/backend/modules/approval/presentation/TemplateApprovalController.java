package com.hronboard.backend.modules.approval.presentation;

import java.util.List;
import java.util.UUID;

import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.global.security.SecurityUtils;
import com.hronboard.backend.modules.approval.application.TemplateApprovalService;
import com.hronboard.backend.modules.approval.domain.ApprovalStatus;
import com.hronboard.backend.modules.approval.presentation.dto.ApprovalRequestDetailResponse;
import com.hronboard.backend.modules.approval.presentation.dto.ApprovalRequestListResponse;
import com.hronboard.backend.modules.approval.presentation.dto.ApprovalRequestResponse;
import com.hronboard.backend.modules.approval.presentation.dto.ApproveRequest;
import com.hronboard.backend.modules.approval.presentation.dto.RejectRequest;
import com.hronboard.backend.modules.approval.presentation.dto.SubmitForApprovalRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/template-approval")
@Tag(name = "Template Approval")
public class TemplateApprovalController {

    private final TemplateApprovalService approvalService;

    public TemplateApprovalController(TemplateApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @PostMapping("/templates/{templateId}/submit")
    @Operation(summary = "Submit a draft template for review")
    public ResponseEntity<ApprovalRequestResponse> submit(
            @PathVariable UUID templateId,
            @Valid @RequestBody(required = false) SubmitForApprovalRequest request
    ) {
        String comments = request == null ? null : request.comments();
        ApprovalRequestResponse created =
                approvalService.submitForApproval(SecurityUtils.getCurrentPrincipal(), templateId, comments);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/requests")
    @Operation(summary = "Approval requests assigned to the current user")
    public ApprovalRequestListResponse requests(
            @RequestParam(value = "status", defaultValue = "pending") ApprovalStatus status,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "10") int limit
    ) {
        return approvalService.getApprovalRequests(SecurityUtils.getCurrentUserId(), status, page, limit);
    }

    @GetMapping("/requests/{requestId}")
    public ApprovalRequestDetailResponse details(@PathVariable UUID requestId) {
        return approvalService.getApprovalRequestDetails(requestId, SecurityUtils.getCurrentPrincipal());
    }

    @PostMapping("/requests/{requestId}/approve")
    public ApprovalRequestResponse approve(
            @PathVariable UUID requestId,
            @Valid @RequestBody(required = false) ApproveRequest request
    ) {
        AuthenticatedUser principal = SecurityUtils.getCurrentPrincipal();
        return approvalService.approve(principal, requestId, request == null ? null : request.comments());
    }

    @PostMapping("/requests/{requestId}/reject")
    public ApprovalRequestResponse reject(
            @PathVariable UUID requestId,
            @Valid @RequestBody(required = false) RejectRequest request
    ) {
        AuthenticatedUser principal = SecurityUtils.getCurrentPrincipal();
        String comments = request == null ? null : request.comments();
        String changesRequested = request == null ? null : request.changesRequested();
        return approvalService.reject(principal, requestId, comments, changesRequested);
    }

    @GetMapping("/templates/{templateId}/history")
    @Operation(summary = "Every approval round of a template, newest first")
    public List<ApprovalRequestResponse> history(@PathVariable UUID templateId) {
        return approvalService.getTemplateApprovalHistory(templateId);
    }
}
