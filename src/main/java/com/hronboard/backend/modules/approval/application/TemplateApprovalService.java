package com.hronboard.backend.modules.approval.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hronboard.backend.global.common.PageInfo;
import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.access.application.AccessGuard;
import com.hronboard.backend.modules.access.domain.ResourceAccess;
import com.hronboard.backend.modules.approval.domain.ApprovalRequest;
import com.hronboard.backend.modules.approval.domain.ApprovalStatus;
import com.hronboard.backend.modules.approval.infrastructure.persistence.ApprovalRequestRepository;
import com.hronboard.backend.modules.approval.presentation.dto.ApprovalRequestDetailResponse;
import com.hronboard.backend.modules.approval.presentation.dto.ApprovalRequestListResponse;
import com.hronboard.backend.modules.approval.presentation.dto.ApprovalRequestResponse;
import com.hronboard.backend.modules.approval.presentation.dto.ApprovalTemplateRef;
import com.hronboard.backend.modules.audit.application.AuditLogService;
import com.hronboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hronboard.backend.modules.audit.domain.AuditAction;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.template.domain.ChecklistTemplate;
import com.hronboard.backend.modules.template.domain.TemplateCategory;
import com.hronboard.backend.modules.template.domain.TemplateStatus;
import com.hronboard.backend.modules.template.infrastructure.persistence.ChecklistTemplateRepository;
import com.hronboard.backend.modules.template.infrastructure.persistence.TemplateCategoryRepository;
import com.hronboard.backend.modules.template.presentation.dto.TemplateDtoMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Draft -> pending_approval -> approved | draft. Every transition updates the request and the
 * template together, so a failure leaves both untouched.
 */
@Service
@Transactional
public class TemplateApprovalService {

    private static final Logger log = LoggerFactory.getLogger(TemplateApprovalService.class);
    private static final String RESOURCE_TEMPLATE = "TEMPLATE";
    private static final int MAX_PAGE_SIZE = 100;

    static final String DEFAULT_SUBMIT_COMMENT = "Template submitted for approval";
    static final String DEFAULT_APPROVE_COMMENT = "Template approved";
    static final String DEFAULT_REJECT_COMMENT = "Template rejected";

    private final ApprovalRequestRepository approvalRequestRepository;
    private final ChecklistTemplateRepository templateRepository;
    private final TemplateCategoryRepository categoryRepository;
    private final AppUserRepository appUserRepository;
    private final ApproverSelector approverSelector;
    private final AccessGuard accessGuard;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public TemplateApprovalService(
            ApprovalRequestRepository approvalRequestRepository,
            ChecklistTemplateRepository templateRepository,
            TemplateCategoryRepository categoryRepository,
            AppUserRepository appUserRepository,
            ApproverSelector approverSelector,
            AccessGuard accessGuard,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.approvalRequestRepository = approvalRequestRepository;
        this.templateRepository = templateRepository;
        this.categoryRepository = categoryRepository;
        this.appUserRepository = appUserRepository;
        this.approverSelector = approverSelector;
        this.accessGuard = accessGuard;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public ApprovalRequestResponse submitForApproval(AuthenticatedUser requester, UUID templateId, String comments) {
        ChecklistTemplate template = templateRepository.findById(templateId)
                .filter(candidate -> candidate.getStatus() == TemplateStatus.DRAFT)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "approvals.template_not_draft",
                        "Template not found or not in draft status"));
        accessGuard.requireOwnerOr(requester, template, ResourceAccess.HR_PLUS);

        if (approvalRequestRepository.existsByTemplateIdAndStatus(templateId, ApprovalStatus.PENDING)) {
            throw duplicatePending();
        }

        AppUser approver = approverSelector.selectFor(requester.userId(), template.getCreatedBy().getId())
                .orElseThrow(() -> new ProblemException(ProblemKind.NO_APPROVER_AVAILABLE, "No available approvers found"));

        ApprovalRequest request = new ApprovalRequest(
                template,
                appUserRepository.getReferenceById(requester.userId()),
                approver,
                defaultIfBlank(comments, DEFAULT_SUBMIT_COMMENT)
        );
        template.setStatus(TemplateStatus.PENDING_APPROVAL);

        ApprovalRequest saved;
        try {
            saved = approvalRequestRepository.saveAndFlush(request);
        } catch (DataIntegrityViolationException ex) {
            // lost the race against a concurrent submission of the same template
            throw duplicatePending();
        }
        templateRepository.save(template);

        log.info("Template {} submitted by {} for approval by {}", templateId, requester.userId(), approver.getId());
        auditLogService.record(new AuditLogCommand(
                AuditAction.TEMPLATE_SUBMITTED, RESOURCE_TEMPLATE, templateId.toString(), requester.userId(),
                Map.of("approvalRequestId", saved.getId().toString(), "assignedTo", approver.getId().toString())));
        return toResponse(saved);
    }

    public ApprovalRequestResponse approve(AuthenticatedUser approver, UUID requestId, String comments) {
        ApprovalRequest request = findPendingAssignedTo(requestId, approver.userId());
        OffsetDateTime now = OffsetDateTime.now(clock);

        request.approve(defaultIfBlank(comments, DEFAULT_APPROVE_COMMENT), now);
        ChecklistTemplate template = request.getTemplate();
        template.setStatus(TemplateStatus.APPROVED);
        template.setApprovedBy(appUserRepository.getReferenceById(approver.userId()));
        template.setApprovedAt(now);

        approvalRequestRepository.save(request);
        templateRepository.save(template);

        log.info("Approval request {} approved by {}", requestId, approver.userId());
        auditLogService.record(new AuditLogCommand(
                AuditAction.TEMPLATE_APPROVED, RESOURCE_TEMPLATE, template.getId().toString(), approver.userId(),
                Map.of("approvalRequestId", requestId.toString(), "version", template.getVersion())));
        return toResponse(request);
    }

    public ApprovalRequestResponse reject(AuthenticatedUser approver, UUID requestId, String comments, String changesRequested) {
        ApprovalRequest request = findPendingAssignedTo(requestId, approver.userId());

        request.reject(defaultIfBlank(comments, DEFAULT_REJECT_COMMENT), changesRequested, OffsetDateTime.now(clock));
        ChecklistTemplate template = request.getTemplate();
        template.setStatus(TemplateStatus.DRAFT);

        approvalRequestRepository.save(request);
        templateRepository.save(template);

        log.info("Approval request {} rejected by {}", requestId, approver.userId());
        auditLogService.record(new AuditLogCommand(
                AuditAction.TEMPLATE_REJECTED, RESOURCE_TEMPLATE, template.getId().toString(), approver.userId(),
                Map.of("approvalRequestId", requestId.toString())));
        return toResponse(request);
    }

    @Transactional(readOnly = true)
    public ApprovalRequestListResponse getApprovalRequests(UUID assigneeId, ApprovalStatus status, int page, int limit) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        ApprovalStatus effectiveStatus = status == null ? ApprovalStatus.PENDING : status;

        Page<ApprovalRequest> result = approvalRequestRepository.findByAssignee(
                assigneeId,
                effectiveStatus,
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt"))
        );
        List<ApprovalRequestResponse> requests = result.getContent().stream()
                .map(this::toResponse)
                .toList();
        return new ApprovalRequestListResponse(requests, PageInfo.of(safePage, safeLimit, result.getTotalElements()));
    }

    /**
     * Visible to the requester, the assignee and any HR manager or admin. Anyone else gets a 404.
     */
    @Transactional(readOnly = true)
    public ApprovalRequestDetailResponse getApprovalRequestDetails(UUID requestId, AuthenticatedUser viewer) {
        ApprovalRequest request = approvalRequestRepository.findDetailedById(requestId)
                .filter(candidate -> viewer.role().isHrOrAdmin() || candidate.involves(viewer.userId()))
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "approvals.not_found",
                        "Approval request not found or insufficient permissions"));

        ChecklistTemplate template = templateRepository.findDetailedById(request.getTemplate().getId())
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "templates.not_found", "Template not found"));
        TemplateCategory category = categoryOf(template);
        return new ApprovalRequestDetailResponse(
                ApprovalRequestResponse.of(request, ApprovalTemplateRef.of(template, category)),
                TemplateDtoMapper.toDetail(template, category, true)
        );
    }

    @Transactional(readOnly = true)
    public List<ApprovalRequestResponse> getTemplateApprovalHistory(UUID templateId) {
        if (!templateRepository.existsById(templateId)) {
            throw new ProblemException(ProblemKind.NOT_FOUND, "templates.not_found", "Template not found");
        }
        return approvalRequestRepository.findHistoryByTemplateId(templateId).stream()
                .map(request -> ApprovalRequestResponse.of(request, null))
                .toList();
    }

    private ApprovalRequest findPendingAssignedTo(UUID requestId, UUID approverId) {
        return approvalRequestRepository.findAssignedWithStatus(requestId, approverId, ApprovalStatus.PENDING)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "approvals.not_found",
                        "Approval request not found or not assigned to you"));
    }

    private ApprovalRequestResponse toResponse(ApprovalRequest request) {
        ChecklistTemplate template = request.getTemplate();
        return ApprovalRequestResponse.of(request, ApprovalTemplateRef.of(template, categoryOf(template)));
    }

    private TemplateCategory categoryOf(ChecklistTemplate template) {
        return categoryRepository.findByName(template.getCategory()).orElse(null);
    }

    private static ProblemException duplicatePending() {
        return new ProblemException(ProblemKind.CONFLICT, "approvals.already_pending",
                "Template already has a pending approval request");
    }

    private static String defaultIfBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
