package com.hronboard.backend.modules.approval.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hronboard.backend.global.jpa.AbstractTimestampedEntity;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.template.domain.ChecklistTemplate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One round of review for a template. Only a {@code pending} request can be decided.
 */
@Entity
@Table(name = "template_approval_request")
public class ApprovalRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private ChecklistTemplate template;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "requested_by", nullable = false)
    private AppUser requestedBy;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_to", nullable = false)
    private AppUser assignedTo;

    @Column(name = "status", nullable = false, length = 16)
    private ApprovalStatus status = ApprovalStatus.PENDING;

    @Column(name = "comments")
    private String comments;

    @Column(name = "changes_requested")
    private String changesRequested;

    @Column(name = "responded_at")
    private OffsetDateTime respondedAt;

    protected ApprovalRequest() {
    }

    public ApprovalRequest(ChecklistTemplate template, AppUser requestedBy, AppUser assignedTo, String comments) {
        this.template = template;
        this.requestedBy = requestedBy;
        this.assignedTo = assignedTo;
        this.comments = comments;
        this.status = ApprovalStatus.PENDING;
    }

    public UUID getId() {
        return id;
    }

    public ChecklistTemplate getTemplate() {
        return template;
    }

    public AppUser getRequestedBy() {
        return requestedBy;
    }

    public AppUser getAssignedTo() {
        return assignedTo;
    }

    public ApprovalStatus getStatus() {
        return status;
    }

    public String getComments() {
        return comments;
    }

    public String getChangesRequested() {
        return changesRequested;
    }

    public OffsetDateTime getRespondedAt() {
        return respondedAt;
    }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }

    public boolean involves(UUID userId) {
        return userId != null
                && (userId.equals(requestedBy.getId()) || userId.equals(assignedTo.getId()));
    }

    public void approve(String comments, OffsetDateTime now) {
        requirePending();
        this.status = ApprovalStatus.APPROVED;
        this.comments = comments;
        this.respondedAt = now;
    }

    public void reject(String comments, String changesRequested, OffsetDateTime now) {
        requirePending();
        this.status = ApprovalStatus.REJECTED;
        this.comments = comments;
        this.changesRequested = changesRequested;
        this.respondedAt = now;
    }

    private void requirePending() {
        if (!isPending()) {
            throw new IllegalStateException("Approval request " + id + " is already " + status.getCode());
        }
    }
}
