package com.hronboard.backend.modules.template.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.hronboard.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "template_item")
public class TemplateItem extends AbstractTimestampedEntity {

    public static final int DEFAULT_DURATION_MINUTES = 30;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private ChecklistTemplate template;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "category", length = 50)
    private String category;

    @Column(name = "is_required", nullable = false)
    private boolean required = true;

    @Column(name = "estimated_duration_minutes", nullable = false)
    private int estimatedDurationMinutes = DEFAULT_DURATION_MINUTES;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "assignee_role", length = 50)
    private String assigneeRole;

    @Column(name = "due_days_from_start")
    private Integer dueDaysFromStart;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "dependencies", nullable = false, columnDefinition = "jsonb")
    private List<String> dependencies = new ArrayList<>();

    @Column(name = "instructions")
    private String instructions;

    @Column(name = "success_criteria")
    private String successCriteria;

    @Column(name = "attachments_required", nullable = false)
    private boolean attachmentsRequired;

    @Column(name = "approval_required", nullable = false)
    private boolean approvalRequired;

    public UUID getId() {
        return id;
    }

    public ChecklistTemplate getTemplate() {
        return template;
    }

    void setTemplate(ChecklistTemplate template) {
        this.template = template;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }

    public int getEstimatedDurationMinutes() {
        return estimatedDurationMinutes;
    }

    public void setEstimatedDurationMinutes(int estimatedDurationMinutes) {
        this.estimatedDurationMinutes = estimatedDurationMinutes;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(int sortOrder) {
        this.sortOrder = sortOrder;
    }

    public String getAssigneeRole() {
        return assigneeRole;
    }

    public void setAssigneeRole(String assigneeRole) {
        this.assigneeRole = assigneeRole;
    }

    public Integer getDueDaysFromStart() {
        return dueDaysFromStart;
    }

    public void setDueDaysFromStart(Integer dueDaysFromStart) {
        this.dueDaysFromStart = dueDaysFromStart;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies == null ? new ArrayList<>() : new ArrayList<>(dependencies);
    }

    public String getInstructions() {
        return instructions;
    }

    public void setInstructions(String instructions) {
        this.instructions = instructions;
    }

    public String getSuccessCriteria() {
        return successCriteria;
    }

    public void setSuccessCriteria(String successCriteria) {
        this.successCriteria = successCriteria;
    }

    public boolean isAttachmentsRequired() {
        return attachmentsRequired;
    }

    public void setAttachmentsRequired(boolean attachmentsRequired) {
        this.attachmentsRequired = attachmentsRequired;
    }

    public boolean isApprovalRequired() {
        return approvalRequired;
    }

    public void setApprovalRequired(boolean approvalRequired) {
        this.approvalRequired = approvalRequired;
    }

    /**
     * Detached copy for cloning; the template link is set when added to the new owner.
     */
    public TemplateItem copy() {
        TemplateItem copy = new TemplateItem();
        copy.title = title;
        copy.description = description;
        copy.category = category;
        copy.required = required;
        copy.estimatedDurationMinutes = estimatedDurationMinutes;
        copy.sortOrder = sortOrder;
        copy.assigneeRole = assigneeRole;
        copy.dueDaysFromStart = dueDaysFromStart;
        copy.dependencies = new ArrayList<>(dependencies);
        copy.instructions = instructions;
        copy.successCriteria = successCriteria;
        copy.attachmentsRequired = attachmentsRequired;
        copy.approvalRequired = approvalRequired;
        return copy;
    }
}
