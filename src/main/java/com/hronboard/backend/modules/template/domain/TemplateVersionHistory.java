package com.hronboard.backend.modules.template.domain;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.AppUser;

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

/**
 * Snapshot of a template's content taken right before it was changed.
 */
@Entity
@Table(name = "template_version_history")
public class TemplateVersionHistory {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private ChecklistTemplate template;

    @Column(name = "version_number", nullable = false)
    private int versionNumber;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "template_data", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> templateData = new HashMap<>();

    @Column(name = "changes_summary")
    private String changesSummary;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by", nullable = false)
    private AppUser createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected TemplateVersionHistory() {
    }

    public static TemplateVersionHistory snapshotOf(
            ChecklistTemplate template,
            AppUser changedBy,
            String changesSummary,
            OffsetDateTime now
    ) {
        TemplateVersionHistory history = new TemplateVersionHistory();
        history.template = template;
        history.versionNumber = template.getVersion();
        history.name = template.getName();
        history.description = template.getDescription();
        history.templateData = new HashMap<>(template.getTemplateData());
        history.changesSummary = changesSummary;
        history.createdBy = changedBy;
        history.createdAt = now;
        return history;
    }

    public UUID getId() {
        return id;
    }

    public ChecklistTemplate getTemplate() {
        return template;
    }

    public int getVersionNumber() {
        return versionNumber;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getTemplateData() {
        return templateData;
    }

    public String getChangesSummary() {
        return changesSummary;
    }

    public AppUser getCreatedBy() {
        return createdBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
