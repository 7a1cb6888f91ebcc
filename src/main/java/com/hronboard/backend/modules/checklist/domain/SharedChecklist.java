package com.hronboard.backend.modules.checklist.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hronboard.backend.global.jpa.AbstractCreatedEntity;
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
 * A checklist snapshot published under a public slug. Items are stored as submitted.
 */
@Entity
@Table(name = "shared_checklist")
public class SharedChecklist extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "slug", nullable = false, updatable = false, length = 50)
    private String slug;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "checklist", nullable = false, columnDefinition = "jsonb")
    private List<Map<String, Object>> items = new ArrayList<>();

    @Column(name = "role", length = 200)
    private String role;

    @Column(name = "department", length = 200)
    private String department;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    private AppUser createdBy;

    protected SharedChecklist() {
    }

    public SharedChecklist(String slug, List<Map<String, Object>> items, String role, String department, AppUser createdBy) {
        this.slug = slug;
        this.items = new ArrayList<>(items);
        this.role = role;
        this.department = department;
        this.createdBy = createdBy;
    }

    public UUID getId() {
        return id;
    }

    public String getSlug() {
        return slug;
    }

    public List<Map<String, Object>> getItems() {
        return items;
    }

    public String getRole() {
        return role;
    }

    public String getDepartment() {
        return department;
    }

    public AppUser getCreatedBy() {
        return createdBy;
    }
}
