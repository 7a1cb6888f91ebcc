package com.hronboard.backend.modules.template.infrastructure.persistence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.hronboard.backend.modules.template.domain.ChecklistTemplate;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class ChecklistTemplateRepositoryImpl implements ChecklistTemplateRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<ChecklistTemplate> searchTemplates(ChecklistTemplateSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.status() != null) {
            whereClauses.add("ct.status = :status");
            params.put("status", condition.status().getCode());
        }

        if (StringUtils.hasText(condition.category())) {
            whereClauses.add("ct.category = :category");
            params.put("category", condition.category().trim());
        }

        if (StringUtils.hasText(condition.keyword())) {
            whereClauses.add("(lower(ct.name) like :keyword"
                    + " OR lower(coalesce(ct.description, '')) like :keyword"
                    + " OR lower(cast(ct.tags as text)) like :keyword)");
            params.put("keyword", "%" + condition.keyword().trim().toLowerCase(Locale.ROOT) + "%");
        }

        String whereSql = whereClauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", whereClauses);

        Query countQuery = entityManager.createNativeQuery("SELECT COUNT(*) FROM checklist_template ct" + whereSql);
        params.forEach(countQuery::setParameter);
        Number total = (Number) countQuery.getSingleResult();

        String direction = condition.ascending() ? "ASC" : "DESC";
        String dataSql = "SELECT ct.id FROM checklist_template ct" + whereSql
                + " ORDER BY " + condition.sortField().getColumn() + " " + direction + ", ct.id"
                + " LIMIT :limit OFFSET :offset";

        Query dataQuery = entityManager.createNativeQuery(dataSql);
        params.forEach(dataQuery::setParameter);
        dataQuery.setParameter("limit", pageable.getPageSize());
        dataQuery.setParameter("offset", (long) pageable.getPageNumber() * pageable.getPageSize());

        @SuppressWarnings("unchecked")
        List<Object> rawIds = dataQuery.getResultList();
        List<UUID> ids = rawIds.stream()
                .map(value -> value instanceof UUID uuid ? uuid : UUID.fromString(value.toString()))
                .toList();

        if (ids.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, total.longValue());
        }

        List<ChecklistTemplate> templates = new ArrayList<>(entityManager.createQuery("""
                        select ct
                          from ChecklistTemplate ct
                          left join fetch ct.createdBy
                          left join fetch ct.approvedBy
                         where ct.id in :ids
                        """, ChecklistTemplate.class)
                .setParameter("ids", ids)
                .getResultList());

        Map<UUID, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }
        templates.sort(Comparator.comparingInt(template -> index.getOrDefault(template.getId(), Integer.MAX_VALUE)));

        return new PageImpl<>(templates, pageable, total.longValue());
    }
}
