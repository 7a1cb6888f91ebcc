package com.hronboard.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.hronboard.backend.modules.audit.domain.AuditAction;
import com.hronboard.backend.modules.audit.domain.AuditLog;
import com.hronboard.backend.modules.audit.infrastructure.AuditLogRepository;
import com.hronboard.backend.modules.auth.domain.AppUser;

import jakarta.persistence.EntityManager;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private static final String REQUEST_ID_MDC_KEY = "requestId";

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    /**
     * Joins the caller's transaction so the entry commits or rolls back with the change it describes.
     */
    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());

        if (command.actorUserId() != null) {
            AppUser actorReference = entityManager.getReference(AppUser.class, command.actorUserId());
            auditLog.setActor(actorReference);
        }

        auditLog.setRequestId(MDC.get(REQUEST_ID_MDC_KEY));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            AuditAction actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            Map<String, Object> detail
    ) {
    }
}
