package com.hronboard.backend.modules.users.application;

import java.util.Map;
import java.util.UUID;

import com.hronboard.backend.global.common.PageInfo;
import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.access.application.AccessGuard;
import com.hronboard.backend.modules.access.application.AccessPolicy;
import com.hronboard.backend.modules.access.application.AccessPolicy.UserAction;
import com.hronboard.backend.modules.access.domain.Permission;
import com.hronboard.backend.modules.audit.application.AuditLogService;
import com.hronboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hronboard.backend.modules.audit.domain.AuditAction;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;
import com.hronboard.backend.modules.users.presentation.dto.ChangePasswordRequest;
import com.hronboard.backend.modules.users.presentation.dto.ProfileResponse;
import com.hronboard.backend.modules.users.presentation.dto.UserListResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);
    private static final String RESOURCE_USER = "USER";
    private static final int MAX_PAGE_SIZE = 100;

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final AccessPolicy accessPolicy;
    private final AccessGuard accessGuard;
    private final AuditLogService auditLogService;

    public UserAccountService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            AccessPolicy accessPolicy,
            AccessGuard accessGuard,
            AuditLogService auditLogService
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.accessPolicy = accessPolicy;
        this.accessGuard = accessGuard;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public ProfileResponse getProfile(AuthenticatedUser actor) {
        AppUser user = findUser(actor.userId());
        boolean hrOrAdmin = user.getRole().isHrOrAdmin();
        ProfileResponse.Capabilities capabilities = new ProfileResponse.Capabilities(
                hrOrAdmin,
                accessPolicy.hasPermission(user.getRole(), Permission.CHECKLISTS_READ_ALL),
                accessPolicy.hasPermission(user.getRole(), Permission.TEMPLATES_CREATE),
                accessPolicy.hasPermission(user.getRole(), Permission.ANALYTICS_VIEW)
        );
        return new ProfileResponse(UserResponse.from(user), capabilities);
    }

    /**
     * Self-service edit: names, email and department only.
     */
    public UserResponse updateProfile(AuthenticatedUser actor, UserPatch patch) {
        UserPatch selfPatch = new UserPatch(patch.firstName(), patch.lastName(), patch.email(), patch.department(), null, null);
        if (selfPatch.isEmpty()) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "users.no_changes", "No valid fields to update");
        }
        AppUser user = findUser(actor.userId());
        applyProfileFields(user, selfPatch);
        return UserResponse.from(appUserRepository.save(user));
    }

    public void changePassword(AuthenticatedUser actor, ChangePasswordRequest request) {
        AppUser user = findUser(actor.userId());
        if (!passwordEncoder.matches(request.currentPassword(), user.getPasswordHash())) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "users.current_password_incorrect",
                    "Current password is incorrect");
        }
        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        appUserRepository.save(user);

        int revoked = actor.sessionId() != null
                ? userSessionRepository.deactivateOthersForUser(user.getId(), actor.sessionId())
                : userSessionRepository.deactivateAllForUser(user.getId());
        log.info("Password changed for user {}, {} other sessions deactivated", user.getId(), revoked);
        auditLogService.record(new AuditLogCommand(
                AuditAction.PASSWORD_CHANGED, RESOURCE_USER, user.getId().toString(), user.getId(),
                Map.of("revokedSessions", revoked)));
    }

    @Transactional(readOnly = true)
    public UserListResponse listUsers(UserRole role, Boolean active, int page, int limit) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        Page<AppUser> result = appUserRepository.search(
                role,
                active,
                PageRequest.of(safePage - 1, safeLimit, Sort.by(Sort.Direction.DESC, "createdAt"))
        );
        return new UserListResponse(
                result.getContent().stream().map(UserResponse::from).toList(),
                PageInfo.of(safePage, safeLimit, result.getTotalElements())
        );
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(AuthenticatedUser actor, UUID userId) {
        accessGuard.requireUserAccess(actor, userId, UserAction.VIEW);
        return UserResponse.from(findUser(userId));
    }

    public UserResponse updateUser(AuthenticatedUser actor, UUID userId, UserPatch patch) {
        accessGuard.requireUserAccess(actor, userId, UserAction.EDIT);
        if (patch.isEmpty()) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "users.no_changes", "No valid fields to update");
        }
        AppUser user = findUser(userId);

        if (patch.role() != null && patch.role() != user.getRole()) {
            accessGuard.requireRoleAssignment(actor, patch.role());
            // demoting someone above you is never allowed
            if (!accessPolicy.isRoleHigherOrEqual(actor.role(), user.getRole())) {
                throw new ProblemException(ProblemKind.FORBIDDEN, "users.role_hierarchy", "Insufficient role hierarchy");
            }
            user.setRole(patch.role());
        }

        if (patch.active() != null && patch.active() != user.isActive()) {
            if (userId.equals(actor.userId())) {
                throw new ProblemException(ProblemKind.VALIDATION_FAILED, "users.self_status_change",
                        "Cannot change the active flag of your own account");
            }
            accessGuard.requirePermission(actor, Permission.USERS_UPDATE_ALL);
            user.setActive(patch.active());
            if (!patch.active()) {
                userSessionRepository.deactivateAllForUser(userId);
            }
        }

        applyProfileFields(user, patch);
        AppUser saved = appUserRepository.save(user);
        auditLogService.record(new AuditLogCommand(
                AuditAction.USER_UPDATED, RESOURCE_USER, userId.toString(), actor.userId(),
                Map.of("role", saved.getRole().getCode(), "active", saved.isActive())));
        return UserResponse.from(saved);
    }

    public UserResponse deactivateUser(AuthenticatedUser actor, UUID userId) {
        if (userId.equals(actor.userId())) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "users.self_deactivation",
                    "Cannot deactivate your own account");
        }
        accessGuard.requireUserAccess(actor, userId, UserAction.DELETE);
        AppUser user = findUser(userId);
        user.setActive(false);
        AppUser saved = appUserRepository.save(user);
        int revoked = userSessionRepository.deactivateAllForUser(userId);

        log.info("User {} deactivated by {}, {} sessions revoked", userId, actor.userId(), revoked);
        auditLogService.record(new AuditLogCommand(
                AuditAction.USER_DEACTIVATED, RESOURCE_USER, userId.toString(), actor.userId(),
                Map.of("revokedSessions", revoked)));
        return UserResponse.from(saved);
    }

    private void applyProfileFields(AppUser user, UserPatch patch) {
        if (patch.email() != null) {
            String email = patch.email().trim().toLowerCase();
            if (!email.equals(user.getEmail()) && appUserRepository.existsByEmailIgnoreCaseAndIdNot(email, user.getId())) {
                throw new ProblemException(ProblemKind.CONFLICT, "users.email_taken", "Email is already in use");
            }
            user.setEmail(email);
        }
        if (patch.firstName() != null) {
            user.setFirstName(patch.firstName().trim());
        }
        if (patch.lastName() != null) {
            user.setLastName(patch.lastName().trim());
        }
        if (patch.department() != null) {
            user.setDepartment(patch.department().isBlank() ? null : patch.department().trim());
        }
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "users.not_found", "User not found"));
    }
}
