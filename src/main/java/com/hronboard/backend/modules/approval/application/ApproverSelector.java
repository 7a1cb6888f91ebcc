package com.hronboard.backend.modules.approval.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.stereotype.Component;

/**
 * Picks the reviewer for a submission: the longest-standing active admin, otherwise the
 * longest-standing active HR manager. Neither the requester nor the template's creator is chosen.
 */
@Component
public class ApproverSelector {

    private static final List<UserRole> APPROVER_ROLES = List.of(UserRole.ADMIN, UserRole.HR_MANAGER);

    private final AppUserRepository appUserRepository;

    public ApproverSelector(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    public Optional<AppUser> selectFor(UUID requesterId, UUID creatorId) {
        List<UUID> excluded = List.of(requesterId, creatorId);
        for (UserRole role : APPROVER_ROLES) {
            Optional<AppUser> candidate =
                    appUserRepository.findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(role, excluded);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }
}
