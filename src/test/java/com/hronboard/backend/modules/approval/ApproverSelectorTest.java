package com.hronboard.backend.modules.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.modules.approval.application.ApproverSelector;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.support.TestFixtures;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApproverSelectorTest {

    @Mock
    private AppUserRepository appUserRepository;

    @InjectMocks
    private ApproverSelector selector;

    private final UUID requesterId = UUID.randomUUID();
    private final UUID creatorId = UUID.randomUUID();

    @Test
    void prefersAnAdmin() {
        AppUser admin = TestFixtures.user(UUID.randomUUID(), UserRole.ADMIN, "admin@example.com");
        when(appUserRepository.findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(
                UserRole.ADMIN, List.of(requesterId, creatorId)))
                .thenReturn(Optional.of(admin));

        assertThat(selector.selectFor(requesterId, creatorId)).contains(admin);
    }

    @Test
    void fallsBackToHrManager() {
        AppUser hr = TestFixtures.user(UUID.randomUUID(), UserRole.HR_MANAGER, "hr@example.com");
        when(appUserRepository.findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(
                UserRole.ADMIN, List.of(requesterId, creatorId)))
                .thenReturn(Optional.empty());
        when(appUserRepository.findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(
                UserRole.HR_MANAGER, List.of(requesterId, creatorId)))
                .thenReturn(Optional.of(hr));

        assertThat(selector.selectFor(requesterId, creatorId)).contains(hr);
    }

    @Test
    void excludesBothRequesterAndCreator() {
        when(appUserRepository.findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(
                UserRole.ADMIN, List.of(requesterId, creatorId)))
                .thenReturn(Optional.empty());
        when(appUserRepository.findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(
                UserRole.HR_MANAGER, List.of(requesterId, creatorId)))
                .thenReturn(Optional.empty());

        assertThat(selector.selectFor(requesterId, creatorId)).isEmpty();
        verify(appUserRepository).findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(
                UserRole.ADMIN, List.of(requesterId, creatorId));
        verify(appUserRepository).findFirstByRoleAndActiveTrueAndIdNotInOrderByCreatedAtAsc(
                UserRole.HR_MANAGER, List.of(requesterId, creatorId));
    }
}
