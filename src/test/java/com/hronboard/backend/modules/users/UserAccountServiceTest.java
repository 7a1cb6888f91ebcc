package com.hronboard.backend.modules.users;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.access.application.AccessGuard;
import com.hronboard.backend.modules.access.application.AccessPolicy;
import com.hronboard.backend.modules.audit.application.AuditLogService;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;
import com.hronboard.backend.modules.users.application.UserAccountService;
import com.hronboard.backend.modules.users.application.UserPatch;
import com.hronboard.backend.modules.users.presentation.dto.ChangePasswordRequest;
import com.hronboard.backend.modules.users.presentation.dto.ProfileResponse;
import com.hronboard.backend.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class UserAccountServiceTest {

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private UserSessionRepository userSessionRepository;

    @Mock
    private AuditLogService auditLogService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private UserAccountService service;
    private AppUser admin;
    private AppUser hr;
    private AppUser employee;

    @BeforeEach
    void setUp() {
        AccessPolicy accessPolicy = new AccessPolicy();
        service = new UserAccountService(
                appUserRepository,
                userSessionRepository,
                passwordEncoder,
                accessPolicy,
                new AccessGuard(accessPolicy),
                auditLogService
        );
        admin = TestFixtures.user(UUID.randomUUID(), UserRole.ADMIN, "admin@example.com");
        hr = TestFixtures.user(UUID.randomUUID(), UserRole.HR_MANAGER, "hr@example.com");
        employee = TestFixtures.user(UUID.randomUUID(), UserRole.EMPLOYEE, "employee@example.com");

        for (AppUser user : new AppUser[] {admin, hr, employee}) {
            lenient().when(appUserRepository.findById(user.getId())).thenReturn(Optional.of(user));
        }
        lenient().when(appUserRepository.save(any(AppUser.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void profileCapabilitiesFollowRole() {
        ProfileResponse employeeProfile = service.getProfile(TestFixtures.principal(employee));
        ProfileResponse hrProfile = service.getProfile(TestFixtures.principal(hr));

        assertThat(employeeProfile.capabilities().canManageUsers()).isFalse();
        assertThat(employeeProfile.capabilities().canCreateTemplates()).isFalse();
        assertThat(hrProfile.capabilities().canManageUsers()).isTrue();
        assertThat(hrProfile.capabilities().canViewAnalytics()).isTrue();
    }

    @Test
    @DisplayName("profile update ignores role and active even when supplied")
    void profileUpdateCannotEscalate() {
        UserPatch patch = new UserPatch("Sam", null, null, "Finance", UserRole.ADMIN, false);

        UserResponse updated = service.updateProfile(TestFixtures.principal(employee), patch);

        assertThat(updated.firstName()).isEqualTo("Sam");
        assertThat(updated.department()).isEqualTo("Finance");
        assertThat(updated.role()).isEqualTo(UserRole.EMPLOYEE);
        assertThat(updated.active()).isTrue();
    }

    @Test
    void emptyProfileUpdateIsRejected() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updateProfile(TestFixtures.principal(employee), new UserPatch(null, null, null, null, UserRole.ADMIN, null)));

        assertThat(ex.getCode()).isEqualTo("users.no_changes");
    }

    @Test
    void changingEmailToTakenAddressConflicts() {
        when(appUserRepository.existsByEmailIgnoreCaseAndIdNot("hr@example.com", employee.getId())).thenReturn(true);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updateProfile(TestFixtures.principal(employee), new UserPatch(null, null, "HR@example.com", null, null, null)));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.CONFLICT);
    }

    @Test
    void changePasswordRequiresCurrentPasswordAndRevokesOtherSessions() {
        employee.setPasswordHash(passwordEncoder.encode("Old#Pass1"));
        AuthenticatedUser principal = TestFixtures.principal(employee);

        ProblemException wrong = assertThrows(ProblemException.class,
                () -> service.changePassword(principal, new ChangePasswordRequest("nope", "New#Pass22")));
        assertThat(wrong.getCode()).isEqualTo("users.current_password_incorrect");

        when(userSessionRepository.deactivateOthersForUser(employee.getId(), principal.sessionId())).thenReturn(2);
        service.changePassword(principal, new ChangePasswordRequest("Old#Pass1", "New#Pass22"));

        assertThat(passwordEncoder.matches("New#Pass22", employee.getPasswordHash())).isTrue();
        verify(userSessionRepository).deactivateOthersForUser(employee.getId(), principal.sessionId());
    }

    @Test
    void employeeCannotViewSomeoneElse() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.getUser(TestFixtures.principal(employee), hr.getId()));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
    }

    @Test
    void hrCannotPromoteToAdmin() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updateUser(TestFixtures.principal(hr), employee.getId(),
                        new UserPatch(null, null, null, null, UserRole.ADMIN, null)));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
        assertThat(employee.getRole()).isEqualTo(UserRole.EMPLOYEE);
    }

    @Test
    void hrCannotDemoteAnAdmin() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updateUser(TestFixtures.principal(hr), admin.getId(),
                        new UserPatch(null, null, null, null, UserRole.EMPLOYEE, null)));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
        assertThat(admin.getRole()).isEqualTo(UserRole.ADMIN);
    }

    @Test
    void resubmittingTheCurrentRoleNeedsNoAssignmentRight() {
        UserResponse updated = service.updateUser(TestFixtures.principal(employee), employee.getId(),
                new UserPatch("Jo", null, null, null, UserRole.EMPLOYEE, null));

        assertThat(updated.firstName()).isEqualTo("Jo");
        assertThat(updated.role()).isEqualTo(UserRole.EMPLOYEE);
    }

    @Test
    void adminPromotesEmployeeToHr() {
        UserResponse updated = service.updateUser(TestFixtures.principal(admin), employee.getId(),
                new UserPatch(null, null, null, null, UserRole.HR_MANAGER, null));

        assertThat(updated.role()).isEqualTo(UserRole.HR_MANAGER);
    }

    @Test
    void deactivationRevokesSessionsButNeverTargetsSelf() {
        ProblemException self = assertThrows(ProblemException.class,
                () -> service.deactivateUser(TestFixtures.principal(admin), admin.getId()));
        assertThat(self.getCode()).isEqualTo("users.self_deactivation");

        ProblemException hrAttempt = assertThrows(ProblemException.class,
                () -> service.deactivateUser(TestFixtures.principal(hr), employee.getId()));
        assertThat(hrAttempt.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
        verify(userSessionRepository, never()).deactivateAllForUser(employee.getId());

        UserResponse deactivated = service.deactivateUser(TestFixtures.principal(admin), employee.getId());

        assertThat(deactivated.active()).isFalse();
        verify(userSessionRepository).deactivateAllForUser(employee.getId());
    }
}
