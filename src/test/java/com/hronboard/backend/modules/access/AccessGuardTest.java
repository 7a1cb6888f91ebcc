package com.hronboard.backend.modules.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.UUID;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.access.application.AccessGuard;
import com.hronboard.backend.modules.access.application.AccessPolicy;
import com.hronboard.backend.modules.access.domain.Permission;
import com.hronboard.backend.modules.access.domain.ResourceAccess;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.template.domain.ChecklistTemplate;
import com.hronboard.backend.modules.template.domain.TemplateStatus;
import com.hronboard.backend.support.TestFixtures;

import org.junit.jupiter.api.Test;

class AccessGuardTest {

    private final AccessGuard guard = new AccessGuard(new AccessPolicy());

    @Test
    void missingActorIsUnauthorizedNotForbidden() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> guard.requirePermission(null, Permission.TEMPLATES_VIEW));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.UNAUTHORIZED);
    }

    @Test
    void missingPermissionNamesTheCapability() {
        AuthenticatedUser employee = new AuthenticatedUser(UUID.randomUUID(), "e@example.com", UserRole.EMPLOYEE, null, null);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> guard.requirePermission(employee, Permission.TEMPLATES_CREATE));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
        assertThat(ex.getDetailMessage()).contains("templates:create");
    }

    @Test
    void ownerOrHrMayTouchATemplate() {
        AppUser creator = TestFixtures.user(UUID.randomUUID(), UserRole.EMPLOYEE, "creator@example.com");
        AppUser stranger = TestFixtures.user(UUID.randomUUID(), UserRole.EMPLOYEE, "stranger@example.com");
        AppUser hr = TestFixtures.user(UUID.randomUUID(), UserRole.HR_MANAGER, "hr@example.com");
        ChecklistTemplate template = TestFixtures.template(UUID.randomUUID(), creator, TemplateStatus.DRAFT);

        assertThatCode(() -> guard.requireOwnerOr(TestFixtures.principal(creator), template, ResourceAccess.HR_PLUS))
                .doesNotThrowAnyException();
        assertThatCode(() -> guard.requireOwnerOr(TestFixtures.principal(hr), template, ResourceAccess.HR_PLUS))
                .doesNotThrowAnyException();

        ProblemException ex = assertThrows(ProblemException.class,
                () -> guard.requireOwnerOr(TestFixtures.principal(stranger), template, ResourceAccess.HR_PLUS));
        assertThat(ex.getKind()).isEqualTo(ProblemKind.FORBIDDEN);
    }

    @Test
    void hrCannotAssignAdmin() {
        AuthenticatedUser hr = new AuthenticatedUser(UUID.randomUUID(), "hr@example.com", UserRole.HR_MANAGER, null, null);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> guard.requireRoleAssignment(hr, UserRole.ADMIN));

        assertThat(ex.getCode()).isEqualTo("access.role_assignment_denied");
        assertThatCode(() -> guard.requireRoleAssignment(hr, UserRole.EMPLOYEE)).doesNotThrowAnyException();
    }
}
