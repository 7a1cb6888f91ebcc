package com.hronboard.backend.modules.checklist;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.modules.audit.application.AuditLogService;
import com.hronboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hronboard.backend.modules.audit.domain.AuditAction;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.checklist.application.ShareSlugGenerator;
import com.hronboard.backend.modules.checklist.application.SharedChecklistService;
import com.hronboard.backend.modules.checklist.domain.SharedChecklist;
import com.hronboard.backend.modules.checklist.infrastructure.persistence.SharedChecklistRepository;
import com.hronboard.backend.modules.checklist.presentation.dto.ShareChecklistRequest;
import com.hronboard.backend.modules.checklist.presentation.dto.ShareChecklistResponse;
import com.hronboard.backend.modules.checklist.presentation.dto.SharedChecklistResponse;
import com.hronboard.backend.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SharedChecklistServiceTest {

    private static final List<Map<String, Object>> ITEMS = List.of(
            Map.of("title", "Sign the employment contract", "dueDays", 0),
            Map.of("title", "Collect badge", "dueDays", 1)
    );

    @Mock
    private SharedChecklistRepository sharedChecklistRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private ShareSlugGenerator slugGenerator;

    @Mock
    private AuditLogService auditLogService;

    private SharedChecklistService service;
    private AppUser hr;

    @BeforeEach
    void setUp() {
        service = new SharedChecklistService(sharedChecklistRepository, appUserRepository, slugGenerator, auditLogService);
        hr = TestFixtures.user(UUID.randomUUID(), UserRole.HR_MANAGER, "hr@example.com");
        lenient().when(appUserRepository.getReferenceById(hr.getId())).thenReturn(hr);
        lenient().when(sharedChecklistRepository.save(any(SharedChecklist.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("sharing stores the items under a fresh slug and returns the public link")
    void shareStoresChecklistUnderSlug() {
        when(slugGenerator.next()).thenReturn("Ab3dE6gH9k");

        ShareChecklistResponse response = service.share(TestFixtures.principal(hr),
                new ShareChecklistRequest(ITEMS, " Backend developer ", "  "));

        assertThat(response.slug()).isEqualTo("Ab3dE6gH9k");
        assertThat(response.shareUrl()).isEqualTo("/api/checklist/c/Ab3dE6gH9k");

        ArgumentCaptor<SharedChecklist> captor = ArgumentCaptor.forClass(SharedChecklist.class);
        verify(sharedChecklistRepository).save(captor.capture());
        SharedChecklist stored = captor.getValue();
        assertThat(stored.getSlug()).isEqualTo("Ab3dE6gH9k");
        assertThat(stored.getItems()).isEqualTo(ITEMS);
        assertThat(stored.getRole()).isEqualTo("Backend developer");
        assertThat(stored.getDepartment()).isNull();
        assertThat(stored.getCreatedBy()).isSameAs(hr);

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo(AuditAction.CHECKLIST_SHARED);
        assertThat(audit.getValue().resourceKey()).isEqualTo("Ab3dE6gH9k");
    }

    @Test
    void takenSlugIsSkipped() {
        when(slugGenerator.next()).thenReturn("takenSlug1", "freeSlug22");
        when(sharedChecklistRepository.existsBySlug("takenSlug1")).thenReturn(true);
        when(sharedChecklistRepository.existsBySlug("freeSlug22")).thenReturn(false);

        ShareChecklistResponse response = service.share(TestFixtures.principal(hr),
                new ShareChecklistRequest(ITEMS, null, null));

        assertThat(response.slug()).isEqualTo("freeSlug22");
    }

    @Test
    void givesUpWhenEverySlugIsTaken() {
        when(slugGenerator.next()).thenReturn("takenSlug1");
        when(sharedChecklistRepository.existsBySlug("takenSlug1")).thenReturn(true);

        assertThrows(IllegalStateException.class, () -> service.share(TestFixtures.principal(hr),
                new ShareChecklistRequest(ITEMS, null, null)));
        verify(sharedChecklistRepository, never()).save(any(SharedChecklist.class));
    }

    @Test
    void missingChecklistIsRejected() {
        ProblemException ex = assertThrows(ProblemException.class, () -> service.share(TestFixtures.principal(hr),
                new ShareChecklistRequest(null, "Designer", null)));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.VALIDATION_FAILED);
        verify(sharedChecklistRepository, never()).save(any(SharedChecklist.class));
    }

    @Test
    void readsSharedChecklistBySlug() {
        SharedChecklist shared = new SharedChecklist("Ab3dE6gH9k", ITEMS, "Designer", "Product", hr);
        when(sharedChecklistRepository.findBySlug("Ab3dE6gH9k")).thenReturn(Optional.of(shared));

        SharedChecklistResponse response = service.getBySlug("Ab3dE6gH9k");

        assertThat(response.checklist()).isEqualTo(ITEMS);
        assertThat(response.role()).isEqualTo("Designer");
        assertThat(response.department()).isEqualTo("Product");
    }

    @Test
    @DisplayName("malformed slugs are refused before any lookup")
    void malformedSlugIsRejected() {
        for (String slug : List.of("bad_slug", "a..b", "with space", "")) {
            ProblemException ex = assertThrows(ProblemException.class, () -> service.getBySlug(slug));
            assertThat(ex.getKind()).isEqualTo(ProblemKind.VALIDATION_FAILED);
            assertThat(ex.getCode()).isEqualTo("checklists.invalid_slug");
        }
        verify(sharedChecklistRepository, never()).findBySlug(anyString());
    }

    @Test
    void unknownSlugIsNotFound() {
        when(sharedChecklistRepository.findBySlug("missing-42")).thenReturn(Optional.empty());

        ProblemException ex = assertThrows(ProblemException.class, () -> service.getBySlug("missing-42"));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.NOT_FOUND);
        assertThat(ex.getCode()).isEqualTo("checklists.not_found");
    }
}
