package com.hronboard.backend.modules.checklist.application;

import java.util.Map;
import java.util.regex.Pattern;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.audit.application.AuditLogService;
import com.hronboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hronboard.backend.modules.audit.domain.AuditAction;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.checklist.domain.SharedChecklist;
import com.hronboard.backend.modules.checklist.infrastructure.persistence.SharedChecklistRepository;
import com.hronboard.backend.modules.checklist.presentation.dto.ShareChecklistRequest;
import com.hronboard.backend.modules.checklist.presentation.dto.ShareChecklistResponse;
import com.hronboard.backend.modules.checklist.presentation.dto.SharedChecklistResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SharedChecklistService {

    private static final Logger log = LoggerFactory.getLogger(SharedChecklistService.class);
    private static final String RESOURCE_CHECKLIST = "SHARED_CHECKLIST";
    private static final String SHARE_PATH = "/api/checklist/c/";
    private static final Pattern SLUG_PATTERN = Pattern.compile("^[A-Za-z0-9-]+$");
    static final int MAX_SLUG_ATTEMPTS = 5;

    private final SharedChecklistRepository sharedChecklistRepository;
    private final AppUserRepository appUserRepository;
    private final ShareSlugGenerator slugGenerator;
    private final AuditLogService auditLogService;

    public SharedChecklistService(
            SharedChecklistRepository sharedChecklistRepository,
            AppUserRepository appUserRepository,
            ShareSlugGenerator slugGenerator,
            AuditLogService auditLogService
    ) {
        this.sharedChecklistRepository = sharedChecklistRepository;
        this.appUserRepository = appUserRepository;
        this.slugGenerator = slugGenerator;
        this.auditLogService = auditLogService;
    }

    public ShareChecklistResponse share(AuthenticatedUser actor, ShareChecklistRequest request) {
        if (request.checklist() == null) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "checklists.invalid_checklist",
                    "Valid checklist array is required");
        }
        String slug = nextFreeSlug();
        SharedChecklist shared = new SharedChecklist(
                slug,
                request.checklist(),
                trimToNull(request.role()),
                trimToNull(request.department()),
                appUserRepository.getReferenceById(actor.userId())
        );
        sharedChecklistRepository.save(shared);

        log.info("Checklist with {} items shared by {} as {}", request.checklist().size(), actor.userId(), slug);
        auditLogService.record(new AuditLogCommand(
                AuditAction.CHECKLIST_SHARED, RESOURCE_CHECKLIST, slug, actor.userId(),
                Map.of("itemCount", request.checklist().size())));
        return new ShareChecklistResponse(slug, SHARE_PATH + slug);
    }

    @Transactional(readOnly = true)
    public SharedChecklistResponse getBySlug(String slug) {
        if (slug == null || slug.contains("..") || !SLUG_PATTERN.matcher(slug).matches()) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "checklists.invalid_slug", "Invalid slug format");
        }
        return sharedChecklistRepository.findBySlug(slug)
                .map(SharedChecklistResponse::from)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "checklists.not_found", "Checklist not found"));
    }

    private String nextFreeSlug() {
        for (int attempt = 0; attempt < MAX_SLUG_ATTEMPTS; attempt++) {
            String candidate = slugGenerator.next();
            if (!sharedChecklistRepository.existsBySlug(candidate)) {
                return candidate;
            }
            log.debug("Share slug {} already taken, drawing another", candidate);
        }
        throw new IllegalStateException("Could not allocate a free share slug after " + MAX_SLUG_ATTEMPTS + " attempts");
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
