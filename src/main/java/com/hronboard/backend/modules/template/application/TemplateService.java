package com.hronboard.backend.modules.template.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.hronboard.backend.global.common.PageInfo;
import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.access.application.AccessGuard;
import com.hronboard.backend.modules.access.domain.ResourceAccess;
import com.hronboard.backend.modules.audit.application.AuditLogService;
import com.hronboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hronboard.backend.modules.audit.domain.AuditAction;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.template.domain.ChecklistTemplate;
import com.hronboard.backend.modules.template.domain.TemplateCategory;
import com.hronboard.backend.modules.template.domain.TemplateItem;
import com.hronboard.backend.modules.template.domain.TemplateStatus;
import com.hronboard.backend.modules.template.domain.TemplateVersionHistory;
import com.hronboard.backend.modules.template.infrastructure.persistence.ChecklistTemplateRepository;
import com.hronboard.backend.modules.template.infrastructure.persistence.ChecklistTemplateRepository.CategoryCountProjection;
import com.hronboard.backend.modules.template.infrastructure.persistence.ChecklistTemplateSearchCondition;
import com.hronboard.backend.modules.template.infrastructure.persistence.TemplateCategoryRepository;
import com.hronboard.backend.modules.template.infrastructure.persistence.TemplateItemRepository;
import com.hronboard.backend.modules.template.infrastructure.persistence.TemplateItemRepository.ItemCountProjection;
import com.hronboard.backend.modules.template.infrastructure.persistence.TemplateSortField;
import com.hronboard.backend.modules.template.infrastructure.persistence.TemplateVersionHistoryRepository;
import com.hronboard.backend.modules.template.presentation.dto.CreateTemplateRequest;
import com.hronboard.backend.modules.template.presentation.dto.TemplateCategoryResponse;
import com.hronboard.backend.modules.template.presentation.dto.TemplateDetailResponse;
import com.hronboard.backend.modules.template.presentation.dto.TemplateDtoMapper;
import com.hronboard.backend.modules.template.presentation.dto.TemplateItemRequest;
import com.hronboard.backend.modules.template.presentation.dto.TemplateListResponse;
import com.hronboard.backend.modules.template.presentation.dto.TemplateSummaryResponse;
import com.hronboard.backend.modules.template.presentation.dto.TemplateVersionResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);
    private static final String RESOURCE_TEMPLATE = "TEMPLATE";
    private static final String COPY_SUFFIX = " (Copy)";
    private static final int MAX_PAGE_SIZE = 100;

    private final ChecklistTemplateRepository templateRepository;
    private final TemplateItemRepository templateItemRepository;
    private final TemplateCategoryRepository categoryRepository;
    private final TemplateVersionHistoryRepository versionHistoryRepository;
    private final AppUserRepository appUserRepository;
    private final AccessGuard accessGuard;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public TemplateService(
            ChecklistTemplateRepository templateRepository,
            TemplateItemRepository templateItemRepository,
            TemplateCategoryRepository categoryRepository,
            TemplateVersionHistoryRepository versionHistoryRepository,
            AppUserRepository appUserRepository,
            AccessGuard accessGuard,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.templateRepository = templateRepository;
        this.templateItemRepository = templateItemRepository;
        this.categoryRepository = categoryRepository;
        this.versionHistoryRepository = versionHistoryRepository;
        this.appUserRepository = appUserRepository;
        this.accessGuard = accessGuard;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public TemplateListResponse listTemplates(
            TemplateStatus status,
            String category,
            String search,
            String sortBy,
            String sortOrder,
            int page,
            int limit
    ) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
        TemplateSortField sortField = TemplateSortField.fromKey(sortBy).orElse(TemplateSortField.UPDATED_AT);
        boolean ascending = "asc".equalsIgnoreCase(sortOrder);

        Page<ChecklistTemplate> result = templateRepository.searchTemplates(
                new ChecklistTemplateSearchCondition(status, category, search, sortField, ascending),
                PageRequest.of(safePage - 1, safeLimit)
        );

        List<UUID> ids = result.getContent().stream().map(ChecklistTemplate::getId).toList();
        Map<UUID, Long> itemCounts = ids.isEmpty()
                ? Map.of()
                : templateItemRepository.countByTemplateIds(ids).stream()
                        .collect(Collectors.toMap(ItemCountProjection::getTemplateId, ItemCountProjection::getItemCount));
        Map<String, TemplateCategory> categories = categoriesByName();

        List<TemplateSummaryResponse> templates = result.getContent().stream()
                .map(template -> TemplateDtoMapper.toSummary(
                        template,
                        categories.get(template.getCategory()),
                        itemCounts.getOrDefault(template.getId(), 0L)))
                .toList();
        return new TemplateListResponse(templates, PageInfo.of(safePage, safeLimit, result.getTotalElements()));
    }

    @Transactional(readOnly = true)
    public TemplateDetailResponse getTemplate(UUID templateId, boolean includeItems) {
        ChecklistTemplate template = findTemplate(templateId);
        return toDetail(template, includeItems);
    }

    public TemplateDetailResponse createTemplate(AuthenticatedUser actor, CreateTemplateRequest request) {
        requireKnownCategory(request.category());
        AppUser creator = appUserRepository.getReferenceById(actor.userId());

        ChecklistTemplate template = new ChecklistTemplate();
        template.setName(request.name().trim());
        template.setDescription(request.description());
        template.setCategory(request.category().trim());
        template.setTemplateData(request.templateData());
        template.setTags(request.tags());
        template.setTargetRoles(request.targetRoles());
        template.setTargetDepartments(request.targetDepartments());
        template.setComplianceFrameworks(request.complianceFrameworks());
        template.setEstimatedDurationMinutes(request.estimatedDurationMinutes());
        template.setCreatedBy(creator);
        template.setStatus(TemplateStatus.DRAFT);
        template.setVersion(1);
        toItems(request.items()).forEach(template::addItem);

        ChecklistTemplate saved = templateRepository.save(template);
        log.info("Template {} created by {}", saved.getId(), actor.userId());
        return toDetail(saved, true);
    }

    /**
     * Content edits are allowed on drafts only. The previous content is kept as a version snapshot.
     */
    public TemplateDetailResponse updateTemplate(AuthenticatedUser actor, UUID templateId, TemplatePatch patch) {
        ChecklistTemplate template = findTemplate(templateId);
        accessGuard.requireOwnerOr(actor, template, ResourceAccess.HR_PLUS);
        if (!template.getStatus().isEditable()) {
            throw new ProblemException(ProblemKind.CONFLICT, "templates.not_editable",
                    "Only draft templates can be edited (current status: " + template.getStatus().getCode() + ")");
        }
        if (patch.isEmpty()) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "templates.no_changes", "No valid fields to update");
        }
        if (patch.category() != null) {
            requireKnownCategory(patch.category());
        }

        AppUser editor = appUserRepository.getReferenceById(actor.userId());
        versionHistoryRepository.save(
                TemplateVersionHistory.snapshotOf(template, editor, patch.changesSummary(), OffsetDateTime.now(clock)));

        if (patch.name() != null) {
            template.setName(patch.name().trim());
        }
        if (patch.description() != null) {
            template.setDescription(patch.description());
        }
        if (patch.category() != null) {
            template.setCategory(patch.category().trim());
        }
        if (patch.templateData() != null) {
            template.setTemplateData(patch.templateData());
        }
        if (patch.tags() != null) {
            template.setTags(patch.tags());
        }
        if (patch.targetRoles() != null) {
            template.setTargetRoles(patch.targetRoles());
        }
        if (patch.targetDepartments() != null) {
            template.setTargetDepartments(patch.targetDepartments());
        }
        if (patch.complianceFrameworks() != null) {
            template.setComplianceFrameworks(patch.complianceFrameworks());
        }
        if (patch.estimatedDurationMinutes() != null) {
            template.setEstimatedDurationMinutes(patch.estimatedDurationMinutes());
        }
        if (patch.items() != null) {
            template.replaceItems(toItems(patch.items()));
        }
        template.setVersion(template.getVersion() + 1);

        ChecklistTemplate saved = templateRepository.save(template);
        return toDetail(saved, true);
    }

    public void deleteTemplate(AuthenticatedUser actor, UUID templateId) {
        ChecklistTemplate template = findTemplate(templateId);
        accessGuard.requireOwnerOr(actor, template, ResourceAccess.HR_PLUS);
        if (template.getStatus() == TemplateStatus.PENDING_APPROVAL) {
            throw new ProblemException(ProblemKind.CONFLICT, "templates.pending_approval",
                    "Cannot delete a template that is pending approval");
        }
        templateRepository.delete(template);
        log.info("Template {} deleted by {}", templateId, actor.userId());
        auditLogService.record(new AuditLogCommand(
                AuditAction.TEMPLATE_DELETED, RESOURCE_TEMPLATE, templateId.toString(), actor.userId(),
                Map.of("name", template.getName(), "version", template.getVersion())));
    }

    public TemplateDetailResponse cloneTemplate(AuthenticatedUser actor, UUID templateId, String name) {
        ChecklistTemplate source = findTemplate(templateId);
        AppUser creator = appUserRepository.getReferenceById(actor.userId());

        ChecklistTemplate copy = new ChecklistTemplate();
        copy.setName(name != null && !name.isBlank() ? name.trim() : source.getName() + COPY_SUFFIX);
        copy.setDescription(source.getDescription());
        copy.setCategory(source.getCategory());
        copy.setTemplateData(source.getTemplateData());
        copy.setTags(source.getTags());
        copy.setTargetRoles(source.getTargetRoles());
        copy.setTargetDepartments(source.getTargetDepartments());
        copy.setComplianceFrameworks(source.getComplianceFrameworks());
        copy.setEstimatedDurationMinutes(source.getEstimatedDurationMinutes());
        copy.setCreatedBy(creator);
        copy.setStatus(TemplateStatus.DRAFT);
        copy.setVersion(1);
        source.getItems().forEach(item -> copy.addItem(item.copy()));

        ChecklistTemplate saved = templateRepository.save(copy);
        log.info("Template {} cloned into {} by {}", templateId, saved.getId(), actor.userId());
        return toDetail(saved, true);
    }

    public TemplateDetailResponse archiveTemplate(AuthenticatedUser actor, UUID templateId) {
        ChecklistTemplate template = findTemplate(templateId);
        if (!template.getStatus().isArchivable()) {
            throw new ProblemException(ProblemKind.CONFLICT, "templates.not_archivable",
                    "Only draft or approved templates can be archived (current status: "
                            + template.getStatus().getCode() + ")");
        }
        TemplateStatus previous = template.getStatus();
        template.setStatus(TemplateStatus.ARCHIVED);
        ChecklistTemplate saved = templateRepository.save(template);
        auditLogService.record(new AuditLogCommand(
                AuditAction.TEMPLATE_ARCHIVED, RESOURCE_TEMPLATE, templateId.toString(), actor.userId(),
                Map.of("previousStatus", previous.getCode())));
        return toDetail(saved, false);
    }

    @Transactional(readOnly = true)
    public List<TemplateCategoryResponse> listCategories() {
        Map<String, Long> approvedCounts = templateRepository.countByCategoryAndStatus(TemplateStatus.APPROVED).stream()
                .collect(Collectors.toMap(CategoryCountProjection::getCategory, CategoryCountProjection::getTemplateCount));
        return categoryRepository.findByActiveTrueOrderBySortOrderAsc().stream()
                .map(category -> new TemplateCategoryResponse(
                        category.getName(),
                        category.getDisplayName(),
                        category.getDescription(),
                        category.getIcon(),
                        category.getColor(),
                        category.getSortOrder(),
                        approvedCounts.getOrDefault(category.getName(), 0L)))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TemplateVersionResponse> listVersions(UUID templateId) {
        if (!templateRepository.existsById(templateId)) {
            throw templateNotFound();
        }
        return versionHistoryRepository.findByTemplateId(templateId).stream()
                .map(TemplateVersionResponse::from)
                .toList();
    }

    private ChecklistTemplate findTemplate(UUID templateId) {
        return templateRepository.findDetailedById(templateId).orElseThrow(TemplateService::templateNotFound);
    }

    private TemplateDetailResponse toDetail(ChecklistTemplate template, boolean includeItems) {
        TemplateCategory category = categoryRepository.findByName(template.getCategory()).orElse(null);
        return TemplateDtoMapper.toDetail(template, category, includeItems);
    }

    private Map<String, TemplateCategory> categoriesByName() {
        return categoryRepository.findAll().stream()
                .collect(Collectors.toMap(TemplateCategory::getName, Function.identity()));
    }

    private void requireKnownCategory(String category) {
        if (category == null || !categoryRepository.existsByNameAndActiveTrue(category.trim())) {
            throw new ProblemException(ProblemKind.VALIDATION_FAILED, "templates.unknown_category",
                    "Unknown template category: " + category);
        }
    }

    private static List<TemplateItem> toItems(List<TemplateItemRequest> requests) {
        List<TemplateItem> items = new ArrayList<>();
        if (requests == null) {
            return items;
        }
        for (int i = 0; i < requests.size(); i++) {
            TemplateItemRequest request = requests.get(i);
            TemplateItem item = new TemplateItem();
            item.setTitle(request.title().trim());
            item.setDescription(request.description());
            item.setCategory(request.category());
            item.setRequired(request.required() == null || request.required());
            item.setEstimatedDurationMinutes(request.estimatedDurationMinutes() != null
                    ? request.estimatedDurationMinutes()
                    : TemplateItem.DEFAULT_DURATION_MINUTES);
            item.setSortOrder(request.sortOrder() != null ? request.sortOrder() : i);
            item.setAssigneeRole(request.assigneeRole());
            item.setDueDaysFromStart(request.dueDaysFromStart());
            item.setDependencies(request.dependencies());
            item.setInstructions(request.instructions());
            item.setSuccessCriteria(request.successCriteria());
            item.setAttachmentsRequired(Boolean.TRUE.equals(request.attachmentsRequired()));
            item.setApprovalRequired(Boolean.TRUE.equals(request.approvalRequired()));
            items.add(item);
        }
        return items;
    }

    static ProblemException templateNotFound() {
        return new ProblemException(ProblemKind.NOT_FOUND, "templates.not_found", "Template not found");
    }
}
