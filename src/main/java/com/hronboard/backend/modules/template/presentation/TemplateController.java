package com.hronboard.backend.modules.template.presentation;

import java.util.List;
import java.util.UUID;

import com.hronboard.backend.global.security.SecurityUtils;
import com.hronboard.backend.modules.template.application.TemplateService;
import com.hronboard.backend.modules.template.domain.TemplateStatus;
import com.hronboard.backend.modules.template.presentation.dto.CloneTemplateRequest;
import com.hronboard.backend.modules.template.presentation.dto.CreateTemplateRequest;
import com.hronboard.backend.modules.template.presentation.dto.TemplateCategoryResponse;
import com.hronboard.backend.modules.template.presentation.dto.TemplateDetailResponse;
import com.hronboard.backend.modules.template.presentation.dto.TemplateListResponse;
import com.hronboard.backend.modules.template.presentation.dto.TemplateVersionResponse;
import com.hronboard.backend.modules.template.presentation.dto.UpdateTemplateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/templates")
@Tag(name = "Templates")
public class TemplateController {

    private final TemplateService templateService;

    public TemplateController(TemplateService templateService) {
        this.templateService = templateService;
    }

    @GetMapping
    @Operation(summary = "Search templates", description = "Defaults to approved templates, most recently updated first")
    public TemplateListResponse list(
            @RequestParam(value = "status", defaultValue = "approved") TemplateStatus status,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "sortBy", defaultValue = "updatedAt") String sortBy,
            @RequestParam(value = "sortOrder", defaultValue = "desc") String sortOrder,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "10") int limit
    ) {
        return templateService.listTemplates(status, category, search, sortBy, sortOrder, page, limit);
    }

    @GetMapping("/categories")
    @Operation(summary = "Active categories with approved template counts")
    public List<TemplateCategoryResponse> categories() {
        return templateService.listCategories();
    }

    @GetMapping("/{templateId}")
    public TemplateDetailResponse get(
            @PathVariable UUID templateId,
            @RequestParam(value = "includeItems", defaultValue = "true") boolean includeItems
    ) {
        return templateService.getTemplate(templateId, includeItems);
    }

    @GetMapping("/{templateId}/versions")
    @Operation(summary = "Content snapshots taken before each edit, newest first")
    public List<TemplateVersionResponse> versions(@PathVariable UUID templateId) {
        return templateService.listVersions(templateId);
    }

    @PostMapping
    @Operation(summary = "Create a draft template")
    public ResponseEntity<TemplateDetailResponse> create(@Valid @RequestBody CreateTemplateRequest request) {
        TemplateDetailResponse created = templateService.createTemplate(SecurityUtils.getCurrentPrincipal(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PutMapping("/{templateId}")
    @Operation(summary = "Edit a draft template and bump its version")
    public TemplateDetailResponse update(
            @PathVariable UUID templateId,
            @Valid @RequestBody UpdateTemplateRequest request
    ) {
        return templateService.updateTemplate(SecurityUtils.getCurrentPrincipal(), templateId, request.toPatch());
    }

    @DeleteMapping("/{templateId}")
    public ResponseEntity<Void> delete(@PathVariable UUID templateId) {
        templateService.deleteTemplate(SecurityUtils.getCurrentPrincipal(), templateId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{templateId}/clone")
    @Operation(summary = "Copy a template into a new draft")
    public ResponseEntity<TemplateDetailResponse> clone(
            @PathVariable UUID templateId,
            @Valid @RequestBody(required = false) CloneTemplateRequest request
    ) {
        String name = request == null ? null : request.name();
        TemplateDetailResponse cloned = templateService.cloneTemplate(SecurityUtils.getCurrentPrincipal(), templateId, name);
        return ResponseEntity.status(HttpStatus.CREATED).body(cloned);
    }

    @PostMapping("/{templateId}/archive")
    public TemplateDetailResponse archive(@PathVariable UUID templateId) {
        return templateService.archiveTemplate(SecurityUtils.getCurrentPrincipal(), templateId);
    }
}
