package com.hronboard.backend.modules.checklist.presentation;

import com.hronboard.backend.global.security.SecurityUtils;
import com.hronboard.backend.modules.checklist.application.SharedChecklistService;
import com.hronboard.backend.modules.checklist.presentation.dto.ShareChecklistRequest;
import com.hronboard.backend.modules.checklist.presentation.dto.ShareChecklistResponse;
import com.hronboard.backend.modules.checklist.presentation.dto.SharedChecklistResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/checklist")
@Tag(name = "Shared checklists")
public class SharedChecklistController {

    private final SharedChecklistService sharedChecklistService;

    public SharedChecklistController(SharedChecklistService sharedChecklistService) {
        this.sharedChecklistService = sharedChecklistService;
    }

    @PostMapping("/share")
    @Operation(summary = "Publish a checklist under a random slug")
    public ResponseEntity<ShareChecklistResponse> share(@Valid @RequestBody ShareChecklistRequest request) {
        ShareChecklistResponse response = sharedChecklistService.share(SecurityUtils.getCurrentPrincipal(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/c/{slug}")
    @Operation(summary = "Read a shared checklist", description = "Public; anyone holding the link can read it")
    public SharedChecklistResponse get(@PathVariable String slug) {
        return sharedChecklistService.getBySlug(slug);
    }
}
