package com.hronboard.backend.modules.users.presentation;

import java.util.UUID;

import com.hronboard.backend.global.security.SecurityUtils;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;
import com.hronboard.backend.modules.users.application.UserAccountService;
import com.hronboard.backend.modules.users.application.UserPatch;
import com.hronboard.backend.modules.users.presentation.dto.ChangePasswordRequest;
import com.hronboard.backend.modules.users.presentation.dto.ProfileResponse;
import com.hronboard.backend.modules.users.presentation.dto.UpdateProfileRequest;
import com.hronboard.backend.modules.users.presentation.dto.UpdateUserRequest;
import com.hronboard.backend.modules.users.presentation.dto.UserListResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Users")
public class UserController {

    private final UserAccountService userAccountService;

    public UserController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @GetMapping("/profile")
    public ProfileResponse profile() {
        return userAccountService.getProfile(SecurityUtils.getCurrentPrincipal());
    }

    @PutMapping("/profile")
    public UserResponse updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        UserPatch patch = new UserPatch(request.firstName(), request.lastName(), request.email(), request.department(), null, null);
        return userAccountService.updateProfile(SecurityUtils.getCurrentPrincipal(), patch);
    }

    @PostMapping("/change-password")
    @Operation(summary = "Change password and sign out every other session")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        userAccountService.changePassword(SecurityUtils.getCurrentPrincipal(), request);
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    @Operation(summary = "List users, newest first")
    public UserListResponse list(
            @RequestParam(value = "role", required = false) UserRole role,
            @RequestParam(value = "isActive", required = false) Boolean active,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "limit", defaultValue = "20") int limit
    ) {
        return userAccountService.listUsers(role, active, page, limit);
    }

    @GetMapping("/{userId}")
    public UserResponse get(@PathVariable UUID userId) {
        return userAccountService.getUser(SecurityUtils.getCurrentPrincipal(), userId);
    }

    @PutMapping("/{userId}")
    public UserResponse update(@PathVariable UUID userId, @Valid @RequestBody UpdateUserRequest request) {
        return userAccountService.updateUser(SecurityUtils.getCurrentPrincipal(), userId, request.toPatch());
    }

    @PostMapping("/{userId}/deactivate")
    public UserResponse deactivate(@PathVariable UUID userId) {
        return userAccountService.deactivateUser(SecurityUtils.getCurrentPrincipal(), userId);
    }
}
