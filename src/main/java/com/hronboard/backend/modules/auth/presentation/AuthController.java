package com.hronboard.backend.modules.auth.presentation;

import java.util.List;
import java.util.UUID;

import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.global.security.SecurityUtils;
import com.hronboard.backend.global.web.ClientInfo;
import com.hronboard.backend.modules.access.application.AccessPolicy;
import com.hronboard.backend.modules.access.domain.Permission;
import com.hronboard.backend.modules.auth.application.AuthService;
import com.hronboard.backend.modules.auth.presentation.dto.CurrentUserResponse;
import com.hronboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.hronboard.backend.modules.auth.presentation.dto.LoginResponse;
import com.hronboard.backend.modules.auth.presentation.dto.RegisterRequest;
import com.hronboard.backend.modules.auth.presentation.dto.RegisterResponse;
import com.hronboard.backend.modules.auth.presentation.dto.SessionResponse;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication")
public class AuthController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final AccessPolicy accessPolicy;

    public AuthController(AuthService authService, AccessPolicy accessPolicy) {
        this.authService = authService;
        this.accessPolicy = accessPolicy;
    }

    @PostMapping("/register")
    @Operation(summary = "Register a new account")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthenticatedUser caller = SecurityUtils.findCurrentPrincipal().orElse(null);
        UserResponse user = authService.register(request, caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse("User registered successfully", user));
    }

    @PostMapping("/login")
    @Operation(summary = "Exchange credentials for a session token")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientInfo.from(httpRequest)));
    }

    @PostMapping("/logout")
    @Operation(summary = "Deactivate the current session")
    public ResponseEntity<Void> logout() {
        AuthenticatedUser principal = SecurityUtils.getCurrentPrincipal();
        authService.logout(principal.sessionId(), principal.userId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    @Operation(summary = "Current user with granted capabilities")
    public CurrentUserResponse me() {
        AuthenticatedUser principal = SecurityUtils.getCurrentPrincipal();
        List<String> permissions = accessPolicy.permissionsOf(principal.role()).stream()
                .map(Permission::getCode)
                .sorted()
                .toList();
        return new CurrentUserResponse(authService.currentUser(principal.userId()), permissions, principal.sessionId());
    }

    @PostMapping("/refresh")
    @Operation(summary = "Re-issue the token of the current session")
    public LoginResponse refresh(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        String token = authorization.startsWith(BEARER_PREFIX)
                ? authorization.substring(BEARER_PREFIX.length()).trim()
                : authorization.trim();
        return authService.refreshToken(token);
    }

    @GetMapping("/sessions")
    @Operation(summary = "Active sessions of the current user")
    public List<SessionResponse> sessions() {
        AuthenticatedUser principal = SecurityUtils.getCurrentPrincipal();
        return authService.listSessions(principal.userId(), principal.sessionId());
    }

    @DeleteMapping("/sessions/{sessionId}")
    @Operation(summary = "Terminate one of the current user's sessions")
    public ResponseEntity<Void> terminateSession(@PathVariable UUID sessionId) {
        authService.terminateSession(SecurityUtils.getCurrentUserId(), sessionId);
        return ResponseEntity.noContent().build();
    }
}
