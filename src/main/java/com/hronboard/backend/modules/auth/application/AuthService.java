package com.hronboard.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hronboard.backend.global.error.AccountLockedException;
import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.global.web.ClientInfo;
import com.hronboard.backend.modules.access.application.AccessPolicy;
import com.hronboard.backend.modules.audit.application.AuditLogService;
import com.hronboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hronboard.backend.modules.audit.domain.AuditAction;
import com.hronboard.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.hronboard.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.hronboard.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.domain.UserSession;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.hronboard.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.hronboard.backend.modules.auth.presentation.dto.LoginRequest;
import com.hronboard.backend.modules.auth.presentation.dto.LoginResponse;
import com.hronboard.backend.modules.auth.presentation.dto.RegisterRequest;
import com.hronboard.backend.modules.auth.presentation.dto.SessionResponse;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Credential checks, lockout bookkeeping and the session lifecycle.
 * Failed-attempt counters must survive the exception that reports the failure, hence {@code noRollbackFor}.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String INVALID_CREDENTIALS_MESSAGE = "Invalid email or password";
    private static final String RESOURCE_USER = "USER";
    private static final String RESOURCE_SESSION = "SESSION";

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final AccessPolicy accessPolicy;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final int maxLoginAttempts;
    private final long lockoutMinutes;

    public AuthService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            AccessPolicy accessPolicy,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${auth.lockout.max-attempts:5}") int maxLoginAttempts,
            @Value("${auth.lockout.duration-minutes:15}") long lockoutMinutes
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.accessPolicy = accessPolicy;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.maxLoginAttempts = maxLoginAttempts;
        this.lockoutMinutes = lockoutMinutes;
    }

    /**
     * Creates an account. Anything other than an employee account needs an authenticated caller
     * allowed to assign that role.
     */
    public UserResponse register(RegisterRequest request, AuthenticatedUser caller) {
        UserRole role = request.role() != null ? request.role() : UserRole.EMPLOYEE;
        if (role != UserRole.EMPLOYEE && (caller == null || !accessPolicy.canAssignRole(caller.role(), role))) {
            throw new ProblemException(ProblemKind.FORBIDDEN, "auth.role_assignment_denied",
                    "Cannot register an account with role " + role.getCode());
        }

        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(ProblemKind.CONFLICT, "auth.email_taken", "User with this email already exists");
        }

        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setRole(role);
        user.setDepartment(request.department());
        user.setEmailVerified(false);
        user.setActive(true);
        user.setLoginAttempts(0);
        user.setLockedUntil(null);

        AppUser saved = appUserRepository.save(user);
        log.info("Registered user {} with role {}", saved.getId(), role.getCode());
        return UserResponse.from(saved);
    }

    public LoginResponse login(LoginRequest request, ClientInfo clientInfo) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .filter(AppUser::isActive)
                .orElseThrow(AuthService::invalidCredentials);

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (user.isLockedAt(now)) {
            throw new AccountLockedException(minutesUntil(user.getLockedUntil(), now));
        }
        if (user.getLockedUntil() != null) {
            // lock has run out, start counting afresh
            user.setLockedUntil(null);
            user.setLoginAttempts(0);
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            registerFailedAttempt(user, now);
        }

        user.setLoginAttempts(0);
        user.setLockedUntil(null);
        user.setLastLoginAt(now);
        appUserRepository.save(user);

        IssuedToken issued = jwtTokenService.issue(user);
        UserSession session = persistSession(user, issued, clientInfo);

        auditLogService.record(new AuditLogCommand(
                AuditAction.LOGIN_SUCCEEDED,
                RESOURCE_SESSION,
                String.valueOf(session.getId()),
                user.getId(),
                clientInfo != null && clientInfo.ipAddress() != null ? Map.of("ipAddress", clientInfo.ipAddress()) : Map.of()
        ));
        return new LoginResponse(UserResponse.from(user), issued.token(), session.getId(), issued.expiresAt());
    }

    /**
     * Idempotent: deactivating an unknown or already inactive session is not an error.
     */
    public void logout(UUID sessionId, UUID actorUserId) {
        if (sessionId == null) {
            return;
        }
        int updated = userSessionRepository.deactivate(sessionId);
        if (updated > 0) {
            auditLogService.record(new AuditLogCommand(
                    AuditAction.LOGOUT, RESOURCE_SESSION, sessionId.toString(), actorUserId, Map.of()));
        }
    }

    @Transactional(readOnly = true)
    public VerifiedSession verifyToken(String token) {
        UserSession session = resolveSession(token);
        return new VerifiedSession(UserResponse.from(session.getUser()), session.getId(), session.getExpiresAt());
    }

    /**
     * Re-issues a token on the same session row; the old token stops matching immediately.
     */
    public LoginResponse refreshToken(String oldToken) {
        UserSession session = resolveSession(oldToken);
        AppUser user = session.getUser();

        IssuedToken issued = jwtTokenService.issue(user);
        session.setTokenHash(TokenHashing.sha256Hex(issued.token()));
        session.setExpiresAt(issued.expiresAt());
        userSessionRepository.save(session);

        return new LoginResponse(UserResponse.from(user), issued.token(), session.getId(), issued.expiresAt());
    }

    @Transactional(readOnly = true)
    public UserResponse currentUser(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .filter(AppUser::isActive)
                .orElseThrow(() -> new ProblemException(ProblemKind.UNAUTHORIZED, "auth.user_inactive", "User not found or inactive"));
        return UserResponse.from(user);
    }

    @Transactional(readOnly = true)
    public List<SessionResponse> listSessions(UUID userId, UUID currentSessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.findActiveSessions(userId, now).stream()
                .map(session -> new SessionResponse(
                        session.getId(),
                        session.getIpAddress(),
                        session.getUserAgent(),
                        session.getCreatedAt(),
                        session.getExpiresAt(),
                        session.getId().equals(currentSessionId)
                ))
                .toList();
    }

    public void terminateSession(UUID userId, UUID sessionId) {
        UserSession session = userSessionRepository.findById(sessionId)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "auth.session_not_found", "Session not found"));
        if (!session.getUser().getId().equals(userId)) {
            throw new ProblemException(ProblemKind.FORBIDDEN, "auth.session_not_owned", "Cannot terminate another user's session");
        }
        session.setActive(false);
        userSessionRepository.save(session);
        auditLogService.record(new AuditLogCommand(
                AuditAction.SESSION_TERMINATED, RESOURCE_SESSION, sessionId.toString(), userId, Map.of()));
    }

    private void registerFailedAttempt(AppUser user, OffsetDateTime now) {
        int attempts = user.getLoginAttempts() + 1;
        user.setLoginAttempts(attempts);
        if (attempts >= maxLoginAttempts) {
            OffsetDateTime lockedUntil = now.plusMinutes(lockoutMinutes);
            user.setLockedUntil(lockedUntil);
            appUserRepository.save(user);
            log.warn("Locking user {} until {} after {} failed attempts", user.getId(), lockedUntil, attempts);
            auditLogService.record(new AuditLogCommand(
                    AuditAction.ACCOUNT_LOCKED, RESOURCE_USER, user.getId().toString(), user.getId(),
                    Map.of("attempts", attempts, "lockedUntil", lockedUntil.toString())));
            throw new AccountLockedException(minutesUntil(lockedUntil, now));
        }
        appUserRepository.save(user);
        throw invalidCredentials();
    }

    private UserSession resolveSession(String token) {
        if (token == null || token.isBlank()) {
            throw unauthorized("auth.token_missing", "Access token is required");
        }
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parse(token);
        } catch (InvalidTokenException ex) {
            throw unauthorized("auth.invalid_token", "Invalid or expired token");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userSessionRepository.findValidSession(parsed.userId(), TokenHashing.sha256Hex(token), now)
                .orElseThrow(() -> unauthorized("auth.session_invalid", "Session expired or invalid"));
    }

    private UserSession persistSession(AppUser user, IssuedToken issued, ClientInfo clientInfo) {
        UserSession session = new UserSession();
        session.setUser(user);
        session.setTokenHash(TokenHashing.sha256Hex(issued.token()));
        session.setExpiresAt(issued.expiresAt());
        session.setActive(true);
        if (clientInfo != null) {
            session.setIpAddress(clientInfo.ipAddress());
            session.setUserAgent(clientInfo.userAgent());
        }
        return userSessionRepository.save(session);
    }

    static long minutesUntil(OffsetDateTime lockedUntil, OffsetDateTime now) {
        Duration remaining = Duration.between(now, lockedUntil);
        if (remaining.isNegative() || remaining.isZero()) {
            return 0;
        }
        // any part of a started minute counts as a whole one
        long wholeMinutes = remaining.toMinutes();
        return remaining.equals(Duration.ofMinutes(wholeMinutes)) ? wholeMinutes : wholeMinutes + 1;
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase();
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(ProblemKind.INVALID_CREDENTIALS, "auth.invalid_credentials", INVALID_CREDENTIALS_MESSAGE);
    }

    private static ProblemException unauthorized(String code, String detail) {
        return new ProblemException(ProblemKind.UNAUTHORIZED, code, detail);
    }

    public record VerifiedSession(UserResponse user, UUID sessionId, OffsetDateTime expiresAt) {
    }
}
