package com.hronboard.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.modules.access.application.AccessPolicy;
import com.hronboard.backend.modules.auth.application.AuthService;
import com.hronboard.backend.modules.auth.application.AuthService.VerifiedSession;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class SessionAuthenticationFilterTest {

    @Mock
    private AuthService authService;

    private SessionAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new SessionAuthenticationFilter(authService, new AccessPolicy());
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validBearerTokenPopulatesPrincipalAndPermissions() throws Exception {
        UUID userId = UUID.randomUUID();
        UUID sessionId = UUID.randomUUID();
        UserResponse user = new UserResponse(userId, "hr@example.com", "Hana", "Ito", UserRole.HR_MANAGER, "People",
                true, true, null, null, null);
        when(authService.verifyToken("good-token")).thenReturn(new VerifiedSession(user, sessionId, OffsetDateTime.now()));

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/templates");
        request.addHeader("Authorization", "Bearer good-token");
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        AuthenticatedUser principal = (AuthenticatedUser) authentication.getPrincipal();
        assertThat(principal.userId()).isEqualTo(userId);
        assertThat(principal.sessionId()).isEqualTo(sessionId);
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .contains("ROLE_HR_MANAGER", "templates:approve")
                .doesNotContain("users:delete");
    }

    @Test
    void rejectedTokenLeavesRequestAnonymousAndRecordsFailure() throws Exception {
        ProblemException failure = new ProblemException(ProblemKind.UNAUTHORIZED, "auth.session_invalid", "Session expired or invalid");
        when(authService.verifyToken("stale-token")).thenThrow(failure);

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/auth/me");
        request.addHeader("Authorization", "Bearer stale-token");
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(SessionAuthenticationFilter.AUTH_FAILURE_ATTRIBUTE)).isSameAs(failure);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void requestsWithoutBearerHeaderAreUntouched() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/templates");
        request.addHeader("Authorization", "Basic dXNlcjpwYXNz");
        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verifyNoInteractions(authService);
    }
}
