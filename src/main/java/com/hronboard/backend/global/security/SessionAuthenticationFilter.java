package com.hronboard.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.modules.access.application.AccessPolicy;
import com.hronboard.backend.modules.auth.application.AuthService;
import com.hronboard.backend.modules.auth.application.AuthService.VerifiedSession;
import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves a bearer token against the session store. Each capability of the caller's role becomes
 * a granted authority so route rules can use {@code hasAuthority("templates:edit")}.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    static final String AUTH_FAILURE_ATTRIBUTE = SessionAuthenticationFilter.class.getName() + ".failure";

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final AccessPolicy accessPolicy;

    public SessionAuthenticationFilter(AuthService authService, AccessPolicy accessPolicy) {
        this.authService = authService;
        this.accessPolicy = accessPolicy;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                VerifiedSession verified = authService.verifyToken(token);
                UserResponse user = verified.user();

                AuthenticatedUser principal = new AuthenticatedUser(
                        user.id(),
                        user.email(),
                        user.role(),
                        user.department(),
                        verified.sessionId()
                );

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authoritiesOf(principal));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ProblemException ex) {
                // protected routes answer 401 through the entry point; public ones carry on anonymously
                log.debug("Rejected bearer token: {}", ex.getCode());
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_FAILURE_ATTRIBUTE, ex);
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    private List<GrantedAuthority> authoritiesOf(AuthenticatedUser principal) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
        accessPolicy.permissionsOf(principal.role())
                .forEach(permission -> authorities.add(new SimpleGrantedAuthority(permission.getCode())));
        return authorities;
    }
}
