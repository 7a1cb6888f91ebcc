package com.hronboard.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String ISSUER = "hr-onboarding-api";
    static final String AUDIENCE = "hr-onboarding-client";

    private final JwtTokenProvider tokenProvider;
    private final long tokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:604800000}") long tokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.tokenTtlMillis = tokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issue(AppUser user) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(tokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        String token = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(user.getId().toString())
                .issuer(ISSUER)
                .audience().add(AUDIENCE).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim("email", user.getEmail())
                .claim("role", user.getRole().getCode())
                .claim("firstName", user.getFirstName())
                .claim("lastName", user.getLastName())
                .signWith(key, SIG.HS256)
                .compact();

        return new IssuedToken(
                token,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiry, clock.getZone())
        );
    }

    public ParsedToken parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .requireIssuer(ISSUER)
                    .requireAudience(AUDIENCE)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get("email", String.class);
            UserRole role = UserRole.fromCode(claims.get("role", String.class));
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    email,
                    role,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid session token", e);
        }
    }

    public long getTokenTtlMillis() {
        return tokenTtlMillis;
    }

    public record IssuedToken(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(UUID userId, String email, UserRole role, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
