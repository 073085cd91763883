package com.hrms.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.domain.TokenType;
import com.hrms.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * Issues and validates access/refresh token pairs. Both tokens of a pair share a freshly minted
 * {@code session_id}, which is the unit of revocation.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_SESSION_ID = "session_id";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    private final JwtTokenProvider tokenProvider;
    private final SecurityProperties.Jwt settings;
    private final Clock clock;

    public JwtTokenService(JwtTokenProvider tokenProvider, SecurityProperties properties, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.settings = properties.getJwt();
        this.clock = clock;
    }

    public IssuedTokenPair issuePair(UUID userId, String email, Collection<String> roles, Collection<String> permissions) {
        UUID sessionId = UUID.randomUUID();
        Instant now = clock.instant();
        Instant accessExpiry = now.plus(settings.getAccessTtl());
        Instant refreshExpiry = now.plus(settings.getRefreshTtl());

        String accessToken = baseBuilder(userId, sessionId, TokenType.ACCESS, now, accessExpiry)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLES, List.copyOf(roles))
                .claim(CLAIM_PERMISSIONS, List.copyOf(permissions))
                .signWith(tokenProvider.keyFor(TokenType.ACCESS), SIG.HS256)
                .compact();

        String refreshToken = baseBuilder(userId, sessionId, TokenType.REFRESH, now, refreshExpiry)
                .signWith(tokenProvider.keyFor(TokenType.REFRESH), SIG.HS256)
                .compact();

        return new IssuedTokenPair(accessToken, refreshToken, sessionId, now, accessExpiry, refreshExpiry);
    }

    /**
     * Verifies signature, issuer, audience, expiry, not-before and token type. Any failure is
     * reported as {@code TOKEN_EXPIRED} or {@code TOKEN_INVALID}; no claims escape a failed check.
     */
    public TokenClaims validate(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw AuthProblems.tokenInvalid();
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.keyFor(expectedType))
                    .requireIssuer(settings.getIssuer())
                    .requireAudience(settings.getAudience())
                    .clock(() -> Date.from(clock.instant()))
                    .clockSkewSeconds(settings.getClockSkew().toSeconds())
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            throw AuthProblems.tokenExpired();
        } catch (JwtException | IllegalArgumentException ex) {
            throw AuthProblems.tokenInvalid();
        }

        TokenType actualType = TokenType.fromClaim(claims.get(CLAIM_TOKEN_TYPE, String.class))
                .orElseThrow(AuthProblems::tokenInvalid);
        if (actualType != expectedType) {
            throw AuthProblems.tokenInvalid();
        }

        try {
            return new TokenClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.get(CLAIM_EMAIL, String.class),
                    stringList(claims.get(CLAIM_ROLES, List.class)),
                    stringList(claims.get(CLAIM_PERMISSIONS, List.class)),
                    UUID.fromString(claims.get(CLAIM_SESSION_ID, String.class)),
                    actualType,
                    claims.getId(),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()
            );
        } catch (RuntimeException ex) {
            throw AuthProblems.tokenInvalid();
        }
    }

    public Duration getAccessTtl() {
        return settings.getAccessTtl();
    }

    public Duration getRefreshTtl() {
        return settings.getRefreshTtl();
    }

    private JwtBuilder baseBuilder(UUID userId, UUID sessionId, TokenType type, Instant now, Instant expiry) {
        Date issuedAt = Date.from(now);
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(settings.getIssuer())
                .audience().add(settings.getAudience()).and()
                .subject(userId.toString())
                .issuedAt(issuedAt)
                .notBefore(issuedAt)
                .expiration(Date.from(expiry))
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .claim(CLAIM_TOKEN_TYPE, type.claimValue());
    }

    private static List<String> stringList(List<?> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }
}
