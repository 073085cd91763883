package com.hrms.backend.modules.auth.application;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.hrms.backend.modules.auth.domain.TokenType;

/**
 * Verified claims of an access or refresh token. Refresh tokens carry no email, roles or
 * permissions; those lists are empty and {@code email} is null.
 */
public record TokenClaims(
        UUID userId,
        String email,
        List<String> roles,
        List<String> permissions,
        UUID sessionId,
        TokenType tokenType,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt
) {
}
