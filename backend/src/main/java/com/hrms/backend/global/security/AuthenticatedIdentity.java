package com.hrms.backend.global.security;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Principal built from a validated, non-revoked access token.
 */
public record AuthenticatedIdentity(
        UUID userId,
        String email,
        List<String> roles,
        List<String> permissions,
        UUID sessionId,
        Instant accessExpiresAt
) {
}
