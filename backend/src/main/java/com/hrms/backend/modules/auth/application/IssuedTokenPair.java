package com.hrms.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record IssuedTokenPair(
        String accessToken,
        String refreshToken,
        UUID sessionId,
        Instant issuedAt,
        Instant accessExpiresAt,
        Instant refreshExpiresAt
) {
}
