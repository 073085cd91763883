package com.hrms.backend.modules.auth.presentation.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import com.hrms.backend.modules.auth.application.IssuedTokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        Instant expiresAt,
        String refreshToken,
        long refreshExpiresIn,
        UUID sessionId,
        Instant issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(IssuedTokenPair tokens) {
        return new TokenPairResponse(
                tokens.accessToken(),
                DEFAULT_TOKEN_TYPE,
                Duration.between(tokens.issuedAt(), tokens.accessExpiresAt()).toSeconds(),
                tokens.accessExpiresAt(),
                tokens.refreshToken(),
                Duration.between(tokens.issuedAt(), tokens.refreshExpiresAt()).toSeconds(),
                tokens.sessionId(),
                tokens.issuedAt()
        );
    }
}
