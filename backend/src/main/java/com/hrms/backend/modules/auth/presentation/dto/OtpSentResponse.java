package com.hrms.backend.modules.auth.presentation.dto;

import java.time.Instant;

public record OtpSentResponse(String message, Instant expiresAt) {
}
