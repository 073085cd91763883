package com.hrms.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record SessionRevocationResponse(UUID userId, int revokedSessions) {
}
