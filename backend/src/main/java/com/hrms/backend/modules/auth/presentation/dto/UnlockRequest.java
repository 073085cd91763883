package com.hrms.backend.modules.auth.presentation.dto;

import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.AttemptScope;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UnlockRequest(
        @NotNull(message = "scope is required") AttemptScope scope,
        @NotBlank(message = "identifier is required") String identifier
) {
}
