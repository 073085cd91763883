package com.hrms.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record PermissionGrantRequest(
        @NotBlank(message = "permission is required") String permission
) {
}
