package com.hrms.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RoleAssignmentRequest(
        @NotBlank(message = "role is required") String role
) {
}
