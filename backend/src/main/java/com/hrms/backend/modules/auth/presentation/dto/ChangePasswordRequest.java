package com.hrms.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @NotBlank(message = "currentPassword is required") @Size(max = 256) String currentPassword,
        @NotBlank(message = "newPassword is required") @Size(max = 256) String newPassword
) {
}
