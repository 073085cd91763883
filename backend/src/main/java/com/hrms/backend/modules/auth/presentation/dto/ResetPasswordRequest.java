package com.hrms.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "token is required") @Size(max = 128) String token,
        @NotBlank(message = "newPassword is required") @Size(max = 256) String newPassword
) {
}
