package com.hrms.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record TwoFactorVerifyRequest(
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "code is required") @Pattern(regexp = "\\d{4,10}", message = "code must be numeric") String code
) {
}
