package com.hrms.backend.modules.auth.presentation.dto;

import com.hrms.backend.modules.auth.domain.OtpPurpose;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record OtpVerifyRequest(
        @NotBlank(message = "email is required") @Email String email,
        @NotNull(message = "purpose is required") OtpPurpose purpose,
        @NotBlank(message = "code is required") @Pattern(regexp = "\\d{4,10}", message = "code must be numeric") String code
) {
}
