package com.hrms.backend.modules.auth.presentation.dto;

import com.hrms.backend.modules.auth.domain.OtpPurpose;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record OtpSendRequest(
        @NotBlank(message = "email is required") @Email String email,
        @NotNull(message = "purpose is required") OtpPurpose purpose
) {
}
