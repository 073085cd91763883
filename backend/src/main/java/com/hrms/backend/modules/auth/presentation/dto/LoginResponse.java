package com.hrms.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hrms.backend.modules.auth.application.LoginResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        boolean requiresTwoFactor,
        TokenPairResponse tokens,
        TwoFactorChallengeResponse challenge,
        UserProfileResponse user
) {

    public static LoginResponse from(LoginResult result) {
        if (result.requiresTwoFactor()) {
            return new LoginResponse(true, null,
                    TwoFactorChallengeResponse.email(result.user().getEmail(), result.challengeExpiresAt()), null);
        }
        return new LoginResponse(false, TokenPairResponse.from(result.tokens()), null,
                UserProfileResponse.of(result.user(), result.permissions()));
    }
}
