package com.hrms.backend.modules.auth.presentation.dto;

import java.time.Instant;

public record TwoFactorChallengeResponse(String method, String destination, Instant expiresAt) {

    public static TwoFactorChallengeResponse email(String email, Instant expiresAt) {
        return new TwoFactorChallengeResponse("email", maskEmail(email), expiresAt);
    }

    static String maskEmail(String email) {
        int at = email == null ? -1 : email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
