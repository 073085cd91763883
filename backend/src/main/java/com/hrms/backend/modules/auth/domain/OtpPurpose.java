package com.hrms.backend.modules.auth.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scope of a one-time code. Codes are stored per purpose, so a code issued for one purpose never
 * satisfies a check for another.
 */
public enum OtpPurpose {
    @JsonProperty("email_verification")
    EMAIL_VERIFICATION("email_verification", true),
    @JsonProperty("phone_verification")
    PHONE_VERIFICATION("phone_verification", true),
    @JsonProperty("password_reset")
    PASSWORD_RESET("password_reset", true),
    @JsonProperty("two_factor")
    TWO_FACTOR("two_factor", false);

    private final String key;
    private final boolean selfService;

    OtpPurpose(String key, boolean selfService) {
        this.key = key;
        this.selfService = selfService;
    }

    public String key() {
        return key;
    }

    /**
     * Whether callers may request and verify this purpose directly. Two-factor codes are only
     * issued by the login flow.
     */
    public boolean isSelfService() {
        return selfService;
    }
}
