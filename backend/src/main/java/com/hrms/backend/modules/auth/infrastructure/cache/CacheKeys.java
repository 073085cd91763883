package com.hrms.backend.modules.auth.infrastructure.cache;

/**
 * Key prefixes inside the {@code hr:} namespace.
 */
public final class CacheKeys {

    public static final String NAMESPACE = "hr:";

    public static final String LOGIN_ATTEMPTS = "login_attempts:";
    public static final String REVOKED_SESSION = "blacklist:";
    public static final String OTP = "otp:";
    public static final String RATE_LIMIT = "rl:";
    public static final String PERMISSIONS = "perms:";

    private CacheKeys() {
    }
}
