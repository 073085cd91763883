package com.hrms.backend.support;

import com.hrms.backend.global.config.SecurityProperties;

/**
 * Defaults used by unit tests: distinct 32+ byte secrets and the cheapest bcrypt cost.
 */
public final class SecurityTestProperties {

    public static final String ACCESS_SECRET = "test-access-secret-0123456789-abcdefghij";
    public static final String REFRESH_SECRET = "test-refresh-secret-0123456789-abcdefghij";

    private SecurityTestProperties() {
    }

    public static SecurityProperties defaults() {
        SecurityProperties properties = new SecurityProperties();
        properties.getJwt().setAccessSecret(ACCESS_SECRET);
        properties.getJwt().setRefreshSecret(REFRESH_SECRET);
        properties.getPassword().setBcryptCost(4);
        return properties;
    }
}
