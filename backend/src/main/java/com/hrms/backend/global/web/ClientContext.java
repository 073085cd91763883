package com.hrms.backend.global.web;

import com.hrms.backend.global.common.Digests;

/**
 * Caller details recorded with a session.
 */
public record ClientContext(String ipAddress, String userAgent, String acceptLanguage) {

    public static ClientContext unknown() {
        return new ClientContext(null, null, null);
    }

    /**
     * SHA-256 of user agent, IP and accept-language, joined with {@code |}.
     */
    public String fingerprint() {
        return Digests.sha256Hex(nullToEmpty(userAgent) + "|" + nullToEmpty(ipAddress) + "|" + nullToEmpty(acceptLanguage));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
