package com.hrms.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Security settings bound from {@code app.security.*}.
 *
 * <p>Bound once at startup and passed to each component through its constructor.
 * Groups:</p>
 * - Jwt: signing secrets, lifetimes, issuer/audience and tolerated clock skew;
 * - Password: bcrypt work factor and minimum length;
 * - Otp: code width, lifetime, verification attempts and send throttling;
 * - Lockout: consecutive failure thresholds per account and per client IP;
 * - RateLimit: global per-IP window, per-endpoint windows and trusted proxies;
 * - PasswordReset: reset link lifetime and frontend base URL.
 */
@Data
@ConfigurationProperties(prefix = "app.security")
public class SecurityProperties {

    private final Jwt jwt = new Jwt();
    private final Password password = new Password();
    private final Otp otp = new Otp();
    private final Lockout lockout = new Lockout();
    private final RateLimit rateLimit = new RateLimit();
    private final PasswordReset passwordReset = new PasswordReset();

    /** Lifetime of a cached role/permission expansion. Must stay below the refresh token lifetime. */
    private Duration permissionCacheTtl = Duration.ofMinutes(10);

    @Data
    public static class Jwt {
        /** HMAC secret for access tokens. Prefix with {@code base64:} to supply raw key bytes. */
        private String accessSecret;
        /** HMAC secret for refresh tokens; must differ from the access secret. */
        private String refreshSecret;
        private Duration accessTtl = Duration.ofMinutes(15);
        private Duration refreshTtl = Duration.ofDays(7);
        private String issuer = "hr-management-system";
        private String audience = "hr-management-users";
        private Duration clockSkew = Duration.ofSeconds(5);
    }

    @Data
    public static class Password {
        /** BCrypt cost. Existing hashes keep verifying after this changes. */
        private int bcryptCost = 12;
        private int minLength = 8;
    }

    @Data
    public static class Otp {
        private int length = 6;
        private Duration ttl = Duration.ofMinutes(5);
        /** Wrong submissions tolerated before the code is destroyed. */
        private int maxAttempts = 5;
        /** Codes that may be requested per identifier within {@link #sendWindow}. */
        private int sendLimit = 3;
        private Duration sendWindow = Duration.ofMinutes(5);
    }

    @Data
    public static class Lockout {
        private int maxAttempts = 5;
        private int ipMaxAttempts = 20;
        private Duration duration = Duration.ofMinutes(30);
    }

    @Data
    public static class RateLimit {
        private Window ip = new Window(100, Duration.ofMinutes(1));
        /** Per-route windows keyed by servlet path, e.g. {@code [/auth/login]}. */
        private Map<String, Window> endpoints = new LinkedHashMap<>();
        /** Remote addresses whose X-Real-IP / X-Forwarded-For headers are trusted. */
        private List<String> trustedProxies = new ArrayList<>();
        /** Let requests through when the cache cannot be reached. */
        private boolean failOpen = true;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Window {
        private int limit;
        private Duration window;
    }

    @Data
    public static class PasswordReset {
        private Duration ttl = Duration.ofHours(1);
        private String frontendUrl = "http://localhost:3000";
    }
}
