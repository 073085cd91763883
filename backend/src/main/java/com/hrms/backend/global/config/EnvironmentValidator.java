package com.hrms.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Refuses to start with unsafe security settings: missing or shared signing secrets,
 * placeholder secrets, and lifetimes that break the revocation and caching bounds.
 */
@Component
public class EnvironmentValidator implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final int MIN_SECRET_BYTES = 32;
    private static final Set<String> PLACEHOLDER_SECRETS = Set.of(
            "change-me-access-secret-change-me-access-secret",
            "change-me-refresh-secret-change-me-refresh-secret"
    );

    private final SecurityProperties properties;

    public EnvironmentValidator(SecurityProperties properties) {
        this.properties = properties;
    }

    @Override
    public void afterPropertiesSet() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid security configuration: {}", problem));
            throw new IllegalStateException("Invalid security configuration: " + String.join("; ", problems));
        }
        log.info("Security configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        SecurityProperties.Jwt jwt = properties.getJwt();

        checkSecret("app.security.jwt.access-secret", jwt.getAccessSecret(), problems);
        checkSecret("app.security.jwt.refresh-secret", jwt.getRefreshSecret(), problems);
        if (jwt.getAccessSecret() != null && jwt.getAccessSecret().equals(jwt.getRefreshSecret())) {
            problems.add("access and refresh secrets must differ");
        }

        checkPositive("app.security.jwt.access-ttl", jwt.getAccessTtl(), problems);
        checkPositive("app.security.jwt.refresh-ttl", jwt.getRefreshTtl(), problems);
        if (isPositive(jwt.getAccessTtl()) && isPositive(jwt.getRefreshTtl())
                && jwt.getAccessTtl().compareTo(jwt.getRefreshTtl()) >= 0) {
            problems.add("access-ttl must be shorter than refresh-ttl");
        }
        if (jwt.getClockSkew() == null || jwt.getClockSkew().isNegative()
                || jwt.getClockSkew().compareTo(Duration.ofMinutes(1)) > 0) {
            problems.add("app.security.jwt.clock-skew must be between 0 and 60 seconds");
        }

        int cost = properties.getPassword().getBcryptCost();
        if (cost < 4 || cost > 31) {
            problems.add("app.security.password.bcrypt-cost must be between 4 and 31");
        }

        int otpLength = properties.getOtp().getLength();
        if (otpLength < 4 || otpLength > 10) {
            problems.add("app.security.otp.length must be between 4 and 10");
        }
        Duration otpTtl = properties.getOtp().getTtl();
        checkPositive("app.security.otp.ttl", otpTtl, problems);
        if (isPositive(otpTtl) && otpTtl.compareTo(Duration.ofMinutes(30)) > 0) {
            problems.add("app.security.otp.ttl must not exceed 30 minutes");
        }
        if (properties.getOtp().getMaxAttempts() < 1) {
            problems.add("app.security.otp.max-attempts must be positive");
        }

        if (properties.getLockout().getMaxAttempts() < 1 || properties.getLockout().getIpMaxAttempts() < 1) {
            problems.add("app.security.lockout thresholds must be positive");
        }
        checkPositive("app.security.lockout.duration", properties.getLockout().getDuration(), problems);

        Duration permissionTtl = properties.getPermissionCacheTtl();
        checkPositive("app.security.permission-cache-ttl", permissionTtl, problems);
        if (isPositive(permissionTtl) && isPositive(jwt.getRefreshTtl())
                && permissionTtl.compareTo(jwt.getRefreshTtl()) >= 0) {
            problems.add("permission-cache-ttl must be shorter than refresh-ttl");
        }
        return problems;
    }

    private void checkSecret(String name, String value, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add(name + " is required");
            return;
        }
        if (PLACEHOLDER_SECRETS.contains(value)) {
            problems.add(name + " still uses the shipped placeholder");
        }
        if (!value.startsWith("base64:") && value.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            problems.add(name + " must be at least " + MIN_SECRET_BYTES + " bytes");
        }
    }

    private void checkPositive(String name, Duration value, List<String> problems) {
        if (!isPositive(value)) {
            problems.add(name + " must be a positive duration");
        }
    }

    private static boolean isPositive(Duration value) {
        return value != null && !value.isZero() && !value.isNegative();
    }
}
