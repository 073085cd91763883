package com.hrms.backend.modules.auth.application;

import java.time.Duration;
import java.util.Locale;

import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.infrastructure.cache.CacheKeys;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Counts consecutive authentication failures per account and per client IP.
 * <p>
 * The counter lives in the cache with a self-expiring TTL seeded on the first failure. Reaching
 * the threshold re-seeds the TTL once, so the lock lasts the full lockout duration from the
 * failure that triggered it. Cache failures propagate; a lock check that cannot be answered
 * rejects the request.
 */
@Service
public class LoginAttemptGovernor {

    private static final Logger log = LoggerFactory.getLogger(LoginAttemptGovernor.class);

    public enum AttemptScope {
        ACCOUNT("email:"),
        CLIENT_IP("ip:");

        private final String prefix;

        AttemptScope(String prefix) {
            this.prefix = prefix;
        }
    }

    public record LockStatus(boolean locked, long failures, Duration remaining) {

        static LockStatus clear(long failures) {
            return new LockStatus(false, failures, Duration.ZERO);
        }
    }

    private final SecurityCache cache;
    private final SecurityProperties.Lockout settings;

    public LoginAttemptGovernor(SecurityCache cache, SecurityProperties properties) {
        this.cache = cache;
        this.settings = properties.getLockout();
    }

    public long recordFailure(AttemptScope scope, String identifier) {
        int threshold = threshold(scope);
        long failures = cache.incrementWithExpiry(key(scope, identifier), settings.getDuration(), threshold);
        if (failures == threshold) {
            log.warn("Locked {} {} for {} after {} failed attempts",
                    scope, identifier, settings.getDuration(), failures);
        }
        return failures;
    }

    public LockStatus status(AttemptScope scope, String identifier) {
        String key = key(scope, identifier);
        long failures = cache.get(key).map(LoginAttemptGovernor::parseCount).orElse(0L);
        if (failures < threshold(scope)) {
            return LockStatus.clear(failures);
        }
        Duration remaining = cache.ttl(key).orElse(settings.getDuration());
        return new LockStatus(true, failures, remaining);
    }

    public boolean isLocked(AttemptScope scope, String identifier) {
        return status(scope, identifier).locked();
    }

    public void clear(AttemptScope scope, String identifier) {
        cache.delete(key(scope, identifier));
    }

    public Duration lockoutDuration() {
        return settings.getDuration();
    }

    public int threshold(AttemptScope scope) {
        return scope == AttemptScope.ACCOUNT ? settings.getMaxAttempts() : settings.getIpMaxAttempts();
    }

    static String key(AttemptScope scope, String identifier) {
        String normalized = identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
        return CacheKeys.LOGIN_ATTEMPTS + scope.prefix + normalized;
    }

    private static long parseCount(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }
}
