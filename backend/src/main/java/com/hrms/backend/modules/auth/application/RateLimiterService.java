package com.hrms.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.infrastructure.cache.CacheKeys;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache.SlidingWindowResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Sliding-window limiter. Each check prunes, counts and records in one atomic cache step.
 * Keys are scoped by client IP, by client IP and endpoint, or by an identifier such as an email.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final SecurityCache cache;
    private final SecurityProperties.RateLimit settings;
    private final Clock clock;

    public RateLimiterService(SecurityCache cache, SecurityProperties properties, Clock clock) {
        this.cache = cache;
        this.settings = properties.getRateLimit();
        this.clock = clock;
    }

    public RateLimitDecision check(String key, int limit, Duration window) {
        Instant now = clock.instant();
        try {
            SlidingWindowResult result = cache.acquireSlot(CacheKeys.RATE_LIMIT + key, limit, window, now);
            int remaining = (int) Math.max(0, limit - result.count());
            return new RateLimitDecision(result.allowed(), limit, remaining, result.resetAt());
        } catch (DataAccessException ex) {
            if (!settings.isFailOpen()) {
                throw ex;
            }
            log.warn("Rate limit check for {} skipped, cache unavailable: {}", key, ex.getMessage());
            return new RateLimitDecision(true, limit, limit, now.plus(window));
        }
    }

    public RateLimitDecision checkIp(String ip) {
        SecurityProperties.Window window = settings.getIp();
        return check("ip:" + ip, window.getLimit(), window.getWindow());
    }

    public Optional<RateLimitDecision> checkEndpoint(String ip, String path) {
        SecurityProperties.Window window = settings.getEndpoints().get(path);
        if (window == null) {
            return Optional.empty();
        }
        return Optional.of(check("endpoint:" + ip + ":" + path, window.getLimit(), window.getWindow()));
    }

    public RateLimitDecision checkIdentifier(String scope, String identifier, int limit, Duration window) {
        String normalized = identifier == null ? "" : identifier.trim().toLowerCase(Locale.ROOT);
        return check("user:" + scope + ":" + normalized, limit, window);
    }
}
