package com.hrms.backend.modules.auth.application;

import java.time.Duration;
import java.time.Instant;

public record RateLimitDecision(boolean allowed, int limit, int remaining, Instant resetAt) {

    public Duration retryAfter(Instant now) {
        Duration wait = Duration.between(now, resetAt);
        return wait.isNegative() ? Duration.ZERO : wait;
    }
}
