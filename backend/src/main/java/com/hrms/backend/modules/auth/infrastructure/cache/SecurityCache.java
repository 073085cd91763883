package com.hrms.backend.modules.auth.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Narrow view of the shared cache used by the security core.
 * <p>
 * Every read-modify-write primitive is atomic per key on the server side. Implementations let
 * backend failures propagate as {@link org.springframework.dao.DataAccessException}; callers decide
 * whether a failure fails open or closed.
 */
public interface SecurityCache {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * @return {@code true} when this call created the entry
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /**
     * Remaining lifetime of the key, empty when the key is absent or has no expiry.
     */
    Optional<Duration> ttl(String key);

    /**
     * Increments a counter. The expiry is applied when the counter is created and re-applied
     * when the counter reaches {@code reseedAtCount}.
     */
    long incrementWithExpiry(String key, Duration ttl, long reseedAtCount);

    /**
     * Prunes entries older than {@code now - window}, counts the rest and records {@code now}
     * when the count is below {@code limit}, as one atomic step.
     */
    SlidingWindowResult acquireSlot(String key, int limit, Duration window, Instant now);

    /**
     * Stores a challenge digest, replacing any live challenge under the same key.
     */
    void putChallenge(String key, String digest, Duration ttl);

    /**
     * Compares a submitted digest against the stored one. A match deletes the entry; a mismatch
     * counts an attempt and deletes the entry once {@code maxAttempts} is reached.
     */
    ChallengeOutcome consumeChallenge(String key, String digest, int maxAttempts);

    record SlidingWindowResult(boolean allowed, long count, Instant resetAt) {
    }

    enum ChallengeOutcome {
        MATCHED,
        MISMATCHED,
        EXHAUSTED,
        MISSING
    }
}
