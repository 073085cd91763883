package com.hrms.backend.modules.auth.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

@Component
public class RedisSecurityCache implements SecurityCache {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> incrementWithExpiryScript;
    private final RedisScript<String> slidingWindowScript;
    private final RedisScript<Long> challengeStoreScript;
    private final RedisScript<Long> challengeConsumeScript;

    public RedisSecurityCache(
            StringRedisTemplate redisTemplate,
            RedisScript<Long> incrementWithExpiryScript,
            RedisScript<String> slidingWindowScript,
            RedisScript<Long> challengeStoreScript,
            RedisScript<Long> challengeConsumeScript
    ) {
        this.redisTemplate = redisTemplate;
        this.incrementWithExpiryScript = incrementWithExpiryScript;
        this.slidingWindowScript = slidingWindowScript;
        this.challengeStoreScript = challengeStoreScript;
        this.challengeConsumeScript = challengeConsumeScript;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(namespaced(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(namespaced(key), value, ttl);
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(namespaced(key), value, ttl));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(namespaced(key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(namespaced(key)));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long millis = redisTemplate.getExpire(namespaced(key), TimeUnit.MILLISECONDS);
        if (millis == null || millis < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl, long reseedAtCount) {
        Long count = redisTemplate.execute(
                incrementWithExpiryScript,
                List.of(namespaced(key)),
                Long.toString(ttl.toMillis()),
                Long.toString(reseedAtCount)
        );
        return count == null ? 0L : count;
    }

    @Override
    public SlidingWindowResult acquireSlot(String key, int limit, Duration window, Instant now) {
        long nowMillis = now.toEpochMilli();
        String result = redisTemplate.execute(
                slidingWindowScript,
                List.of(namespaced(key)),
                Long.toString(nowMillis),
                Long.toString(window.toMillis()),
                Integer.toString(limit),
                nowMillis + "-" + UUID.randomUUID()
        );
        String[] parts = result == null ? new String[0] : result.split(":");
        if (parts.length != 3) {
            throw new IllegalStateException("Sliding window script returned '" + result + "' for " + key);
        }
        return new SlidingWindowResult(
                "1".equals(parts[0]),
                Long.parseLong(parts[1]),
                Instant.ofEpochMilli(Long.parseLong(parts[2]))
        );
    }

    @Override
    public void putChallenge(String key, String digest, Duration ttl) {
        redisTemplate.execute(
                challengeStoreScript,
                List.of(namespaced(key)),
                digest,
                Long.toString(ttl.toMillis())
        );
    }

    @Override
    public ChallengeOutcome consumeChallenge(String key, String digest, int maxAttempts) {
        Long result = redisTemplate.execute(
                challengeConsumeScript,
                List.of(namespaced(key)),
                digest,
                Integer.toString(maxAttempts)
        );
        if (result == null || result == -1L) {
            return ChallengeOutcome.MISSING;
        }
        if (result == 1L) {
            return ChallengeOutcome.MATCHED;
        }
        return result == -2L ? ChallengeOutcome.EXHAUSTED : ChallengeOutcome.MISMATCHED;
    }

    private static String namespaced(String key) {
        return CacheKeys.NAMESPACE + key;
    }
}
