package com.hrms.backend.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache;

/**
 * Single-threaded stand-in for the Redis cache that follows the Lua scripts' semantics and
 * expires entries against the supplied clock.
 */
public class InMemorySecurityCache implements SecurityCache {

    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();

    public InMemorySecurityCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Entry entry = live(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.value);
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        entries.put(key, Entry.value(value, expiry(ttl)));
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        if (live(key) != null) {
            return false;
        }
        set(key, value, ttl);
        return true;
    }

    @Override
    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public synchronized boolean exists(String key) {
        return live(key) != null;
    }

    @Override
    public synchronized Optional<Duration> ttl(String key) {
        Entry entry = live(key);
        if (entry == null || entry.expiresAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(clock.instant(), entry.expiresAt));
    }

    @Override
    public synchronized long incrementWithExpiry(String key, Duration ttl, long reseedAtCount) {
        Entry entry = live(key);
        long count = entry == null ? 1 : Long.parseLong(entry.value) + 1;
        Instant expiresAt = entry == null ? null : entry.expiresAt;
        if (count == 1 || count == reseedAtCount || expiresAt == null) {
            expiresAt = expiry(ttl);
        }
        entries.put(key, Entry.value(Long.toString(count), expiresAt));
        return count;
    }

    @Override
    public synchronized SlidingWindowResult acquireSlot(String key, int limit, Duration window, Instant now) {
        Entry entry = live(key);
        List<Instant> stamps = entry == null ? new ArrayList<>() : entry.timestamps;
        Instant cutoff = now.minus(window);
        stamps.removeIf(stamp -> !stamp.isAfter(cutoff));
        boolean allowed = stamps.size() < limit;
        if (allowed) {
            stamps.add(now);
        }
        entries.put(key, Entry.window(stamps, now.plus(window)));
        Instant resetAt = stamps.isEmpty() ? now.plus(window) : stamps.get(0).plus(window);
        return new SlidingWindowResult(allowed, stamps.size(), resetAt);
    }

    @Override
    public synchronized void putChallenge(String key, String digest, Duration ttl) {
        entries.put(key, Entry.challenge(digest, expiry(ttl)));
    }

    @Override
    public synchronized ChallengeOutcome consumeChallenge(String key, String digest, int maxAttempts) {
        Entry entry = live(key);
        if (entry == null) {
            return ChallengeOutcome.MISSING;
        }
        if (entry.value.equals(digest)) {
            entries.remove(key);
            return ChallengeOutcome.MATCHED;
        }
        entry.attempts++;
        if (entry.attempts >= maxAttempts) {
            entries.remove(key);
            return ChallengeOutcome.EXHAUSTED;
        }
        return ChallengeOutcome.MISMATCHED;
    }

    public synchronized int size() {
        for (String key : List.copyOf(entries.keySet())) {
            live(key);
        }
        return entries.size();
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private static final class Entry {
        private final String value;
        private final List<Instant> timestamps;
        private final Instant expiresAt;
        private int attempts;

        private Entry(String value, List<Instant> timestamps, Instant expiresAt) {
            this.value = value;
            this.timestamps = timestamps;
            this.expiresAt = expiresAt;
        }

        static Entry value(String value, Instant expiresAt) {
            return new Entry(value, null, expiresAt);
        }

        static Entry window(List<Instant> timestamps, Instant expiresAt) {
            return new Entry(null, timestamps, expiresAt);
        }

        static Entry challenge(String digest, Instant expiresAt) {
            return new Entry(digest, null, expiresAt);
        }
    }
}
