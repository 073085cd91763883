package com.hrms.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hrms.backend.global.web.ClientContext;
import com.hrms.backend.modules.auth.domain.UserAccount;
import com.hrms.backend.modules.auth.domain.UserSession;
import com.hrms.backend.modules.auth.infrastructure.cache.CacheKeys;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache;
import com.hrms.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Durable session records plus the cache-backed revocation list.
 * <p>
 * A revocation entry lives exactly as long as the refresh token it invalidates could still be
 * used. Revocation writes propagate cache failures so that a logout or rotation never reports
 * success without the entry in place.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final String REVOKED_MARKER = "1";
    private static final int MAX_STORED_USER_AGENT = 512;

    private final UserSessionRepository userSessionRepository;
    private final SecurityCache cache;
    private final Clock clock;

    public SessionRegistry(UserSessionRepository userSessionRepository, SecurityCache cache, Clock clock) {
        this.userSessionRepository = userSessionRepository;
        this.cache = cache;
        this.clock = clock;
    }

    @Transactional
    public UserSession storeSession(UserAccount user, IssuedTokenPair tokens, ClientContext client) {
        ClientContext context = client == null ? ClientContext.unknown() : client;
        UserSession session = new UserSession(tokens.sessionId());
        session.setUser(user);
        session.setIssuedAt(OffsetDateTime.ofInstant(tokens.issuedAt(), clock.getZone()));
        session.setExpiresAt(OffsetDateTime.ofInstant(tokens.refreshExpiresAt(), clock.getZone()));
        session.setClientFingerprint(context.fingerprint());
        session.setIpAddress(context.ipAddress());
        session.setUserAgent(truncate(context.userAgent()));
        return userSessionRepository.save(session);
    }

    public void revoke(UUID sessionId, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.set(key(sessionId), REVOKED_MARKER, ttl);
    }

    /**
     * Inserts the revocation entry only if none exists.
     *
     * @return {@code true} when this caller revoked the session, {@code false} when it was already revoked
     */
    public boolean revokeOnce(UUID sessionId, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return cache.setIfAbsent(key(sessionId), REVOKED_MARKER, ttl);
    }

    /**
     * Removes a revocation entry written by {@link #revokeOnce} whose enclosing operation failed.
     */
    public void release(UUID sessionId) {
        cache.delete(key(sessionId));
        log.info("Released revocation of session {}", sessionId);
    }

    /**
     * Releases the revocation entry if the current transaction rolls back. No-op outside a transaction.
     */
    public void releaseOnRollback(UUID sessionId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    release(sessionId);
                }
            }
        });
    }

    public boolean isRevoked(UUID sessionId) {
        return cache.exists(key(sessionId));
    }

    /**
     * Revokes one session until its refresh token would have expired and marks the audit row.
     */
    @Transactional
    public void revokeSession(UUID sessionId, Instant refreshExpiresAt, String reason) {
        revoke(sessionId, remaining(refreshExpiresAt));
        userSessionRepository.markRevoked(sessionId, OffsetDateTime.now(clock), reason);
        log.info("Revoked session {} ({})", sessionId, reason);
    }

    /**
     * Revokes a session whose refresh expiry is known only from its audit row.
     */
    @Transactional
    public void revokeSession(UUID sessionId, String reason, Duration fallbackTtl) {
        Instant refreshExpiresAt = userSessionRepository.findById(sessionId)
                .map(session -> session.getExpiresAt().toInstant())
                .orElse(clock.instant().plus(fallbackTtl));
        revokeSession(sessionId, refreshExpiresAt, reason);
    }

    @Transactional
    public int revokeAllForUser(UUID userId, String reason) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UserSession> sessions = userSessionRepository.findActiveByUserId(userId, now);
        for (UserSession session : sessions) {
            revoke(session.getId(), remaining(session.getExpiresAt().toInstant()));
            session.setRevokedAt(now);
            session.setRevokedReason(reason);
        }
        log.info("Revoked {} session(s) of user {} ({})", sessions.size(), userId, reason);
        return sessions.size();
    }

    public Duration remaining(Instant refreshExpiresAt) {
        Duration remaining = Duration.between(clock.instant(), refreshExpiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    static String key(UUID sessionId) {
        return CacheKeys.REVOKED_SESSION + sessionId;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_STORED_USER_AGENT) {
            return value;
        }
        return value.substring(0, MAX_STORED_USER_AGENT);
    }
}
