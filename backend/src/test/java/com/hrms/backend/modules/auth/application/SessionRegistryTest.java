package com.hrms.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hrms.backend.global.web.ClientContext;
import com.hrms.backend.modules.auth.domain.UserAccount;
import com.hrms.backend.modules.auth.domain.UserSession;
import com.hrms.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.hrms.backend.support.InMemorySecurityCache;
import com.hrms.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@ExtendWith(MockitoExtension.class)
class SessionRegistryTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private UserSessionRepository userSessionRepository;

    private MutableClock clock;
    private InMemorySecurityCache cache;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T09:00:00Z");
        cache = new InMemorySecurityCache(clock);
        registry = new SessionRegistry(userSessionRepository, cache, clock);
    }

    @Test
    @DisplayName("세션 저장 시 클라이언트 지문과 만료 시각이 기록된다")
    void storeSessionRecordsClientDetails() {
        when(userSessionRepository.save(any(UserSession.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UUID sessionId = UUID.randomUUID();
        Instant now = clock.instant();
        IssuedTokenPair tokens = new IssuedTokenPair("a", "r", sessionId, now,
                now.plus(Duration.ofMinutes(15)), now.plus(Duration.ofDays(7)));
        ClientContext client = new ClientContext("203.0.113.7", "JUnit", "en");

        UserSession stored = registry.storeSession(new UserAccount(), tokens, client);

        assertThat(stored.getId()).isEqualTo(sessionId);
        assertThat(stored.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(stored.getClientFingerprint()).isEqualTo(client.fingerprint()).hasSize(64);
        assertThat(stored.getExpiresAt()).isEqualTo(OffsetDateTime.parse("2025-01-08T09:00:00Z"));
    }

    @Test
    @DisplayName("폐기 항목은 리프레시 토큰 만료까지만 유지된다")
    void revocationLastsUntilRefreshExpiry() {
        UUID sessionId = UUID.randomUUID();

        registry.revokeSession(sessionId, clock.instant().plus(Duration.ofHours(2)), "LOGOUT");

        assertThat(registry.isRevoked(sessionId)).isTrue();
        verify(userSessionRepository).markRevoked(eq(sessionId), any(), eq("LOGOUT"));

        clock.advance(Duration.ofHours(2));
        assertThat(registry.isRevoked(sessionId)).isFalse();
    }

    @Test
    @DisplayName("트랜잭션이 롤백되면 선점한 폐기 항목이 해제되고 커밋되면 유지된다")
    void revocationIsReleasedOnlyOnRollback() {
        UUID rolledBack = UUID.randomUUID();
        UUID committed = UUID.randomUUID();
        registry.revokeOnce(rolledBack, Duration.ofDays(1));
        registry.revokeOnce(committed, Duration.ofDays(1));

        TransactionSynchronizationManager.initSynchronization();
        try {
            registry.releaseOnRollback(rolledBack);
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
        TransactionSynchronizationManager.initSynchronization();
        try {
            registry.releaseOnRollback(committed);
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        assertThat(registry.isRevoked(rolledBack)).isFalse();
        assertThat(registry.isRevoked(committed)).isTrue();
    }

    @Test
    @DisplayName("이미 만료된 세션은 폐기 목록에 남기지 않는다")
    void expiredSessionLeavesNoEntry() {
        UUID sessionId = UUID.randomUUID();

        registry.revoke(sessionId, Duration.ZERO);

        assertThat(registry.isRevoked(sessionId)).isFalse();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("같은 세션을 두 번 폐기하려 하면 두 번째는 실패한다")
    void revokeOnceSucceedsOnlyForFirstCaller() {
        UUID sessionId = UUID.randomUUID();

        assertThat(registry.revokeOnce(sessionId, Duration.ofMinutes(5))).isTrue();
        assertThat(registry.revokeOnce(sessionId, Duration.ofMinutes(5))).isFalse();
    }

    @Test
    void revokeAllForUserRevokesEveryActiveSession() {
        UserSession first = session(Duration.ofDays(1));
        UserSession second = session(Duration.ofDays(3));
        when(userSessionRepository.findActiveByUserId(eq(USER_ID), any())).thenReturn(List.of(first, second));

        int revoked = registry.revokeAllForUser(USER_ID, "PASSWORD_RESET");

        assertThat(revoked).isEqualTo(2);
        assertThat(registry.isRevoked(first.getId())).isTrue();
        assertThat(registry.isRevoked(second.getId())).isTrue();
        assertThat(first.getRevokedReason()).isEqualTo("PASSWORD_RESET");
        assertThat(second.getRevokedAt()).isEqualTo(OffsetDateTime.now(clock));

        clock.advance(Duration.ofDays(2));
        assertThat(registry.isRevoked(first.getId())).isFalse();
        assertThat(registry.isRevoked(second.getId())).isTrue();
    }

    @Test
    void revokeByIdFallsBackWhenAuditRowIsMissing() {
        UUID sessionId = UUID.randomUUID();
        when(userSessionRepository.findById(sessionId)).thenReturn(Optional.empty());

        registry.revokeSession(sessionId, "ADMIN_REVOKED", Duration.ofDays(7));

        assertThat(cache.ttl(SessionRegistry.key(sessionId))).contains(Duration.ofDays(7));
    }

    private UserSession session(Duration lifetime) {
        UserSession session = new UserSession(UUID.randomUUID());
        session.setIssuedAt(OffsetDateTime.now(clock));
        session.setExpiresAt(OffsetDateTime.ofInstant(clock.instant().plus(lifetime), ZoneOffset.UTC));
        return session;
    }
}
