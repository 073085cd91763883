package com.hrms.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import com.hrms.backend.global.config.SecurityProperties;
import com.hrms.backend.modules.auth.infrastructure.cache.SecurityCache;
import com.hrms.backend.support.InMemorySecurityCache;
import com.hrms.backend.support.MutableClock;
import com.hrms.backend.support.SecurityTestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class RateLimiterServiceTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private MutableClock clock;
    private SecurityProperties properties;
    private RateLimiterService limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T09:00:00Z");
        properties = SecurityTestProperties.defaults();
        properties.getRateLimit().getEndpoints().put("/auth/login", new SecurityProperties.Window(5, Duration.ofMinutes(1)));
        limiter = new RateLimiterService(new InMemorySecurityCache(clock), properties, clock);
    }

    @Test
    @DisplayName("한도 3에서 네 번째 요청은 가장 오래된 요청이 창을 벗어날 때까지 거부된다")
    void fourthRequestWaitsForOldestToLeaveWindow() {
        RateLimitDecision first = limiter.check("k", 3, WINDOW);
        clock.advance(Duration.ofSeconds(10));
        limiter.check("k", 3, WINDOW);
        clock.advance(Duration.ofSeconds(10));
        RateLimitDecision third = limiter.check("k", 3, WINDOW);
        clock.advance(Duration.ofSeconds(10));

        RateLimitDecision fourth = limiter.check("k", 3, WINDOW);

        assertThat(first.allowed()).isTrue();
        assertThat(first.remaining()).isEqualTo(2);
        assertThat(third.allowed()).isTrue();
        assertThat(third.remaining()).isZero();
        assertThat(fourth.allowed()).isFalse();
        assertThat(fourth.resetAt()).isEqualTo(Instant.parse("2025-01-01T09:01:00Z"));
        assertThat(fourth.retryAfter(clock.instant())).isEqualTo(Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(30));
        assertThat(limiter.check("k", 3, WINDOW).allowed()).isTrue();
    }

    @Test
    @DisplayName("거부된 요청은 창을 늘리지 않는다")
    void rejectedRequestsAreNotRecorded() {
        for (int i = 0; i < 3; i++) {
            limiter.check("k", 3, WINDOW);
        }
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.check("k", 3, WINDOW).allowed()).isFalse();
        }

        clock.advance(WINDOW);

        assertThat(limiter.check("k", 3, WINDOW).remaining()).isEqualTo(2);
    }

    @Test
    void keysAreIndependent() {
        for (int i = 0; i < 3; i++) {
            limiter.checkIdentifier("otp", "jane@example.com", 3, WINDOW);
        }

        assertThat(limiter.checkIdentifier("otp", "JANE@example.com", 3, WINDOW).allowed()).isFalse();
        assertThat(limiter.checkIdentifier("otp", "john@example.com", 3, WINDOW).allowed()).isTrue();
        assertThat(limiter.checkIdentifier("password_reset", "jane@example.com", 3, WINDOW).allowed()).isTrue();
    }

    @Test
    void endpointLimitAppliesOnlyToConfiguredPaths() {
        assertThat(limiter.checkEndpoint("203.0.113.7", "/profile/me")).isEmpty();
        assertThat(limiter.checkEndpoint("203.0.113.7", "/auth/login"))
                .hasValueSatisfying(decision -> assertThat(decision.limit()).isEqualTo(5));
    }

    @Test
    @DisplayName("캐시 장애 시 설정에 따라 요청을 통과시킨다")
    void failsOpenWhenCacheIsDown() {
        SecurityCache broken = mock(SecurityCache.class);
        when(broken.acquireSlot(any(), anyInt(), any(), any()))
                .thenThrow(new RedisConnectionFailureException("down"));
        RateLimiterService failOpen = new RateLimiterService(broken, properties, clock);

        RateLimitDecision decision = failOpen.check("k", 3, WINDOW);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(3);
    }

    @Test
    @DisplayName("fail-open이 꺼져 있으면 캐시 장애가 전파된다")
    void propagatesCacheFailureWhenFailClosed() {
        SecurityCache broken = mock(SecurityCache.class);
        when(broken.acquireSlot(any(), anyInt(), any(), any()))
                .thenThrow(new RedisConnectionFailureException("down"));
        properties.getRateLimit().setFailOpen(false);
        RateLimiterService failClosed = new RateLimiterService(broken, properties, clock);

        assertThatThrownBy(() -> failClosed.check("k", 3, WINDOW))
                .isInstanceOf(RedisConnectionFailureException.class);
    }
}
