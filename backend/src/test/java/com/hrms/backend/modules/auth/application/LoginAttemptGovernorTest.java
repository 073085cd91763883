package com.hrms.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.AttemptScope;
import com.hrms.backend.modules.auth.application.LoginAttemptGovernor.LockStatus;
import com.hrms.backend.support.InMemorySecurityCache;
import com.hrms.backend.support.MutableClock;
import com.hrms.backend.support.SecurityTestProperties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LoginAttemptGovernorTest {

    private MutableClock clock;
    private LoginAttemptGovernor governor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T09:00:00Z");
        governor = new LoginAttemptGovernor(new InMemorySecurityCache(clock), SecurityTestProperties.defaults());
    }

    @Test
    @DisplayName("다섯 번째 실패에서 계정이 잠긴다")
    void locksAccountAtThreshold() {
        for (int i = 0; i < 4; i++) {
            governor.recordFailure(AttemptScope.ACCOUNT, "jane@example.com");
        }
        assertThat(governor.isLocked(AttemptScope.ACCOUNT, "jane@example.com")).isFalse();

        long failures = governor.recordFailure(AttemptScope.ACCOUNT, "Jane@Example.com");

        LockStatus status = governor.status(AttemptScope.ACCOUNT, "jane@example.com");
        assertThat(failures).isEqualTo(5);
        assertThat(status.locked()).isTrue();
        assertThat(status.remaining()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("잠금 시간은 임계치에 도달한 실패 시점부터 전체 기간 동안 유지된다")
    void lockLastsFullDurationFromTriggeringFailure() {
        governor.recordFailure(AttemptScope.ACCOUNT, "jane@example.com");
        clock.advance(Duration.ofMinutes(20));
        for (int i = 0; i < 4; i++) {
            governor.recordFailure(AttemptScope.ACCOUNT, "jane@example.com");
        }

        clock.advance(Duration.ofMinutes(29));
        assertThat(governor.isLocked(AttemptScope.ACCOUNT, "jane@example.com")).isTrue();

        clock.advance(Duration.ofMinutes(1));
        assertThat(governor.isLocked(AttemptScope.ACCOUNT, "jane@example.com")).isFalse();
        assertThat(governor.status(AttemptScope.ACCOUNT, "jane@example.com").failures()).isZero();
    }

    @Test
    @DisplayName("실패 카운터는 첫 실패 후 잠금 기간이 지나면 사라진다")
    void counterExpiresWithoutReachingThreshold() {
        governor.recordFailure(AttemptScope.ACCOUNT, "jane@example.com");
        governor.recordFailure(AttemptScope.ACCOUNT, "jane@example.com");

        clock.advance(Duration.ofMinutes(30));

        assertThat(governor.status(AttemptScope.ACCOUNT, "jane@example.com").failures()).isZero();
    }

    @Test
    void clearResetsTheCounter() {
        for (int i = 0; i < 5; i++) {
            governor.recordFailure(AttemptScope.ACCOUNT, "jane@example.com");
        }

        governor.clear(AttemptScope.ACCOUNT, "jane@example.com");

        assertThat(governor.status(AttemptScope.ACCOUNT, "jane@example.com"))
                .isEqualTo(new LockStatus(false, 0, Duration.ZERO));
    }

    @Test
    @DisplayName("IP 범위는 별도의 더 높은 임계치를 사용한다")
    void ipScopeUsesItsOwnThreshold() {
        for (int i = 0; i < 19; i++) {
            governor.recordFailure(AttemptScope.CLIENT_IP, "203.0.113.7");
        }
        assertThat(governor.isLocked(AttemptScope.CLIENT_IP, "203.0.113.7")).isFalse();
        assertThat(governor.isLocked(AttemptScope.ACCOUNT, "203.0.113.7")).isFalse();

        governor.recordFailure(AttemptScope.CLIENT_IP, "203.0.113.7");

        assertThat(governor.isLocked(AttemptScope.CLIENT_IP, "203.0.113.7")).isTrue();
    }
}
