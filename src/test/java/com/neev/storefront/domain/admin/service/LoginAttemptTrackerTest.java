package com.neev.storefront.domain.admin.service;

import com.neev.storefront.domain.admin.service.LoginAttemptTracker.LoginStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("관리자 로그인 잠금 테스트")
class LoginAttemptTrackerTest {

    private static final Instant NOW = Instant.parse("2026-10-17T10:00:00Z");

    private LoginAttemptTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new LoginAttemptTracker(3, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("실패할 때마다 남은 시도 횟수가 줄어든다")
    void 남은_시도_감소() {
        // when
        LoginStatus first = tracker.recordFailure(NOW);
        LoginStatus second = tracker.recordFailure(NOW);

        // then
        assertThat(first.attemptsLeft()).isEqualTo(2);
        assertThat(second.attemptsLeft()).isEqualTo(1);
        assertThat(second.locked()).isFalse();
    }

    @Test
    @DisplayName("3회 연속 실패하면 5분간 잠긴다")
    void 잠금() {
        // when
        tracker.recordFailure(NOW);
        tracker.recordFailure(NOW);
        LoginStatus third = tracker.recordFailure(NOW);

        // then
        assertThat(third.locked()).isTrue();
        assertThat(third.lockedUntil()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(tracker.isLocked(NOW.plusSeconds(299))).isTrue();
    }

    @Test
    @DisplayName("잠금 시간이 지나면 잠금과 실패 횟수가 초기화된다")
    void 잠금_만료() {
        // given
        tracker.recordFailure(NOW);
        tracker.recordFailure(NOW);
        tracker.recordFailure(NOW);

        // when
        LoginStatus status = tracker.status(NOW.plus(Duration.ofMinutes(5)));

        // then
        assertThat(status.locked()).isFalse();
        assertThat(status.attemptsLeft()).isEqualTo(3);
    }

    @Test
    @DisplayName("잠금 중의 실패는 잠금 시간을 늘리지 않는다")
    void 잠금_중_실패() {
        // given
        tracker.recordFailure(NOW);
        tracker.recordFailure(NOW);
        tracker.recordFailure(NOW);

        // when
        LoginStatus status = tracker.recordFailure(NOW.plusSeconds(60));

        // then
        assertThat(status.lockedUntil()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("로그인에 성공하면 실패 횟수가 초기화된다")
    void 성공_초기화() {
        // given
        tracker.recordFailure(NOW);
        tracker.recordFailure(NOW);

        // when
        tracker.recordSuccess();

        // then
        assertThat(tracker.status(NOW).attemptsLeft()).isEqualTo(3);
    }
}
