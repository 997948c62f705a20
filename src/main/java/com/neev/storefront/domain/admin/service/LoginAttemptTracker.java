package com.neev.storefront.domain.admin.service;

import com.neev.storefront.common.config.StoreProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * 관리자 로그인 실패 횟수/잠금 관리
 *
 * - 프로세스 단위 카운터 (재시작 시 초기화)
 * - 연속 실패가 maxAttempts 에 도달하면 lockoutDuration 동안 잠금
 * - 로그인 성공 또는 잠금 만료 시 카운터 초기화
 * 모든 메서드는 호출 시각을 인자로 받는다.
 */
@Component
public class LoginAttemptTracker {

    private final int maxAttempts;
    private final Duration lockoutDuration;

    private int failures;
    private Instant lockedUntil;

    @Autowired
    public LoginAttemptTracker(StoreProperties storeProperties) {
        this(storeProperties.getAdmin().getMaxAttempts(), storeProperties.getAdmin().getLockoutDuration());
    }

    LoginAttemptTracker(int maxAttempts, Duration lockoutDuration) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 는 1 이상이어야 합니다");
        }
        this.maxAttempts = maxAttempts;
        this.lockoutDuration = lockoutDuration;
    }

    public synchronized LoginStatus status(Instant now) {
        expireLockout(now);
        return new LoginStatus(maxAttempts - failures, lockedUntil);
    }

    public synchronized boolean isLocked(Instant now) {
        expireLockout(now);
        return lockedUntil != null;
    }

    /**
     * 실패 기록, 한도에 도달하면 잠금 시작
     */
    public synchronized LoginStatus recordFailure(Instant now) {
        expireLockout(now);
        if (lockedUntil == null) {
            failures++;
            if (failures >= maxAttempts) {
                lockedUntil = now.plus(lockoutDuration);
            }
        }
        return new LoginStatus(maxAttempts - failures, lockedUntil);
    }

    public synchronized void recordSuccess() {
        failures = 0;
        lockedUntil = null;
    }

    private void expireLockout(Instant now) {
        if (lockedUntil != null && !now.isBefore(lockedUntil)) {
            lockedUntil = null;
            failures = 0;
        }
    }

    /**
     * @param attemptsLeft 잠금까지 남은 시도 횟수
     * @param lockedUntil 잠금 해제 시각 (잠겨 있지 않으면 null)
     */
    public record LoginStatus(int attemptsLeft, Instant lockedUntil) {

        public boolean locked() {
            return lockedUntil != null;
        }
    }
}
