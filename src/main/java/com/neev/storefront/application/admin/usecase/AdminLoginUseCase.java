package com.neev.storefront.application.admin.usecase;

import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.admin.exception.AdminLockedException;
import com.neev.storefront.domain.admin.exception.AdminUnauthorizedException;
import com.neev.storefront.domain.admin.service.LoginAttemptTracker;
import com.neev.storefront.domain.admin.service.LoginAttemptTracker.LoginStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;

/**
 * 관리자 로그인 UseCase
 *
 * - 잠금 중이면 비밀번호를 확인하지 않고 AdminLockedException
 * - 비밀번호 불일치 시 실패 기록 후 AdminUnauthorizedException (한도 도달 시 AdminLockedException)
 * - 성공 시 실패 카운터 초기화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminLoginUseCase {

    private final LoginAttemptTracker loginAttemptTracker;
    private final StoreProperties storeProperties;
    private final Clock clock;

    public void execute(String password) {
        Instant now = clock.instant();

        // 1. 잠금 확인
        LoginStatus status = loginAttemptTracker.status(now);
        if (status.locked()) {
            log.warn("잠금 중 관리자 로그인 시도 - lockedUntil={}", status.lockedUntil());
            throw new AdminLockedException(status.lockedUntil());
        }

        // 2. 비밀번호 확인
        if (!matches(password, storeProperties.getAdmin().getPassword())) {
            LoginStatus after = loginAttemptTracker.recordFailure(now);
            if (after.locked()) {
                log.warn("관리자 로그인 잠금 - lockedUntil={}", after.lockedUntil());
                throw new AdminLockedException(after.lockedUntil());
            }
            log.warn("관리자 로그인 실패 - attemptsLeft={}", after.attemptsLeft());
            throw new AdminUnauthorizedException(after.attemptsLeft());
        }

        // 3. 성공
        loginAttemptTracker.recordSuccess();
        log.info("관리자 로그인");
    }

    private static boolean matches(String given, String expected) {
        if (given == null || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                given.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8)
        );
    }
}
