package com.neev.storefront.application.admin.dto;

import com.neev.storefront.domain.admin.service.LoginAttemptTracker.LoginStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * 관리자 로그인 폼 상태
 */
public record AdminStatusResponse(
        @Schema(description = "잠금까지 남은 시도 횟수", example = "3")
        int attemptsLeft,
        @Schema(description = "잠금 해제 시각 (잠겨 있지 않으면 null)", example = "2026-10-17T10:05:00Z")
        Instant lockedUntil
) {
    public static AdminStatusResponse from(LoginStatus status) {
        return new AdminStatusResponse(status.attemptsLeft(), status.lockedUntil());
    }
}
