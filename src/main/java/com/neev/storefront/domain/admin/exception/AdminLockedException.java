package com.neev.storefront.domain.admin.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;
import lombok.Getter;

import java.time.Instant;

/**
 * 로그인 잠금 상태에서 시도할 때 발생하는 예외
 */
@Getter
public class AdminLockedException extends BusinessException {

    private final Instant lockedUntil;

    public AdminLockedException(Instant lockedUntil) {
        super(ErrorCode.ADM002, "로그인 시도 횟수를 초과했습니다. 잠금 해제: " + lockedUntil);
        this.lockedUntil = lockedUntil;
    }
}
