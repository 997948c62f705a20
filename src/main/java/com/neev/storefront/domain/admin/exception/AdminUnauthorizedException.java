package com.neev.storefront.domain.admin.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 관리자 비밀번호가 틀렸을 때 발생하는 예외
 */
@Getter
public class AdminUnauthorizedException extends BusinessException {

    private final int attemptsLeft;

    public AdminUnauthorizedException(int attemptsLeft) {
        super(ErrorCode.ADM001, "관리자 비밀번호가 올바르지 않습니다. 남은 시도: " + attemptsLeft);
        this.attemptsLeft = attemptsLeft;
    }
}
