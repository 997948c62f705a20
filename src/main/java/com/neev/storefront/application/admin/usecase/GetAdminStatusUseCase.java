package com.neev.storefront.application.admin.usecase;

import com.neev.storefront.application.admin.dto.AdminStatusResponse;
import com.neev.storefront.domain.admin.service.LoginAttemptTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 관리자 로그인 잠금 상태 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetAdminStatusUseCase {

    private final LoginAttemptTracker loginAttemptTracker;
    private final Clock clock;

    public AdminStatusResponse execute() {
        return AdminStatusResponse.from(loginAttemptTracker.status(clock.instant()));
    }
}
