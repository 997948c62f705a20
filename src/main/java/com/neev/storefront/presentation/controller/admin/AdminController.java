package com.neev.storefront.presentation.controller.admin;

import com.neev.storefront.application.admin.dto.AdminDashboardResponse;
import com.neev.storefront.application.admin.dto.AdminStatusResponse;
import com.neev.storefront.application.admin.usecase.AdminLoginUseCase;
import com.neev.storefront.application.admin.usecase.GetAdminDashboardUseCase;
import com.neev.storefront.application.admin.usecase.GetAdminStatusUseCase;
import com.neev.storefront.presentation.session.AdminSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * 관리자 로그인/대시보드 API
 */
@Slf4j
@Tag(name = "관리자", description = "관리자 로그인, 잠금 상태, 대시보드 API")
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final String DEFAULT_NEXT = "/admin";

    private final AdminLoginUseCase adminLoginUseCase;
    private final GetAdminStatusUseCase getAdminStatusUseCase;
    private final GetAdminDashboardUseCase getAdminDashboardUseCase;

    /**
     * 로그인 화면 (남은 시도 횟수/잠금 상태)
     * GET /admin/login
     */
    @Operation(summary = "로그인 화면", description = "남은 시도 횟수와 잠금 해제 시각을 반환합니다")
    @GetMapping("/login")
    public ResponseEntity<AdminStatusResponse> getLogin() {
        return ResponseEntity.ok(getAdminStatusUseCase.execute());
    }

    /**
     * 로그인
     * POST /admin/login (form: password) -> 302 next
     */
    @Operation(summary = "관리자 로그인", description = "성공 시 next 경로로 리다이렉트, 실패 401, 잠금 423")
    @PostMapping("/login")
    public ResponseEntity<Void> login(
            @Parameter(description = "관리자 비밀번호") @RequestParam(required = false) String password,
            @Parameter(description = "로그인 후 이동할 경로") @RequestParam(required = false) String next,
            HttpSession session) {

        adminLoginUseCase.execute(password);
        AdminSession.grant(session);

        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(safeNext(next)))
                .build();
    }

    /**
     * 로그아웃
     * GET /admin/logout -> 302 /
     */
    @Operation(summary = "관리자 로그아웃")
    @GetMapping("/logout")
    public ResponseEntity<Void> logout(HttpSession session) {
        AdminSession.revoke(session);
        log.info("관리자 로그아웃");
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create("/"))
                .build();
    }

    /**
     * 로그인 잠금 상태
     * GET /admin/status
     */
    @Operation(summary = "로그인 잠금 상태", description = "{attemptsLeft, lockedUntil}")
    @GetMapping("/status")
    public ResponseEntity<AdminStatusResponse> getStatus() {
        return ResponseEntity.ok(getAdminStatusUseCase.execute());
    }

    /**
     * 대시보드 (최근 주문 200건 + 전체 상품)
     * GET /admin
     */
    @Operation(summary = "관리자 대시보드")
    @GetMapping
    public ResponseEntity<AdminDashboardResponse> getDashboard() {
        return ResponseEntity.ok(getAdminDashboardUseCase.execute());
    }

    /**
     * 외부 URL 로의 리다이렉트 방지 (같은 사이트의 절대 경로만 허용)
     */
    static String safeNext(String next) {
        if (next == null || next.isBlank() || !next.startsWith("/") || next.startsWith("//") || next.contains("\\")) {
            return DEFAULT_NEXT;
        }
        return next;
    }
}
