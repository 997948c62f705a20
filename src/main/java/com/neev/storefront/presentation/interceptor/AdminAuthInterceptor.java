package com.neev.storefront.presentation.interceptor;

import com.neev.storefront.presentation.session.AdminSession;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 관리자 권한이 없는 요청을 /admin/login?next={원래 경로} 로 리다이렉트
 */
@Slf4j
@Component
public class AdminAuthInterceptor implements HandlerInterceptor {

    static final String LOGIN_PATH = "/admin/login";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        if (AdminSession.isAdmin(request.getSession(false))) {
            return true;
        }

        String path = request.getRequestURI().substring(request.getContextPath().length());
        log.debug("관리자 권한 없음 - path={}", path);
        response.sendRedirect(request.getContextPath() + LOGIN_PATH + "?next="
                + UriUtils.encodeQueryParam(path, StandardCharsets.UTF_8));
        return false;
    }
}
