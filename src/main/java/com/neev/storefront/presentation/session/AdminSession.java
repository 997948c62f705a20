package com.neev.storefront.presentation.session;

import jakarta.servlet.http.HttpSession;

/**
 * 세션 단위 관리자 권한 플래그
 */
public final class AdminSession {

    static final String ADMIN_ATTRIBUTE = "neev.admin";

    private AdminSession() {
    }

    public static void grant(HttpSession session) {
        session.setAttribute(ADMIN_ATTRIBUTE, Boolean.TRUE);
    }

    public static void revoke(HttpSession session) {
        session.removeAttribute(ADMIN_ATTRIBUTE);
    }

    public static boolean isAdmin(HttpSession session) {
        return session != null && Boolean.TRUE.equals(session.getAttribute(ADMIN_ATTRIBUTE));
    }
}
