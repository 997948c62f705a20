package com.neev.storefront.presentation.session;

import com.neev.storefront.domain.cart.Cart;
import jakarta.servlet.http.HttpSession;
import org.springframework.stereotype.Component;

/**
 * HTTP 세션에 장바구니 보관
 */
@Component
public class SessionCartStore {

    static final String CART_ATTRIBUTE = "neev.cart";

    public Cart load(HttpSession session) {
        Object value = session.getAttribute(CART_ATTRIBUTE);
        if (value instanceof Cart cart) {
            return cart;
        }
        Cart cart = new Cart();
        session.setAttribute(CART_ATTRIBUTE, cart);
        return cart;
    }

    /**
     * 변경된 장바구니를 다시 저장 (세션 복제 환경에서 변경 감지용)
     */
    public void save(HttpSession session, Cart cart) {
        session.setAttribute(CART_ATTRIBUTE, cart);
    }
}
