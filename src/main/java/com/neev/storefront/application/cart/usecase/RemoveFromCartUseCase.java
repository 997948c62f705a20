package com.neev.storefront.application.cart.usecase;

import com.neev.storefront.application.cart.dto.CartResponse;
import com.neev.storefront.domain.cart.Cart;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장바구니 상품 삭제 UseCase
 */
@Service
@RequiredArgsConstructor
public class RemoveFromCartUseCase {

    private final GetCartUseCase getCartUseCase;

    public CartResponse execute(Cart cart, Long productId) {
        cart.remove(productId);
        return getCartUseCase.execute(cart);
    }
}
