package com.neev.storefront.application.cart.usecase;

import com.neev.storefront.application.cart.dto.CartResponse;
import com.neev.storefront.application.cart.dto.UpdateCartRequest;
import com.neev.storefront.domain.cart.Cart;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 장바구니 일괄 수정 UseCase (수량 교체 + 프리미엄 옵션)
 */
@Service
@RequiredArgsConstructor
public class UpdateCartUseCase {

    private final GetCartUseCase getCartUseCase;

    public CartResponse execute(Cart cart, UpdateCartRequest request) {
        cart.updateQuantities(request.quantities());
        cart.setPremium(request.premium());
        return getCartUseCase.execute(cart);
    }
}
