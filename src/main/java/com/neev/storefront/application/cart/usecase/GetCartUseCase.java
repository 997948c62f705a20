package com.neev.storefront.application.cart.usecase;

import com.neev.storefront.application.cart.dto.CartLineResponse;
import com.neev.storefront.application.cart.dto.CartResponse;
import com.neev.storefront.domain.cart.Cart;
import com.neev.storefront.domain.cart.CartLine;
import com.neev.storefront.domain.cart.service.CartCalculator;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 장바구니 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetCartUseCase {

    private final ProductRepository productRepository;
    private final CartCalculator cartCalculator;

    @Transactional(readOnly = true)
    public CartResponse execute(Cart cart) {
        // 1. 장바구니 상품의 현재 정보 조회
        List<CartLine> lines = cartCalculator.lines(
                cart.quantities(),
                productRepository.findAllById(cart.quantities().keySet())
        );

        // 2. 응답 생성
        return new CartResponse(
                lines.stream().map(CartLineResponse::from).toList(),
                cartCalculator.subtotal(lines),
                cart.isPremium(),
                cartCalculator.getPremiumSurcharge(),
                cartCalculator.total(lines, cart.isPremium())
        );
    }
}
