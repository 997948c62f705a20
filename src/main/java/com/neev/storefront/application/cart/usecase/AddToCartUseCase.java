package com.neev.storefront.application.cart.usecase;

import com.neev.storefront.application.cart.dto.CartResponse;
import com.neev.storefront.domain.cart.Cart;
import com.neev.storefront.domain.cart.exception.InvalidCartQuantityException;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.exception.InsufficientStockException;
import com.neev.storefront.domain.product.exception.ProductNotFoundException;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 장바구니 상품 추가 UseCase
 *
 * 담긴 수량과 합산한 수량이 현재 재고 이하인지 확인한다 (예약하지 않음).
 * 결제 시점에 재고를 다시 검증한다.
 */
@Service
@RequiredArgsConstructor
public class AddToCartUseCase {

    private final ProductRepository productRepository;
    private final GetCartUseCase getCartUseCase;

    @Transactional(readOnly = true)
    public CartResponse execute(Cart cart, Long productId, int quantity) {
        // 1. 수량 검증
        if (quantity < 1) {
            throw new InvalidCartQuantityException(quantity);
        }

        // 2. 상품 존재 확인
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        // 3. 재고 확인 (이미 담긴 수량 포함)
        int available = product.getStock().quantity();
        long requested = (long) cart.quantityOf(productId) + quantity;
        if (requested > available) {
            throw new InsufficientStockException((int) Math.min(requested, Integer.MAX_VALUE), available);
        }

        // 4. 장바구니에 추가
        cart.add(productId, quantity);

        return getCartUseCase.execute(cart);
    }
}
