package com.neev.storefront.application.product.service;

import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.exception.InsufficientStockException;
import com.neev.storefront.domain.product.exception.ProductNotFoundException;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 재고 차감 서비스
 *
 * UPDATE ... WHERE stock >= :amount 한 문장으로 확인과 차감을 동시에 수행한다.
 * 호출자의 트랜잭션에 참여하므로 주문 생성이 실패하면 함께 롤백된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductStockService {

    private final ProductRepository productRepository;

    /**
     * 재고 차감
     *
     * @throws ProductNotFoundException 상품이 없는 경우
     * @throws InsufficientStockException 재고가 요청 수량보다 적은 경우 (재고 변경 없음)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void decrease(Long productId, int amount) {
        if (amount < 1) {
            throw new IllegalArgumentException("차감 수량은 1 이상이어야 합니다: " + amount);
        }

        int updated = productRepository.decreaseStock(productId, amount);
        if (updated == 0) {
            Product product = productRepository.findById(productId)
                    .orElseThrow(() -> new ProductNotFoundException(productId));
            log.warn("재고 부족 - productId={}, requested={}, available={}",
                    productId, amount, product.getStock().quantity());
            throw new InsufficientStockException(
                    "상품 재고가 부족합니다: " + product.getName() +
                    " (요청: " + amount + ", 재고: " + product.getStock().quantity() + ")"
            );
        }
    }
}
