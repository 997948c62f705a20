package com.neev.storefront.application.product.usecase;

import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 상품 삭제 UseCase (관리자)
 * 없는 상품이면 아무것도 하지 않는다. 주문 항목은 스냅샷을 유지한 채 남는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeleteProductUseCase {

    private final ProductRepository productRepository;

    /**
     * @return 실제로 삭제했으면 true
     */
    @Transactional
    public boolean execute(Long productId) {
        if (!productRepository.existsById(productId)) {
            log.debug("삭제할 상품 없음 - productId={}", productId);
            return false;
        }
        productRepository.deleteById(productId);
        log.info("상품 삭제 - productId={}", productId);
        return true;
    }
}
