package com.neev.storefront.application.product.usecase;

import com.neev.storefront.application.product.dto.ProductRequest;
import com.neev.storefront.application.product.dto.ProductResponse;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.exception.ProductNotFoundException;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 상품 수정 UseCase (관리자)
 * SKU 를 제외한 필드를 교체한다. 기존 주문 항목의 스냅샷에는 영향 없음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpdateProductUseCase {

    private final ProductRepository productRepository;

    @Transactional
    public ProductResponse execute(Long productId, ProductRequest request) {
        Product product = productRepository.findByIdWithLock(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        product.changeDetails(
                request.name(),
                request.category(),
                request.description() == null ? null : request.description().trim(),
                request.price(),
                request.stock(),
                request.image() == null || request.image().isBlank() ? null : request.image().trim()
        );

        log.info("상품 수정 - productId={}, price={}, stock={}", productId, request.price(), request.stock());
        return ProductResponse.from(product);
    }
}
