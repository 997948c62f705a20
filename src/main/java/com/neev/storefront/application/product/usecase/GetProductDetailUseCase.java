package com.neev.storefront.application.product.usecase;

import com.neev.storefront.application.product.dto.ProductResponse;
import com.neev.storefront.domain.product.exception.ProductNotFoundException;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 상품 상세 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetProductDetailUseCase {

    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    public ProductResponse execute(Long productId) {
        return productRepository.findById(productId)
                .map(ProductResponse::from)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }
}
