package com.neev.storefront.application.product.usecase;

import com.neev.storefront.application.product.dto.ProductRequest;
import com.neev.storefront.application.product.dto.ProductResponse;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.exception.InvalidProductException;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * 상품 등록 UseCase (관리자)
 *
 * SKU 를 비우면 SKU{epochSeconds} 로 자동 생성하며,
 * 같은 초에 이미 생성된 SKU 가 있으면 -2, -3 ... 접미사를 붙인다.
 * 직접 입력한 SKU 가 중복이면 InvalidProductException
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreateProductUseCase {

    private final ProductRepository productRepository;
    private final Clock clock;

    @Transactional
    public ProductResponse execute(ProductRequest request) {
        String sku = resolveSku(request.sku());

        Product product = Product.create(
                sku,
                request.name(),
                request.category(),
                trimToNull(request.description()),
                request.price(),
                request.stock(),
                trimToNull(request.image())
        );
        Product saved = productRepository.save(product);

        log.info("상품 등록 - productId={}, sku={}", saved.getId(), saved.getSku());
        return ProductResponse.from(saved);
    }

    private String resolveSku(String requested) {
        if (requested != null && !requested.isBlank()) {
            String sku = requested.trim();
            if (productRepository.existsBySku(sku)) {
                throw new InvalidProductException("이미 사용 중인 SKU 입니다: " + sku);
            }
            return sku;
        }

        String base = "SKU" + clock.instant().getEpochSecond();
        String sku = base;
        for (int suffix = 2; productRepository.existsBySku(sku); suffix++) {
            sku = base + "-" + suffix;
        }
        return sku;
    }

    private static String trimToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
