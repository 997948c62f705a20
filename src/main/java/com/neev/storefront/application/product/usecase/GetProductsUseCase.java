package com.neev.storefront.application.product.usecase;

import com.neev.storefront.application.product.dto.ProductListResponse;
import com.neev.storefront.application.product.dto.ProductResponse;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 상품 목록 조회 UseCase
 *
 * - q 가 있으면 상품명/설명 검색 (카테고리 필터는 무시)
 * - q 가 없고 cat 이 있으면 카테고리 필터
 * - 최신순, 최대 200건
 */
@Service
@RequiredArgsConstructor
public class GetProductsUseCase {

    static final int LIST_LIMIT = 200;

    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    public ProductListResponse execute(String q, String cat) {
        String keyword = normalize(q);
        String category = normalize(cat);

        // 1. 조건에 맞는 상품 조회
        List<Product> products = fetchProducts(keyword, category);

        // 2. DTO 변환
        List<ProductResponse> responses = products.stream()
                .map(ProductResponse::from)
                .toList();

        return new ProductListResponse(responses, productRepository.findDistinctCategories(), keyword, category);
    }

    private List<Product> fetchProducts(String keyword, String category) {
        Pageable limit = PageRequest.of(0, LIST_LIMIT);

        if (!keyword.isEmpty()) {
            return productRepository.searchByKeyword(keyword.toLowerCase(), limit);
        }
        if (!category.isEmpty()) {
            return productRepository.findByCategoryOrderByIdDesc(category, limit);
        }
        return productRepository.findAllByOrderByIdDesc(limit);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
