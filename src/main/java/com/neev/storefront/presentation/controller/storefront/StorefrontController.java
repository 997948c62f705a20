package com.neev.storefront.presentation.controller.storefront;

import com.neev.storefront.application.product.dto.ProductListResponse;
import com.neev.storefront.application.product.dto.ProductResponse;
import com.neev.storefront.application.product.usecase.GetProductDetailUseCase;
import com.neev.storefront.application.product.usecase.GetProductsUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 카탈로그 API
 */
@Tag(name = "카탈로그", description = "상품 목록/상세 조회 API")
@RestController
@RequiredArgsConstructor
public class StorefrontController {

    private final GetProductsUseCase getProductsUseCase;
    private final GetProductDetailUseCase getProductDetailUseCase;

    /**
     * 상품 목록 조회
     * GET /?q=&cat=
     */
    @Operation(summary = "상품 목록 조회", description = "검색어(q)가 있으면 검색, 없으면 카테고리(cat) 필터. 최신순 최대 200건")
    @GetMapping("/")
    public ResponseEntity<ProductListResponse> getProducts(
            @Parameter(description = "상품명/설명 검색어") @RequestParam(required = false) String q,
            @Parameter(description = "카테고리") @RequestParam(required = false) String cat) {

        return ResponseEntity.ok(getProductsUseCase.execute(q, cat));
    }

    /**
     * 상품 상세 조회
     * GET /product/{productId}
     */
    @Operation(summary = "상품 상세 조회", description = "특정 상품의 상세 정보를 조회합니다")
    @GetMapping("/product/{productId}")
    public ResponseEntity<ProductResponse> getProductDetail(
            @Parameter(description = "상품 ID") @PathVariable Long productId) {

        return ResponseEntity.ok(getProductDetailUseCase.execute(productId));
    }
}
