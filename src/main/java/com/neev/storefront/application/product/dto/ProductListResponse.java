package com.neev.storefront.application.product.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 카탈로그 목록 응답 (필터 내비게이션용 카테고리 포함)
 */
public record ProductListResponse(
        @Schema(description = "상품 목록 (최신순)")
        List<ProductResponse> products,

        @Schema(description = "전체 카테고리", example = "[\"Earrings\", \"Pendants\", \"Rings\"]")
        List<String> categories,

        @Schema(description = "검색어", example = "oval")
        String q,

        @Schema(description = "선택된 카테고리", example = "Rings")
        String cat
) {}
