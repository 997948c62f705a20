package com.neev.storefront.application.product.dto;

import com.neev.storefront.domain.product.entity.Product;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

public record ProductResponse(
        @Schema(description = "상품 ID", example = "1")
        Long productId,

        @Schema(description = "SKU", example = "NEEV-R01")
        String sku,

        @Schema(description = "상품명", example = "Round Brilliant 1.0 ct")
        String name,

        @Schema(description = "카테고리", example = "Rings")
        String category,

        @Schema(description = "설명", example = "E/VS1 IGI Certified")
        String description,

        @Schema(description = "가격", example = "24999.00")
        BigDecimal price,

        @Schema(description = "재고 수량", example = "5")
        int stock,

        @Schema(description = "이미지 URL")
        String imageUrl
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(
                product.getId(),
                product.getSku(),
                product.getName(),
                product.getCategory(),
                product.getDescription(),
                product.getPrice(),
                product.getStock().quantity(),
                product.getImageUrl()
        );
    }
}
