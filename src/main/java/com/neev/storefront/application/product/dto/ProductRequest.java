package com.neev.storefront.application.product.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * 관리자 상품 등록/수정 폼
 */
public record ProductRequest(

        @Schema(description = "SKU (비우면 자동 생성, 수정 시 무시)", example = "NEEV-R01")
        String sku,

        @Schema(description = "상품명", example = "Round Brilliant 1.0 ct")
        @NotBlank(message = "상품명은 필수입니다")
        String name,

        @Schema(description = "카테고리 (비우면 General)", example = "Rings")
        String category,

        @Schema(description = "설명", example = "E/VS1 IGI Certified")
        String description,

        @Schema(description = "가격", example = "24999.00")
        @NotNull(message = "가격은 필수입니다")
        @DecimalMin(value = "0", inclusive = false, message = "가격은 0보다 커야 합니다")
        BigDecimal price,

        @Schema(description = "재고 수량", example = "5")
        @Min(value = 0, message = "재고는 음수일 수 없습니다")
        int stock,

        @Schema(description = "이미지 URL")
        String image
) {}
