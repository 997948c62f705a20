package com.neev.storefront.presentation.exception;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 에러 응답
 */
public record ErrorResponse(
        @Schema(description = "에러 코드", example = "P002")
        String code,
        @Schema(description = "에러 메시지", example = "재고가 부족합니다")
        String message
) {}
