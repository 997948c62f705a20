package com.neev.storefront.application.admin.dto;

import com.neev.storefront.application.order.dto.OrderSummaryResponse;
import com.neev.storefront.application.product.dto.ProductResponse;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

public record AdminDashboardResponse(
        @Schema(description = "최근 주문 (최신순, 최대 200건)")
        List<OrderSummaryResponse> orders,
        @Schema(description = "전체 상품 (최신순)")
        List<ProductResponse> products
) {}
