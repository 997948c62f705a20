package com.neev.storefront.presentation.controller.admin;

import com.neev.storefront.application.order.dto.OrderStatusResponse;
import com.neev.storefront.application.order.usecase.FulfillOrderUseCase;
import com.neev.storefront.application.order.usecase.MarkOrderPaidUseCase;
import com.neev.storefront.application.order.usecase.RejectOrderUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 관리자 주문 상태 변경 API
 * 같은 요청을 반복해도 결과는 같다 (changed=false). 종료 상태를 뒤집는 요청은 409
 */
@Tag(name = "관리자 주문", description = "결제 완료/거절/처리 완료 API")
@RestController
@RequestMapping("/admin/order/{orderId}")
@RequiredArgsConstructor
public class AdminOrderController {

    private final MarkOrderPaidUseCase markOrderPaidUseCase;
    private final RejectOrderUseCase rejectOrderUseCase;
    private final FulfillOrderUseCase fulfillOrderUseCase;

    @Operation(summary = "결제 완료 처리", description = "PENDING/CREATED -> PAID/CONFIRMED")
    @PostMapping("/mark_paid")
    public ResponseEntity<OrderStatusResponse> markPaid(
            @Parameter(description = "주문 ID") @PathVariable Long orderId) {
        return ResponseEntity.ok(markOrderPaidUseCase.execute(orderId));
    }

    @Operation(summary = "주문 거절", description = "PENDING/CREATED -> REJECTED/REJECTED (재고 복원 없음)")
    @PostMapping("/reject")
    public ResponseEntity<OrderStatusResponse> reject(
            @Parameter(description = "주문 ID") @PathVariable Long orderId) {
        return ResponseEntity.ok(rejectOrderUseCase.execute(orderId));
    }

    @Operation(summary = "처리 완료", description = "PAID/CONFIRMED -> PAID/FULFILLED")
    @PostMapping("/fulfill")
    public ResponseEntity<OrderStatusResponse> fulfill(
            @Parameter(description = "주문 ID") @PathVariable Long orderId) {
        return ResponseEntity.ok(fulfillOrderUseCase.execute(orderId));
    }
}
