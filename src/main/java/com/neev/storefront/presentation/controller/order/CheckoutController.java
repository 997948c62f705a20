package com.neev.storefront.presentation.controller.order;

import com.neev.storefront.application.cart.dto.CartResponse;
import com.neev.storefront.application.cart.usecase.GetCartUseCase;
import com.neev.storefront.application.order.dto.CheckoutResponse;
import com.neev.storefront.application.order.dto.CreateOrderRequest;
import com.neev.storefront.application.order.dto.OrderDetailResponse;
import com.neev.storefront.application.order.dto.UpiPaymentResponse;
import com.neev.storefront.application.order.usecase.CreateOrderUseCase;
import com.neev.storefront.application.order.usecase.GetOrderDetailUseCase;
import com.neev.storefront.application.order.usecase.GetUpiPaymentUseCase;
import com.neev.storefront.domain.cart.Cart;
import com.neev.storefront.domain.cart.exception.EmptyCartException;
import com.neev.storefront.presentation.session.SessionCartStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * 결제 및 주문 조회 API
 */
@Tag(name = "주문", description = "결제(주문 생성), UPI 결제 안내, 주문 상태 조회 API")
@RestController
@RequiredArgsConstructor
public class CheckoutController {

    private final GetCartUseCase getCartUseCase;
    private final CreateOrderUseCase createOrderUseCase;
    private final GetUpiPaymentUseCase getUpiPaymentUseCase;
    private final GetOrderDetailUseCase getOrderDetailUseCase;
    private final SessionCartStore sessionCartStore;

    /**
     * 결제 화면 (장바구니 요약)
     * GET /checkout
     */
    @Operation(summary = "결제 화면", description = "장바구니가 비어 있으면 400")
    @GetMapping("/checkout")
    public ResponseEntity<CartResponse> getCheckout(HttpSession session) {
        CartResponse cart = getCartUseCase.execute(sessionCartStore.load(session));
        if (cart.isEmpty()) {
            throw new EmptyCartException();
        }
        return ResponseEntity.ok(cart);
    }

    /**
     * 주문 생성
     * POST /checkout (form: name, email, phone, address, payment_method)
     */
    @Operation(summary = "주문 생성", description = "주문/재고 차감 후 게이트웨이 주문을 요청합니다. Location 은 UPI 안내 또는 주문 상태 경로")
    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> checkout(
            @Parameter(description = "주문자 이름") @RequestParam(required = false) String name,
            @Parameter(description = "이메일") @RequestParam(required = false) String email,
            @Parameter(description = "연락처") @RequestParam(required = false) String phone,
            @Parameter(description = "배송 주소") @RequestParam(required = false) String address,
            @Parameter(description = "결제 수단 (upi/card)") @RequestParam(name = "payment_method", required = false) String paymentMethod,
            HttpSession session) {

        Cart cart = sessionCartStore.load(session);
        CheckoutResponse response = createOrderUseCase.execute(
                cart, new CreateOrderRequest(name, email, phone, address, paymentMethod));
        sessionCartStore.save(session, cart);

        return ResponseEntity.status(HttpStatus.CREATED)
                .location(URI.create(response.nextPath()))
                .body(response);
    }

    /**
     * UPI 결제 안내
     * GET /upi/{orderId}
     */
    @Operation(summary = "UPI 결제 안내", description = "주문 금액으로 UPI 딥링크를 생성합니다")
    @GetMapping("/upi/{orderId}")
    public ResponseEntity<UpiPaymentResponse> getUpiPayment(
            @Parameter(description = "주문 ID") @PathVariable Long orderId) {

        return ResponseEntity.ok(getUpiPaymentUseCase.execute(orderId));
    }

    /**
     * 주문 상태 조회
     * GET /order/{orderId}
     */
    @Operation(summary = "주문 상태 조회", description = "결제/주문 상태와 주문 항목 스냅샷을 조회합니다")
    @GetMapping("/order/{orderId}")
    public ResponseEntity<OrderDetailResponse> getOrder(
            @Parameter(description = "주문 ID") @PathVariable Long orderId) {

        return ResponseEntity.ok(getOrderDetailUseCase.execute(orderId));
    }
}
