package com.neev.storefront.presentation.controller.cart;

import com.neev.storefront.application.cart.dto.CartResponse;
import com.neev.storefront.application.cart.dto.UpdateCartRequest;
import com.neev.storefront.application.cart.usecase.AddToCartUseCase;
import com.neev.storefront.application.cart.usecase.GetCartUseCase;
import com.neev.storefront.application.cart.usecase.RemoveFromCartUseCase;
import com.neev.storefront.application.cart.usecase.UpdateCartUseCase;
import com.neev.storefront.domain.cart.Cart;
import com.neev.storefront.presentation.session.SessionCartStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 장바구니 API (세션 보관)
 */
@Tag(name = "장바구니", description = "세션 장바구니 조회/추가/수정/삭제 API")
@RestController
@RequestMapping("/cart")
@RequiredArgsConstructor
public class CartController {

    private final GetCartUseCase getCartUseCase;
    private final AddToCartUseCase addToCartUseCase;
    private final UpdateCartUseCase updateCartUseCase;
    private final RemoveFromCartUseCase removeFromCartUseCase;
    private final SessionCartStore sessionCartStore;

    /**
     * 장바구니 조회
     * GET /cart
     */
    @Operation(summary = "장바구니 조회", description = "현재 상품 가격 기준으로 라인/합계를 계산합니다")
    @GetMapping
    public ResponseEntity<CartResponse> getCart(HttpSession session) {
        return ResponseEntity.ok(getCartUseCase.execute(sessionCartStore.load(session)));
    }

    /**
     * 장바구니 상품 추가
     * POST /cart/add/{productId} (form: qty)
     */
    @Operation(summary = "장바구니 상품 추가", description = "담긴 수량과 합산하여 재고 이하일 때만 추가합니다")
    @PostMapping("/add/{productId}")
    public ResponseEntity<CartResponse> addToCart(
            @Parameter(description = "상품 ID") @PathVariable Long productId,
            @Parameter(description = "수량") @RequestParam(defaultValue = "1") int qty,
            HttpSession session) {

        Cart cart = sessionCartStore.load(session);
        CartResponse response = addToCartUseCase.execute(cart, productId, qty);
        sessionCartStore.save(session, cart);
        return ResponseEntity.ok(response);
    }

    /**
     * 장바구니 일괄 수정
     * POST /cart/update (form: qty_{id}=n, premium=on)
     */
    @Operation(summary = "장바구니 수정", description = "수량을 교체하고(0 이하는 삭제) 프리미엄 옵션을 설정합니다")
    @PostMapping("/update")
    public ResponseEntity<CartResponse> updateCart(
            @RequestParam Map<String, String> form,
            HttpSession session) {

        Cart cart = sessionCartStore.load(session);
        CartResponse response = updateCartUseCase.execute(cart, UpdateCartRequest.fromForm(form));
        sessionCartStore.save(session, cart);
        return ResponseEntity.ok(response);
    }

    /**
     * 장바구니 상품 삭제
     * POST /cart/remove/{productId}
     */
    @Operation(summary = "장바구니 상품 삭제")
    @PostMapping("/remove/{productId}")
    public ResponseEntity<CartResponse> removeFromCart(
            @Parameter(description = "상품 ID") @PathVariable Long productId,
            HttpSession session) {

        Cart cart = sessionCartStore.load(session);
        CartResponse response = removeFromCartUseCase.execute(cart, productId);
        sessionCartStore.save(session, cart);
        return ResponseEntity.ok(response);
    }
}
