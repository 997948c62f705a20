package com.neev.storefront.presentation.controller.admin;

import com.neev.storefront.application.product.dto.ProductRequest;
import com.neev.storefront.application.product.dto.ProductResponse;
import com.neev.storefront.application.product.usecase.CreateProductUseCase;
import com.neev.storefront.application.product.usecase.DeleteProductUseCase;
import com.neev.storefront.application.product.usecase.GetProductDetailUseCase;
import com.neev.storefront.application.product.usecase.UpdateProductUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 관리자 상품 관리 API
 */
@Tag(name = "관리자 상품", description = "상품 등록/수정/삭제 API")
@RestController
@RequestMapping("/admin/product")
@RequiredArgsConstructor
public class AdminProductController {

    private final CreateProductUseCase createProductUseCase;
    private final GetProductDetailUseCase getProductDetailUseCase;
    private final UpdateProductUseCase updateProductUseCase;
    private final DeleteProductUseCase deleteProductUseCase;

    /**
     * 상품 등록
     * POST /admin/product/add
     */
    @Operation(summary = "상품 등록", description = "SKU 를 비우면 자동 생성, 카테고리를 비우면 General")
    @PostMapping("/add")
    public ResponseEntity<ProductResponse> addProduct(@Valid @ModelAttribute ProductRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(createProductUseCase.execute(request));
    }

    /**
     * 상품 수정 화면
     * GET /admin/product/{productId}/edit
     */
    @Operation(summary = "상품 수정 화면")
    @GetMapping("/{productId}/edit")
    public ResponseEntity<ProductResponse> getProductForEdit(
            @Parameter(description = "상품 ID") @PathVariable Long productId) {

        return ResponseEntity.ok(getProductDetailUseCase.execute(productId));
    }

    /**
     * 상품 수정
     * POST /admin/product/{productId}/edit
     */
    @Operation(summary = "상품 수정", description = "SKU 를 제외한 필드를 교체합니다. 기존 주문에는 영향 없음")
    @PostMapping("/{productId}/edit")
    public ResponseEntity<ProductResponse> updateProduct(
            @Parameter(description = "상품 ID") @PathVariable Long productId,
            @Valid @ModelAttribute ProductRequest request) {

        return ResponseEntity.ok(updateProductUseCase.execute(productId, request));
    }

    /**
     * 상품 삭제 (없는 상품이어도 성공)
     * POST /admin/product/{productId}/delete
     */
    @Operation(summary = "상품 삭제", description = "없는 상품이어도 204")
    @PostMapping("/{productId}/delete")
    public ResponseEntity<Void> deleteProduct(
            @Parameter(description = "상품 ID") @PathVariable Long productId) {

        deleteProductUseCase.execute(productId);
        return ResponseEntity.noContent().build();
    }
}
