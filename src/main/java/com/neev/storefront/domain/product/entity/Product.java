package com.neev.storefront.domain.product.entity;

import com.neev.storefront.domain.product.exception.InvalidProductException;
import com.neev.storefront.domain.product.vo.Stock;
import com.neev.storefront.infrastructure.jpa.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 엔티티
 */
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_category", columnList = "category")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Product extends BaseEntity {

    public static final String DEFAULT_CATEGORY = "General";

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sku", unique = true)
    private String sku;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "category")
    private String category;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Embedded
    private Stock stock;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    /**
     * 신규 상품 생성 (가격 > 0, 이름 필수)
     */
    public static Product create(String sku, String name, String category, String description,
                                 BigDecimal price, int stock, String imageUrl) {
        validate(name, price, stock);
        return Product.builder()
                .sku(sku)
                .name(name.trim())
                .category(categoryOrDefault(category))
                .description(description)
                .price(price)
                .stock(new Stock(stock))
                .imageUrl(imageUrl)
                .build();
    }

    /*장바구니 담기 전용*/
    public boolean canAddToCart(int requestQuantity) {
        return stock.isAvailable(requestQuantity);
    }

    /**
     * 관리자 수정 - SKU 를 제외한 가변 필드 전체를 교체
     */
    public void changeDetails(String name, String category, String description,
                              BigDecimal price, int stock, String imageUrl) {
        validate(name, price, stock);
        this.name = name.trim();
        this.category = categoryOrDefault(category);
        this.description = description;
        this.price = price;
        this.stock = new Stock(stock);
        this.imageUrl = imageUrl;
    }

    private static void validate(String name, BigDecimal price, int stock) {
        if (name == null || name.isBlank()) {
            throw new InvalidProductException("상품명은 필수입니다");
        }
        if (price == null || price.signum() <= 0) {
            throw new InvalidProductException("가격은 0보다 커야 합니다");
        }
        if (stock < 0) {
            throw new InvalidProductException("재고는 음수일 수 없습니다");
        }
    }

    private static String categoryOrDefault(String category) {
        return (category == null || category.isBlank()) ? DEFAULT_CATEGORY : category.trim();
    }
}
