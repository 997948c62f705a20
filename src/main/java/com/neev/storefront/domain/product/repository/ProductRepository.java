package com.neev.storefront.domain.product.repository;

import com.neev.storefront.domain.product.entity.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 상품 저장소 인터페이스
 * JpaRepository가 기본 CRUD 메서드 제공 (findById, findAll, save 등)
 */
public interface ProductRepository extends JpaRepository<Product, Long> {

    /**
     * 상품 조회 (비관적 락)
     * SELECT FOR UPDATE로 동시성 제어
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.id = :productId")
    Optional<Product> findByIdWithLock(@Param("productId") Long productId);

    /**
     * 전체 상품 최신순 조회
     */
    List<Product> findAllByOrderByIdDesc(Pageable pageable);

    /**
     * 카테고리별 최신순 조회
     */
    List<Product> findByCategoryOrderByIdDesc(String category, Pageable pageable);

    /**
     * 상품명/설명 검색 (대소문자 무시 부분 일치)
     */
    @Query("""
        SELECT p FROM Product p
        WHERE LOWER(p.name) LIKE LOWER(CONCAT('%', :keyword, '%'))
           OR LOWER(p.description) LIKE LOWER(CONCAT('%', :keyword, '%'))
        ORDER BY p.id DESC
        """)
    List<Product> searchByKeyword(@Param("keyword") String keyword, Pageable pageable);

    @Query("SELECT DISTINCT p.category FROM Product p WHERE p.category IS NOT NULL ORDER BY p.category")
    List<String> findDistinctCategories();

    boolean existsBySku(String sku);

    /**
     * 재고 차감 (직접 UPDATE 쿼리)
     *
     * DB 레벨 재고 검증 포함:
     * - 재고가 충분할 때만 UPDATE 실행
     * - 재고 부족 시 affected rows = 0 반환
     * - 동시성 환경에서 재고 음수 방지
     *
     * @return 업데이트된 행 수 (1: 성공, 0: 재고 부족 또는 상품 없음)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Product p SET p.stock.quantity = p.stock.quantity - :amount WHERE p.id = :productId AND p.stock.quantity >= :amount")
    int decreaseStock(@Param("productId") Long productId, @Param("amount") int amount);
}
