package com.neev.storefront.domain.order.repository;

import com.neev.storefront.domain.order.entity.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 주문 Repository 인터페이스
 */
public interface OrderRepository extends JpaRepository<Order, Long> {

    /**
     * 주문 조회 (비관적 락)
     * 웹훅/관리자 상태 전이가 같은 행 잠금으로 직렬화된다
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") Long orderId);

    /**
     * 게이트웨이 주문 ID로 조회 (비관적 락)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.externalId = :externalId")
    List<Order> findByExternalIdWithLock(@Param("externalId") String externalId);

    /**
     * 관리자 대시보드용 최신 주문
     */
    List<Order> findTop200ByOrderByIdDesc();
}
