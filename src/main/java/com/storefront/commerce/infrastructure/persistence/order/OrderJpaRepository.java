package com.storefront.commerce.infrastructure.persistence.order;

import com.storefront.commerce.domain.order.Order;
import com.storefront.commerce.domain.order.OrderStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 * Spring Data JPA를 통한 Order 엔티티 영구 저장소
 *
 * FetchType 정책:
 * - Order.orderItems: FetchType.LAZY
 * - 단건 조회는 fetch join으로 orderItems 함께 로드
 * - 목록 조회는 페이지네이션 때문에 fetch join 대신 배치 페치(default_batch_fetch_size) 사용
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * 주문 ID로 조회 (orderItems 함께 로드)
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithItems(@Param("orderId") Long orderId);

    /**
     * 주문 ID + 소유자로 조회 (orderItems 함께 로드)
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.orderId = :orderId AND o.userId = :userId")
    Optional<Order> findByIdAndUserIdWithItems(@Param("orderId") Long orderId, @Param("userId") Long userId);

    /**
     * 멱등성 키로 조회 (orderItems 함께 로드)
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems oi " +
           "WHERE o.userId = :userId AND o.checkoutKey = :checkoutKey")
    Optional<Order> findByUserIdAndCheckoutKey(@Param("userId") Long userId, @Param("checkoutKey") String checkoutKey);

    /**
     * 사용자별 주문 목록 (상태/기간 필터, 정렬은 Pageable로 전달)
     */
    @Query("SELECT o FROM Order o " +
           "WHERE o.userId = :userId " +
           "AND (:status IS NULL OR o.orderStatus = :status) " +
           "AND (:startDate IS NULL OR o.createdAt >= :startDate) " +
           "AND (:endDate IS NULL OR o.createdAt <= :endDate)")
    List<Order> search(@Param("userId") Long userId,
                       @Param("status") OrderStatus status,
                       @Param("startDate") LocalDateTime startDate,
                       @Param("endDate") LocalDateTime endDate,
                       Pageable pageable);

    @Query("SELECT COUNT(o) FROM Order o " +
           "WHERE o.userId = :userId " +
           "AND (:status IS NULL OR o.orderStatus = :status) " +
           "AND (:startDate IS NULL OR o.createdAt >= :startDate) " +
           "AND (:endDate IS NULL OR o.createdAt <= :endDate)")
    long countSearch(@Param("userId") Long userId,
                     @Param("status") OrderStatus status,
                     @Param("startDate") LocalDateTime startDate,
                     @Param("endDate") LocalDateTime endDate);

    /**
     * 상태별 주문 수 집계
     *
     * @return [OrderStatus, Long] 배열 목록
     */
    @Query("SELECT o.orderStatus, COUNT(o) FROM Order o " +
           "WHERE o.userId = :userId " +
           "GROUP BY o.orderStatus")
    List<Object[]> countGroupByStatus(@Param("userId") Long userId);
}
