package com.storefront.commerce.domain.order;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface OrderRepository {

    /**
     * 주문 저장 (항목 포함, 즉시 flush하여 제약조건 위반을 트랜잭션 안에서 감지)
     */
    Order save(Order order);

    /**
     * 주문 ID로 조회 (orderItems 함께 로드)
     */
    Optional<Order> findById(Long orderId);

    /**
     * 주문 ID + 소유자로 조회 (orderItems 함께 로드)
     */
    Optional<Order> findByIdAndUserId(Long orderId, Long userId);

    /**
     * 멱등성 키로 기존 주문 조회
     */
    Optional<Order> findByUserIdAndCheckoutKey(Long userId, String checkoutKey);

    /**
     * 사용자별 주문 목록 (최신순, page는 0부터)
     */
    List<Order> findByUserId(Long userId, OrderSearchCondition condition, int page, int size);

    long countByUserId(Long userId, OrderSearchCondition condition);

    /**
     * 사용자의 전체 주문을 상태별로 집계 (주문이 없는 상태는 결과에 없음)
     */
    Map<OrderStatus, Long> countByStatus(Long userId);
}
