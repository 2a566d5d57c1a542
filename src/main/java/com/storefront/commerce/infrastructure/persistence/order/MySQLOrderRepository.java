package com.storefront.commerce.infrastructure.persistence.order;

import com.storefront.commerce.domain.order.Order;
import com.storefront.commerce.domain.order.OrderRepository;
import com.storefront.commerce.domain.order.OrderSearchCondition;
import com.storefront.commerce.domain.order.OrderStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(OrderRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
            .and(Sort.by(Sort.Direction.DESC, "orderId"));

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    /**
     * 주문 저장
     *
     * saveAndFlush로 INSERT를 즉시 실행하여
     * (user_id, checkout_key) 유니크 제약 위반을 트랜잭션 안에서 감지한다.
     */
    @Override
    public Order save(Order order) {
        return orderJpaRepository.saveAndFlush(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findByIdWithItems(orderId);
    }

    @Override
    public Optional<Order> findByIdAndUserId(Long orderId, Long userId) {
        return orderJpaRepository.findByIdAndUserIdWithItems(orderId, userId);
    }

    @Override
    public Optional<Order> findByUserIdAndCheckoutKey(Long userId, String checkoutKey) {
        return orderJpaRepository.findByUserIdAndCheckoutKey(userId, checkoutKey);
    }

    @Override
    public List<Order> findByUserId(Long userId, OrderSearchCondition condition, int page, int size) {
        return orderJpaRepository.search(
                userId,
                condition.getStatus(),
                condition.getStartDate(),
                condition.getEndDate(),
                PageRequest.of(page, size, NEWEST_FIRST));
    }

    @Override
    public long countByUserId(Long userId, OrderSearchCondition condition) {
        return orderJpaRepository.countSearch(
                userId,
                condition.getStatus(),
                condition.getStartDate(),
                condition.getEndDate());
    }

    @Override
    public Map<OrderStatus, Long> countByStatus(Long userId) {
        Map<OrderStatus, Long> counts = new EnumMap<>(OrderStatus.class);
        for (Object[] row : orderJpaRepository.countGroupByStatus(userId)) {
            counts.put((OrderStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
