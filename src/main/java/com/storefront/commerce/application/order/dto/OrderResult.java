package com.storefront.commerce.application.order.dto;

import com.storefront.commerce.domain.order.Order;
import com.storefront.commerce.domain.order.ShippingAddress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 조회 결과 (Application 계층)
 *
 * 트랜잭션 안에서 Order 엔티티로부터 생성하여 LAZY 컬렉션 접근 문제를 피한다.
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderResult {
    private final Long orderId;
    private final Long userId;
    private final String status;
    private final String paymentStatus;
    private final String paymentMethod;
    private final BigDecimal totalAmount;
    private final ShippingAddress shippingAddress;
    private final String note;
    private final List<OrderItemResult> items;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    public static OrderResult from(Order order) {
        return OrderResult.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .status(order.getOrderStatus().getValue())
                .paymentStatus(order.getPaymentStatus().getValue())
                .paymentMethod(order.getPaymentMethod())
                .totalAmount(order.getTotalAmount())
                .shippingAddress(order.getShippingAddress())
                .note(order.getNote())
                .items(order.getOrderItems().stream()
                        .map(OrderItemResult::from)
                        .collect(Collectors.toList()))
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
