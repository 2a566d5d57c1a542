package com.storefront.commerce.presentation.order.mapper;

import com.storefront.commerce.application.order.dto.OrderItemResult;
import com.storefront.commerce.application.order.dto.OrderListResult;
import com.storefront.commerce.application.order.dto.OrderResult;
import com.storefront.commerce.application.order.dto.PlaceOrderCommand;
import com.storefront.commerce.application.order.dto.PlaceOrderResult;
import com.storefront.commerce.application.order.dto.ShippingAddressCommand;
import com.storefront.commerce.domain.order.ShippingAddress;
import com.storefront.commerce.presentation.order.request.PlaceOrderRequest;
import com.storefront.commerce.presentation.order.request.ShippingAddressRequest;
import com.storefront.commerce.presentation.order.response.OrderItemResponse;
import com.storefront.commerce.presentation.order.response.OrderListResponse;
import com.storefront.commerce.presentation.order.response.OrderResponse;
import com.storefront.commerce.presentation.order.response.PlaceOrderResponse;
import com.storefront.commerce.presentation.order.response.ShippingAddressResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Application Result → Presentation Response DTO 변환
 *
 * 아키텍처 원칙:
 * - Application layer는 Presentation layer DTO에 독립적 (자체 DTO 사용)
 * - snake_case 직렬화(@JsonProperty)는 Presentation DTO에서만 처리
 */
@Component
public class OrderMapper {

    /**
     * 요청 본문 + Idempotency-Key 헤더 → PlaceOrderCommand
     *
     * 본문이 비어 있으면 검증 단계(OrderValidator)에서 400으로 처리되도록 null 필드로 변환한다.
     */
    public PlaceOrderCommand toPlaceOrderCommand(PlaceOrderRequest request, String idempotencyKey) {
        if (request == null) {
            return PlaceOrderCommand.builder().checkoutKey(idempotencyKey).build();
        }
        return PlaceOrderCommand.builder()
                .shippingAddress(toShippingAddressCommand(request.getShippingAddress()))
                .paymentMethod(request.getPaymentMethod())
                .note(request.getNote())
                .checkoutKey(idempotencyKey)
                .build();
    }

    public PlaceOrderResponse toPlaceOrderResponse(PlaceOrderResult result) {
        return new PlaceOrderResponse(toOrderResponse(result.getOrder()), result.getNotificationRecorded());
    }

    public OrderResponse toOrderResponse(OrderResult order) {
        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .status(order.getStatus())
                .paymentStatus(order.getPaymentStatus())
                .paymentMethod(order.getPaymentMethod())
                .totalAmount(order.getTotalAmount())
                .shippingAddress(toShippingAddressResponse(order.getShippingAddress()))
                .note(order.getNote())
                .items(order.getItems().stream()
                        .map(this::toOrderItemResponse)
                        .collect(Collectors.toList()))
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    public OrderListResponse toOrderListResponse(OrderListResult result) {
        return OrderListResponse.builder()
                .orders(result.getOrders().stream()
                        .map(this::toOrderResponse)
                        .collect(Collectors.toList()))
                .page(result.getPage())
                .limit(result.getLimit())
                .total(result.getTotal())
                .pages(result.getPages())
                .statusCounts(result.getStatusCounts())
                .build();
    }

    private ShippingAddressCommand toShippingAddressCommand(ShippingAddressRequest request) {
        if (request == null) {
            return null;
        }
        return ShippingAddressCommand.builder()
                .street(request.getStreet())
                .city(request.getCity())
                .state(request.getState())
                .zipCode(request.getZipCode())
                .country(request.getCountry())
                .build();
    }

    private ShippingAddressResponse toShippingAddressResponse(ShippingAddress address) {
        if (address == null) {
            return null;
        }
        return ShippingAddressResponse.builder()
                .street(address.getStreet())
                .city(address.getCity())
                .state(address.getState())
                .zipCode(address.getZipCode())
                .country(address.getCountry())
                .build();
    }

    private OrderItemResponse toOrderItemResponse(OrderItemResult item) {
        return OrderItemResponse.builder()
                .orderItemId(item.getOrderItemId())
                .productId(item.getProductId())
                .productName(item.getProductName())
                .quantity(item.getQuantity())
                .price(item.getUnitPrice())
                .subtotal(item.getSubtotal())
                .build();
    }
}
