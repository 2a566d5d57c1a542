package com.storefront.commerce.presentation.order;

import com.storefront.commerce.application.order.OrderService;
import com.storefront.commerce.application.order.dto.PlaceOrderResult;
import com.storefront.commerce.presentation.common.RequestDates;
import com.storefront.commerce.presentation.order.mapper.OrderMapper;
import com.storefront.commerce.presentation.order.request.PlaceOrderRequest;
import com.storefront.commerce.presentation.order.request.UpdateOrderStatusRequest;
import com.storefront.commerce.presentation.order.request.UpdatePaymentStatusRequest;
import com.storefront.commerce.presentation.order.response.OrderListResponse;
import com.storefront.commerce.presentation.order.response.OrderResponse;
import com.storefront.commerce.presentation.order.response.PlaceOrderResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * OrderController - 주문 API 엔드포인트
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * 주문 생성 (POST /api/orders)
     *
     * 요청자의 장바구니 전체를 주문으로 전환한다.
     * Idempotency-Key 헤더가 있으면 같은 키의 재요청에 기존 주문을 그대로 반환한다.
     *
     * @return 201 Created: 생성된 주문 (재요청이면 200 OK)
     */
    @PostMapping
    public ResponseEntity<PlaceOrderResponse> placeOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @RequestBody(required = false) PlaceOrderRequest request) {
        PlaceOrderResult result = orderService.placeOrder(userId, orderMapper.toPlaceOrderCommand(request, idempotencyKey));

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(orderMapper.toPlaceOrderResponse(result));
    }

    /**
     * 주문 목록 조회 (GET /api/orders?status=&startDate=&endDate=&page=&limit=)
     */
    @GetMapping
    public ResponseEntity<OrderListResponse> getOrders(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "limit", required = false) Integer limit) {
        var result = orderService.getOrders(userId, status,
                RequestDates.startOfDay(startDate), RequestDates.endOfDay(endDate), page, limit);
        return ResponseEntity.ok(orderMapper.toOrderListResponse(result));
    }

    /**
     * 주문 상세 조회 (GET /api/orders/{order_id})
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderResponse> getOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toOrderResponse(orderService.getOrder(userId, orderId)));
    }

    /**
     * 주문 상태 변경 (PUT /api/orders/{order_id}/status) - 주문자 본인만
     */
    @PutMapping("/{order_id}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId,
            @RequestBody UpdateOrderStatusRequest request) {
        var result = orderService.updateStatus(orderId, userId, request.getStatus());
        return ResponseEntity.ok(orderMapper.toOrderResponse(result));
    }

    /**
     * 결제 상태 변경 (PUT /api/orders/{order_id}/payment)
     */
    @PutMapping("/{order_id}/payment")
    public ResponseEntity<OrderResponse> updatePaymentStatus(
            @PathVariable("order_id") Long orderId,
            @RequestBody UpdatePaymentStatusRequest request) {
        var result = orderService.updatePaymentStatus(orderId, request.getPaymentStatus());
        return ResponseEntity.ok(orderMapper.toOrderResponse(result));
    }
}
