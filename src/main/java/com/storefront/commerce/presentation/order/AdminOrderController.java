package com.storefront.commerce.presentation.order;

import com.storefront.commerce.application.order.OrderService;
import com.storefront.commerce.presentation.order.mapper.OrderMapper;
import com.storefront.commerce.presentation.order.request.UpdateOrderStatusRequest;
import com.storefront.commerce.presentation.order.response.OrderResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AdminOrderController - 관리자 주문 API
 *
 * 관리자 권한 확인은 앞단 게이트웨이가 담당하며, 여기서는 소유권 검사를 하지 않는다.
 */
@RestController
@RequestMapping("/admin/orders")
public class AdminOrderController {

    private final OrderService orderService;
    private final OrderMapper orderMapper;

    public AdminOrderController(OrderService orderService, OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderMapper = orderMapper;
    }

    /**
     * 주문 상태 변경 (PUT /api/admin/orders/{order_id}/status)
     */
    @PutMapping("/{order_id}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable("order_id") Long orderId,
            @RequestBody UpdateOrderStatusRequest request) {
        var result = orderService.updateStatusAsAdmin(orderId, request.getStatus());
        return ResponseEntity.ok(orderMapper.toOrderResponse(result));
    }
}
