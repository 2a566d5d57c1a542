package com.storefront.commerce.presentation.order;

import com.storefront.commerce.application.order.OrderService;
import com.storefront.commerce.application.order.dto.OrderItemResult;
import com.storefront.commerce.application.order.dto.OrderListResult;
import com.storefront.commerce.application.order.dto.OrderResult;
import com.storefront.commerce.application.order.dto.PlaceOrderCommand;
import com.storefront.commerce.application.order.dto.PlaceOrderResult;
import com.storefront.commerce.common.BaseControllerTest;
import com.storefront.commerce.common.exception.InvalidRequestException;
import com.storefront.commerce.domain.cart.EmptyCartException;
import com.storefront.commerce.domain.order.OrderNotFoundException;
import com.storefront.commerce.domain.order.ShippingAddress;
import com.storefront.commerce.domain.product.InsufficientStockException;
import com.storefront.commerce.presentation.order.mapper.OrderMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * OrderControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: OrderController, AdminOrderController
 * - POST /orders - 주문 생성 (201 / 멱등 재요청 200)
 * - GET /orders, GET /orders/{order_id}
 * - PUT /orders/{order_id}/status, PUT /orders/{order_id}/payment
 * - PUT /admin/orders/{order_id}/status
 * - 에러 응답 형식 (error_code, error_message)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderController 단위 테스트")
class OrderControllerTest extends BaseControllerTest {

    private MockMvc mockMvc;
    private MockMvc adminMockMvc;

    @Mock
    private OrderService orderService;

    private static final Long TEST_USER_ID = 1L;
    private static final Long TEST_ORDER_ID = 100L;

    private static final String PLACE_ORDER_BODY = "{"
            + "\"shipping_address\":{\"street\":\"테헤란로 1\",\"city\":\"서울\",\"state\":\"서울특별시\",\"zip_code\":\"06236\"},"
            + "\"payment_method\":\"card\","
            + "\"note\":\"문 앞\""
            + "}";

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        OrderMapper orderMapper = new OrderMapper();
        this.mockMvc = buildMockMvc(new OrderController(orderService, orderMapper));
        this.adminMockMvc = buildMockMvc(new AdminOrderController(orderService, orderMapper));
    }

    private OrderResult orderResult(String status) {
        return OrderResult.builder()
                .orderId(TEST_ORDER_ID)
                .userId(TEST_USER_ID)
                .status(status)
                .paymentStatus("pending")
                .paymentMethod("card")
                .totalAmount(new BigDecimal("20.00"))
                .shippingAddress(ShippingAddress.builder()
                        .street("테헤란로 1").city("서울").state("서울특별시").zipCode("06236").build())
                .note("문 앞")
                .items(List.of(OrderItemResult.builder()
                        .orderItemId(1L)
                        .productId(10L)
                        .productName("무선 키보드")
                        .quantity(2)
                        .unitPrice(new BigDecimal("10.00"))
                        .subtotal(new BigDecimal("20.00"))
                        .build()))
                .createdAt(LocalDateTime.of(2026, 1, 5, 10, 0))
                .updatedAt(LocalDateTime.of(2026, 1, 5, 10, 0))
                .build();
    }

    // ========== 주문 생성 (POST /orders) ==========

    @Test
    @DisplayName("주문 생성 - 201 Created, snake_case 응답")
    void testPlaceOrder_Created() throws Exception {
        // Given
        when(orderService.placeOrder(eq(TEST_USER_ID), any(PlaceOrderCommand.class)))
                .thenReturn(new PlaceOrderResult(orderResult("pending"), true, false));

        // When & Then
        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLACE_ORDER_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.order_id").value(TEST_ORDER_ID))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.payment_status").value("pending"))
                .andExpect(jsonPath("$.total_amount").value(20.00))
                .andExpect(jsonPath("$.shipping_address.zip_code").value("06236"))
                .andExpect(jsonPath("$.items[0].product_name").value("무선 키보드"))
                .andExpect(jsonPath("$.notification_recorded").value(true))
                .andExpect(jsonPath("$.created_at").value("2026-01-05T10:00:00"));
    }

    @Test
    @DisplayName("주문 생성 - Idempotency-Key 헤더를 커맨드로 전달, 재요청은 200")
    void testPlaceOrder_Replayed() throws Exception {
        // Given
        when(orderService.placeOrder(eq(TEST_USER_ID), any(PlaceOrderCommand.class)))
                .thenReturn(PlaceOrderResult.replayed(orderResult("pending")));

        // When
        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .header("Idempotency-Key", "checkout-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLACE_ORDER_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_id").value(TEST_ORDER_ID))
                .andExpect(jsonPath("$.notification_recorded").doesNotExist());

        // Then
        ArgumentCaptor<PlaceOrderCommand> command = ArgumentCaptor.forClass(PlaceOrderCommand.class);
        verify(orderService).placeOrder(eq(TEST_USER_ID), command.capture());
        assertEquals("checkout-1", command.getValue().getCheckoutKey());
        assertEquals("06236", command.getValue().getShippingAddress().getZipCode());
        assertEquals("card", command.getValue().getPaymentMethod());
    }

    @Test
    @DisplayName("주문 생성 - 알림 기록 실패해도 201, notification_recorded=false")
    void testPlaceOrder_NotificationNotRecorded() throws Exception {
        when(orderService.placeOrder(eq(TEST_USER_ID), any(PlaceOrderCommand.class)))
                .thenReturn(new PlaceOrderResult(orderResult("pending"), false, false));

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLACE_ORDER_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.notification_recorded").value(false));
    }

    @Test
    @DisplayName("주문 생성 - 재고 부족 400, 상품명 포함")
    void testPlaceOrder_InsufficientStock() throws Exception {
        when(orderService.placeOrder(eq(TEST_USER_ID), any(PlaceOrderCommand.class)))
                .thenThrow(new InsufficientStockException("무선 키보드", 2, 1));

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLACE_ORDER_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_INSUFFICIENT_STOCK"))
                .andExpect(jsonPath("$.error_message").value(org.hamcrest.Matchers.containsString("무선 키보드")))
                .andExpect(jsonPath("$.request_id").exists());
    }

    @Test
    @DisplayName("주문 생성 - 빈 장바구니 400")
    void testPlaceOrder_EmptyCart() throws Exception {
        when(orderService.placeOrder(eq(TEST_USER_ID), any(PlaceOrderCommand.class)))
                .thenThrow(new EmptyCartException(TEST_USER_ID));

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLACE_ORDER_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_EMPTY"));
    }

    @Test
    @DisplayName("주문 생성 - X-USER-ID 헤더 누락 400")
    void testPlaceOrder_MissingUserHeader() throws Exception {
        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLACE_ORDER_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_REQUEST_INVALID"));

        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("주문 생성 - 잘못된 JSON 400")
    void testPlaceOrder_MalformedBody() throws Exception {
        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shipping_address\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_REQUEST_INVALID"));
    }

    @Test
    @DisplayName("주문 생성 - 검증 실패 400")
    void testPlaceOrder_ValidationFailed() throws Exception {
        when(orderService.placeOrder(eq(TEST_USER_ID), any(PlaceOrderCommand.class)))
                .thenThrow(new InvalidRequestException("paymentMethod는 필수입니다"));

        mockMvc.perform(post("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_message").value(org.hamcrest.Matchers.containsString("paymentMethod")));
    }

    // ========== 주문 조회 ==========

    @Test
    @DisplayName("주문 목록 조회 - 날짜는 하루 전체 범위로 변환")
    void testGetOrders() throws Exception {
        // Given
        Map<String, Long> statusCounts = new LinkedHashMap<>();
        statusCounts.put("pending", 1L);
        statusCounts.put("processing", 0L);
        when(orderService.getOrders(eq(TEST_USER_ID), eq("pending"), any(), any(), eq(1), eq(5)))
                .thenReturn(OrderListResult.builder()
                        .orders(List.of(orderResult("pending")))
                        .page(1).limit(5).total(1).pages(1)
                        .statusCounts(statusCounts)
                        .build());

        // When
        mockMvc.perform(get("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .param("status", "pending")
                        .param("startDate", "2026-01-01")
                        .param("endDate", "2026-01-31")
                        .param("page", "1")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orders[0].order_id").value(TEST_ORDER_ID))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.status_counts.pending").value(1))
                .andExpect(jsonPath("$.status_counts.processing").value(0));

        // Then
        ArgumentCaptor<LocalDateTime> start = ArgumentCaptor.forClass(LocalDateTime.class);
        ArgumentCaptor<LocalDateTime> end = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(orderService).getOrders(eq(TEST_USER_ID), eq("pending"), start.capture(), end.capture(), eq(1), eq(5));
        assertEquals(LocalDateTime.of(2026, 1, 1, 0, 0), start.getValue());
        assertEquals(LocalDateTime.of(2026, 1, 31, 23, 59, 59, 999_999_999), end.getValue());
    }

    @Test
    @DisplayName("주문 목록 조회 - 잘못된 날짜 형식 400")
    void testGetOrders_InvalidDate() throws Exception {
        mockMvc.perform(get("/orders")
                        .header("X-USER-ID", TEST_USER_ID)
                        .param("startDate", "01/01/2026"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("주문 상세 조회 - 다른 사용자 주문은 404")
    void testGetOrder_NotFound() throws Exception {
        when(orderService.getOrder(2L, TEST_ORDER_ID)).thenThrow(new OrderNotFoundException(TEST_ORDER_ID));

        mockMvc.perform(get("/orders/{order_id}", TEST_ORDER_ID).header("X-USER-ID", 2L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_ORDER_NOT_FOUND"));
    }

    // ========== 상태 변경 ==========

    @Test
    @DisplayName("주문 상태 변경 - 소유자")
    void testUpdateStatus() throws Exception {
        when(orderService.updateStatus(TEST_ORDER_ID, TEST_USER_ID, "shipped")).thenReturn(orderResult("shipped"));

        mockMvc.perform(put("/orders/{order_id}/status", TEST_ORDER_ID)
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"shipped\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("shipped"));
    }

    @Test
    @DisplayName("결제 상태 변경")
    void testUpdatePaymentStatus() throws Exception {
        when(orderService.updatePaymentStatus(TEST_ORDER_ID, "completed")).thenReturn(orderResult("pending"));

        mockMvc.perform(put("/orders/{order_id}/payment", TEST_ORDER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payment_status\":\"completed\"}"))
                .andExpect(status().isOk());

        verify(orderService).updatePaymentStatus(TEST_ORDER_ID, "completed");
    }

    @Test
    @DisplayName("관리자 주문 상태 변경 - X-USER-ID 없이 처리")
    void testAdminUpdateStatus() throws Exception {
        when(orderService.updateStatusAsAdmin(TEST_ORDER_ID, "delivered")).thenReturn(orderResult("delivered"));

        adminMockMvc.perform(put("/admin/orders/{order_id}/status", TEST_ORDER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"delivered\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("delivered"));
    }
}
