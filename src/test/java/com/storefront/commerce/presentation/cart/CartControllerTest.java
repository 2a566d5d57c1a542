package com.storefront.commerce.presentation.cart;

import com.storefront.commerce.application.cart.CartService;
import com.storefront.commerce.application.cart.dto.AddCartItemCommand;
import com.storefront.commerce.application.cart.dto.CartItemResult;
import com.storefront.commerce.application.cart.dto.CartResult;
import com.storefront.commerce.common.BaseControllerTest;
import com.storefront.commerce.domain.cart.CartItemNotFoundException;
import com.storefront.commerce.domain.cart.InvalidQuantityException;
import com.storefront.commerce.domain.user.UserNotFoundException;
import com.storefront.commerce.presentation.cart.mapper.CartMapper;
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
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * CartControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: CartController
 * - GET /carts, POST /carts/items, PUT/DELETE /carts/items/{cart_item_id}, DELETE /carts
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartController 단위 테스트")
class CartControllerTest extends BaseControllerTest {

    private MockMvc mockMvc;

    @Mock
    private CartService cartService;

    private static final Long TEST_USER_ID = 1001L;
    private static final Long TEST_CART_ID = 1L;
    private static final Long TEST_PRODUCT_ID = 100L;
    private static final Long TEST_CART_ITEM_ID = 50L;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        this.mockMvc = buildMockMvc(new CartController(cartService, new CartMapper()));
    }

    private CartResult cartResult(int quantity) {
        BigDecimal subtotal = new BigDecimal("10.00").multiply(BigDecimal.valueOf(quantity));
        return CartResult.builder()
                .cartId(TEST_CART_ID)
                .userId(TEST_USER_ID)
                .totalItems(1)
                .totalPrice(subtotal)
                .items(List.of(CartItemResult.builder()
                        .cartItemId(TEST_CART_ITEM_ID)
                        .productId(TEST_PRODUCT_ID)
                        .productName("무선 키보드")
                        .quantity(quantity)
                        .unitPrice(new BigDecimal("10.00"))
                        .subtotal(subtotal)
                        .build()))
                .updatedAt(LocalDateTime.now())
                .build();
    }

    // ========== 장바구니 조회 (GET /carts) ==========

    @Test
    @DisplayName("장바구니 조회 - 성공")
    void testGetCart_Success() throws Exception {
        when(cartService.getCart(TEST_USER_ID)).thenReturn(cartResult(2));

        mockMvc.perform(get("/carts").header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cart_id").value(TEST_CART_ID))
                .andExpect(jsonPath("$.total_items").value(1))
                .andExpect(jsonPath("$.items[0].cart_item_id").value(TEST_CART_ITEM_ID))
                .andExpect(jsonPath("$.items[0].product_name").value("무선 키보드"));
    }

    @Test
    @DisplayName("장바구니 조회 - 사용자 없음 404")
    void testGetCart_UserNotFound() throws Exception {
        when(cartService.getCart(TEST_USER_ID)).thenThrow(new UserNotFoundException(TEST_USER_ID));

        mockMvc.perform(get("/carts").header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_USER_NOT_FOUND"));
    }

    @Test
    @DisplayName("장바구니 조회 - X-USER-ID 형식 오류 400")
    void testGetCart_InvalidUserHeader() throws Exception {
        mockMvc.perform(get("/carts").header("X-USER-ID", "abc"))
                .andExpect(status().isBadRequest());
    }

    // ========== 상품 추가 (POST /carts/items) ==========

    @Test
    @DisplayName("상품 추가 - 201 Created")
    void testAddCartItem_Success() throws Exception {
        when(cartService.addItem(eq(TEST_USER_ID), any(AddCartItemCommand.class))).thenReturn(cartResult(2));

        mockMvc.perform(post("/carts/items")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":100,\"quantity\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.total_price").value(20.00));

        ArgumentCaptor<AddCartItemCommand> command = ArgumentCaptor.forClass(AddCartItemCommand.class);
        verify(cartService).addItem(eq(TEST_USER_ID), command.capture());
        assertEquals(TEST_PRODUCT_ID, command.getValue().getProductId());
        assertEquals(2, command.getValue().getQuantity());
    }

    @Test
    @DisplayName("상품 추가 - 수량 범위 초과 400")
    void testAddCartItem_InvalidQuantity() throws Exception {
        when(cartService.addItem(eq(TEST_USER_ID), any(AddCartItemCommand.class)))
                .thenThrow(new InvalidQuantityException(1001));

        mockMvc.perform(post("/carts/items")
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":100,\"quantity\":1001}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_INVALID_QUANTITY"));
    }

    // ========== 수량 변경 / 삭제 ==========

    @Test
    @DisplayName("수량 변경 - 성공")
    void testUpdateQuantity_Success() throws Exception {
        when(cartService.updateItemQuantity(TEST_USER_ID, TEST_CART_ITEM_ID, 3)).thenReturn(cartResult(3));

        mockMvc.perform(put("/carts/items/{cart_item_id}", TEST_CART_ITEM_ID)
                        .header("X-USER-ID", TEST_USER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].quantity").value(3));
    }

    @Test
    @DisplayName("항목 삭제 - 다른 사용자 항목 404")
    void testRemoveItem_NotFound() throws Exception {
        when(cartService.removeItem(TEST_USER_ID, TEST_CART_ITEM_ID))
                .thenThrow(new CartItemNotFoundException(TEST_CART_ITEM_ID));

        mockMvc.perform(delete("/carts/items/{cart_item_id}", TEST_CART_ITEM_ID).header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_ITEM_NOT_FOUND"));
    }

    @Test
    @DisplayName("항목 삭제 - 성공 시 갱신된 장바구니 반환")
    void testRemoveItem_Success() throws Exception {
        when(cartService.removeItem(TEST_USER_ID, TEST_CART_ITEM_ID)).thenReturn(CartResult.builder()
                .cartId(TEST_CART_ID).userId(TEST_USER_ID).totalItems(0).totalPrice(BigDecimal.ZERO)
                .items(Collections.emptyList()).build());

        mockMvc.perform(delete("/carts/items/{cart_item_id}", TEST_CART_ITEM_ID).header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_items").value(0));
    }

    @Test
    @DisplayName("장바구니 비우기 - 204")
    void testClearCart() throws Exception {
        mockMvc.perform(delete("/carts").header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isNoContent());

        verify(cartService).clearCart(TEST_USER_ID);
    }
}
