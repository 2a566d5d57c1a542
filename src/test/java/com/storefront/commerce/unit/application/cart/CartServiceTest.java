package com.storefront.commerce.unit.application.cart;

import com.storefront.commerce.application.cart.CartService;
import com.storefront.commerce.application.cart.dto.AddCartItemCommand;
import com.storefront.commerce.application.cart.dto.CartResult;
import com.storefront.commerce.common.exception.InvalidRequestException;
import com.storefront.commerce.domain.cart.CartItemNotFoundException;
import com.storefront.commerce.domain.cart.InvalidQuantityException;
import com.storefront.commerce.domain.product.InsufficientStockException;
import com.storefront.commerce.domain.product.Product;
import com.storefront.commerce.domain.product.ProductNotFoundException;
import com.storefront.commerce.domain.user.UserNotFoundException;
import com.storefront.commerce.domain.user.UserRepository;
import com.storefront.commerce.support.InMemoryCartRepository;
import com.storefront.commerce.support.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CartServiceTest - 장바구니 유스케이스 단위 테스트
 *
 * 상품/장바구니는 인메모리 저장소, 사용자 존재 여부만 Mock으로 대체한다.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private static final Long TEST_USER_ID = 1L;

    @Mock
    private UserRepository userRepository;

    private InMemoryProductRepository productRepository;
    private InMemoryCartRepository cartRepository;
    private CartService cartService;

    private Product keyboard;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        productRepository = new InMemoryProductRepository();
        cartRepository = new InMemoryCartRepository();
        cartService = new CartService(cartRepository, productRepository, userRepository);

        when(userRepository.existsById(anyLong())).thenReturn(true);
        keyboard = productRepository.save(
                Product.create("무선 키보드", null, new BigDecimal("12.00"), new BigDecimal("10.00"), 5));
    }

    // ========== 장바구니 조회 ==========

    @Test
    @DisplayName("장바구니 조회 - 없으면 빈 장바구니 생성")
    void testGetCart_CreatesEmpty() {
        CartResult result = cartService.getCart(TEST_USER_ID);

        assertNotNull(result.getCartId());
        assertEquals(0, result.getTotalItems());
        assertTrue(result.getItems().isEmpty());
    }

    @Test
    @DisplayName("장바구니 조회 - 존재하지 않는 사용자")
    void testGetCart_UserNotFound() {
        when(userRepository.existsById(99L)).thenReturn(false);

        assertThrows(UserNotFoundException.class, () -> cartService.getCart(99L));
    }

    // ========== 상품 추가 ==========

    @Test
    @DisplayName("상품 추가 - 판매가(할인가)로 단가 고정, 합계 재계산")
    void testAddItem_Success() {
        CartResult result = cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 2));

        assertEquals(1, result.getTotalItems());
        assertEquals(0, new BigDecimal("20.00").compareTo(result.getTotalPrice()));
        assertEquals("무선 키보드", result.getItems().get(0).getProductName());
        assertEquals(0, new BigDecimal("10.00").compareTo(result.getItems().get(0).getUnitPrice()));
    }

    @Test
    @DisplayName("상품 추가 - 같은 상품은 수량 누적")
    void testAddItem_MergesQuantity() {
        cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 2));

        CartResult result = cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 3));

        assertEquals(1, result.getItems().size());
        assertEquals(5, result.getItems().get(0).getQuantity());
    }

    @Test
    @DisplayName("상품 추가 - 누적 수량이 재고 초과")
    void testAddItem_MergedExceedsStock() {
        cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 4));

        assertThrows(InsufficientStockException.class,
                () -> cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 2)));
    }

    @Test
    @DisplayName("상품 추가 - 실패 케이스 (상품 없음, 수량 없음, 수량 0, 상품 ID 없음)")
    void testAddItem_Failures() {
        assertThrows(ProductNotFoundException.class,
                () -> cartService.addItem(TEST_USER_ID, new AddCartItemCommand(999L, 1)));
        assertThrows(InvalidQuantityException.class,
                () -> cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), null)));
        assertThrows(InvalidQuantityException.class,
                () -> cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 0)));
        assertThrows(InvalidRequestException.class,
                () -> cartService.addItem(TEST_USER_ID, new AddCartItemCommand(null, 1)));
    }

    // ========== 수량 변경 / 삭제 ==========

    @Test
    @DisplayName("수량 변경 - 성공")
    void testUpdateItemQuantity_Success() {
        Long cartItemId = cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 1))
                .getItems().get(0).getCartItemId();

        CartResult result = cartService.updateItemQuantity(TEST_USER_ID, cartItemId, 3);

        assertEquals(3, result.getItems().get(0).getQuantity());
        assertEquals(0, new BigDecimal("30.00").compareTo(result.getTotalPrice()));
    }

    @Test
    @DisplayName("수량 변경 - 다른 사용자의 항목은 404")
    void testUpdateItemQuantity_OtherUsersItem() {
        Long cartItemId = cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 1))
                .getItems().get(0).getCartItemId();
        cartService.getCart(2L);

        assertThrows(CartItemNotFoundException.class,
                () -> cartService.updateItemQuantity(2L, cartItemId, 2));
    }

    @Test
    @DisplayName("항목 삭제 - 합계 재계산")
    void testRemoveItem() {
        Long cartItemId = cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 1))
                .getItems().get(0).getCartItemId();

        CartResult result = cartService.removeItem(TEST_USER_ID, cartItemId);

        assertTrue(result.getItems().isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getTotalPrice()));
        assertThrows(CartItemNotFoundException.class, () -> cartService.removeItem(TEST_USER_ID, cartItemId));
    }

    // ========== 비우기 ==========

    @Test
    @DisplayName("장바구니 비우기 - 여러 번 호출해도 성공")
    void testClearCart_Idempotent() {
        cartService.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 1));

        cartService.clearCart(TEST_USER_ID);
        assertDoesNotThrow(() -> cartService.clearCart(TEST_USER_ID));
        assertDoesNotThrow(() -> cartService.clearCart(42L));

        assertEquals(0, cartService.getCart(TEST_USER_ID).getTotalItems());
    }

    // ========== 행 잠금 ==========

    @Test
    @DisplayName("항목 변경과 비우기 - 주문과 같은 장바구니 행 잠금으로 조회")
    void testMutations_UseCartRowLock() {
        InMemoryCartRepository lockingRepository = spy(new InMemoryCartRepository());
        CartService service = new CartService(lockingRepository, productRepository, userRepository);

        Long cartItemId = service.addItem(TEST_USER_ID, new AddCartItemCommand(keyboard.getProductId(), 1))
                .getItems().get(0).getCartItemId();
        service.updateItemQuantity(TEST_USER_ID, cartItemId, 2);
        service.removeItem(TEST_USER_ID, cartItemId);
        service.clearCart(TEST_USER_ID);

        verify(lockingRepository, atLeastOnce()).findByUserIdForUpdate(TEST_USER_ID);
        verify(lockingRepository, never()).findByUserId(TEST_USER_ID);
    }
}
