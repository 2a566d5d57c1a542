package com.storefront.commerce.unit.domain.product;

import com.storefront.commerce.domain.product.InvalidProductException;
import com.storefront.commerce.domain.product.Product;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Product 도메인 엔티티 단위 테스트
 * - 생성 규칙 (가격, 할인가, 재고)
 * - 판매가 계산
 * - 주문 가능 여부
 */
@DisplayName("Product 도메인 엔티티 테스트")
class ProductTest {

    // ========== 상품 생성 ==========

    @Test
    @DisplayName("상품 생성 - 성공 (활성 상태로 생성)")
    void testCreate_Success() {
        // When
        Product product = Product.create("무선 키보드", "저소음", new BigDecimal("10.00"), null, 5);

        // Then
        assertEquals("무선 키보드", product.getName());
        assertEquals(5, product.getStock());
        assertTrue(product.isActive());
        assertNotNull(product.getCreatedAt());
    }

    @Test
    @DisplayName("상품 생성 - 실패 (상품명 공백)")
    void testCreate_Failed_BlankName() {
        assertThrows(InvalidProductException.class,
                () -> Product.create(" ", null, BigDecimal.TEN, null, 1));
    }

    @Test
    @DisplayName("상품 생성 - 실패 (음수 가격)")
    void testCreate_Failed_NegativePrice() {
        assertThrows(InvalidProductException.class,
                () -> Product.create("상품", null, new BigDecimal("-1"), null, 1));
    }

    @Test
    @DisplayName("상품 생성 - 실패 (할인가가 정가 이상)")
    void testCreate_Failed_DiscountNotLowerThanPrice() {
        assertThrows(InvalidProductException.class,
                () -> Product.create("상품", null, BigDecimal.TEN, BigDecimal.TEN, 1));
    }

    @Test
    @DisplayName("상품 생성 - 실패 (음수 재고)")
    void testCreate_Failed_NegativeStock() {
        assertThrows(InvalidProductException.class,
                () -> Product.create("상품", null, BigDecimal.TEN, null, -1));
    }

    // ========== 판매가 ==========

    @Test
    @DisplayName("판매가 - 할인가가 있으면 할인가")
    void testSellingPrice_Discounted() {
        Product product = Product.create("상품", null, new BigDecimal("10.00"), new BigDecimal("8.50"), 1);

        assertEquals(new BigDecimal("8.50"), product.getSellingPrice());
    }

    @Test
    @DisplayName("판매가 - 할인가가 없으면 정가")
    void testSellingPrice_Regular() {
        Product product = Product.create("상품", null, new BigDecimal("10.00"), null, 1);

        assertEquals(new BigDecimal("10.00"), product.getSellingPrice());
    }

    // ========== 주문 가능 여부 ==========

    @Test
    @DisplayName("주문 가능 - 재고와 같은 수량은 가능")
    void testCanFulfill_ExactStock() {
        Product product = Product.create("상품", null, BigDecimal.ONE, null, 3);

        assertTrue(product.canFulfill(3));
        assertFalse(product.canFulfill(4));
    }

    @Test
    @DisplayName("주문 가능 - 비활성 상품은 재고가 있어도 불가")
    void testCanFulfill_Inactive() {
        // Given
        Product product = Product.create("상품", null, BigDecimal.ONE, null, 100);

        // When
        product.deactivate();

        // Then
        assertFalse(product.isActive());
        assertFalse(product.canFulfill(1));
    }
}
