package com.storefront.commerce.unit.application.order;

import com.storefront.commerce.application.order.OrderTransactionService;
import com.storefront.commerce.application.order.dto.PlaceOrderCommand;
import com.storefront.commerce.application.order.dto.ShippingAddressCommand;
import com.storefront.commerce.domain.cart.Cart;
import com.storefront.commerce.domain.cart.CartItem;
import com.storefront.commerce.domain.product.InsufficientStockException;
import com.storefront.commerce.domain.product.Product;
import com.storefront.commerce.support.InMemoryCartRepository;
import com.storefront.commerce.support.InMemoryOrderRepository;
import com.storefront.commerce.support.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 동시 주문 재고 테스트
 *
 * 서로 다른 사용자 N명이 재고 S개인 상품 1개씩을 동시에 주문하면
 * 성공 건수는 min(N, S)이고 재고는 음수가 되지 않아야 한다.
 */
@DisplayName("동시 주문 재고 테스트")
class OrderStockConcurrencyTest {

    private InMemoryProductRepository productRepository;
    private InMemoryCartRepository cartRepository;
    private InMemoryOrderRepository orderRepository;
    private OrderTransactionService orderTransactionService;

    @BeforeEach
    void setup() {
        productRepository = new InMemoryProductRepository();
        cartRepository = new InMemoryCartRepository();
        orderRepository = new InMemoryOrderRepository();
        orderTransactionService = new OrderTransactionService(orderRepository, cartRepository, productRepository);
    }

    private PlaceOrderCommand command() {
        return PlaceOrderCommand.builder()
                .shippingAddress(ShippingAddressCommand.builder()
                        .street("테헤란로 1").city("서울").state("서울특별시").zipCode("06236").build())
                .paymentMethod("card")
                .build();
    }

    @Test
    @DisplayName("사용자 20명, 재고 5 - 5건만 성공")
    void testConcurrentOrders_NoOversell() throws InterruptedException {
        assertConcurrentOrders(20, 5);
    }

    @Test
    @DisplayName("사용자 5명, 재고 10 - 모두 성공")
    void testConcurrentOrders_EnoughStock() throws InterruptedException {
        assertConcurrentOrders(5, 10);
    }

    private void assertConcurrentOrders(int users, int stock) throws InterruptedException {
        // Given
        Product product = productRepository.save(
                Product.create("한정판 스니커즈", null, new BigDecimal("99.00"), null, stock));
        for (long userId = 1; userId <= users; userId++) {
            Cart cart = cartRepository.findOrCreateByUserId(userId);
            cartRepository.saveCartItem(
                    CartItem.create(cart.getCartId(), product.getProductId(), 1, product.getSellingPrice()));
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(users, 16));
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(users);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger soldOutCount = new AtomicInteger();

        // When
        for (long userId = 1; userId <= users; userId++) {
            final long buyer = userId;
            executor.submit(() -> {
                try {
                    start.await();
                    orderTransactionService.executeTransactionalOrder(buyer, command());
                    successCount.incrementAndGet();
                } catch (InsufficientStockException e) {
                    soldOutCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        int expectedSuccess = Math.min(users, stock);
        assertEquals(expectedSuccess, successCount.get());
        assertEquals(users - expectedSuccess, soldOutCount.get());
        assertEquals(stock - expectedSuccess, productRepository.stockOf(product.getProductId()));
        assertTrue(productRepository.stockOf(product.getProductId()) >= 0);
        assertEquals(expectedSuccess, orderRepository.all().size());
        assertEquals(Collections.nCopies(expectedSuccess, 1),
                orderRepository.all().stream().map(order -> order.getTotalQuantity()).toList());
    }
}
