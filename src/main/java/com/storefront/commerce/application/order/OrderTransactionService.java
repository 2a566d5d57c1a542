package com.storefront.commerce.application.order;

import com.storefront.commerce.application.order.dto.OrderPlacement;
import com.storefront.commerce.application.order.dto.OrderResult;
import com.storefront.commerce.application.order.dto.PlaceOrderCommand;
import com.storefront.commerce.domain.cart.Cart;
import com.storefront.commerce.domain.cart.CartItem;
import com.storefront.commerce.domain.cart.CartRepository;
import com.storefront.commerce.domain.cart.EmptyCartException;
import com.storefront.commerce.domain.order.Order;
import com.storefront.commerce.domain.order.OrderItem;
import com.storefront.commerce.domain.order.OrderNotFoundException;
import com.storefront.commerce.domain.order.OrderRepository;
import com.storefront.commerce.domain.order.OrderStatus;
import com.storefront.commerce.domain.order.PaymentStatus;
import com.storefront.commerce.domain.product.InsufficientStockException;
import com.storefront.commerce.domain.product.Product;
import com.storefront.commerce.domain.product.ProductNotFoundException;
import com.storefront.commerce.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OrderTransactionService - 주문 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - OrderService와 분리된 독립적인 서비스
 * - 2단계(원자적 거래)만 담당
 * - @Transactional이 프록시를 통해 정상 작동하도록 보장
 *
 * 이유:
 * - OrderService 내에서 @Transactional 메서드를 직접 호출하면
 *   Spring AOP 프록시가 작동하지 않아 트랜잭션이 적용되지 않음 (self-invocation)
 * - 알림 저장은 주문 커밋 이후에 수행되어야 하므로 OrderService에는 트랜잭션을 걸지 않음
 *
 * 아키텍처:
 * OrderService (1단계 검증, 3단계 알림)
 *     ↓ (의존성 주입)
 * OrderTransactionService (2단계, @Transactional 처리)
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final OrderRepository orderRepository;
    private final CartRepository cartRepository;
    private final ProductRepository productRepository;

    public OrderTransactionService(OrderRepository orderRepository,
                                   CartRepository cartRepository,
                                   ProductRepository productRepository) {
        this.orderRepository = orderRepository;
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
    }

    /**
     * 2단계: 장바구니 → 주문 전환 (단일 트랜잭션)
     *
     * 처리 순서:
     * 1. 장바구니 행 비관적 락 획득 (같은 사용자의 동시 주문 직렬화)
     * 2. 멱등성 키로 이미 생성된 주문이 있으면 그대로 반환
     * 3. 장바구니 항목 로드 (없으면 EmptyCartException)
     * 4. 각 항목의 상품을 다시 읽어 현재 재고 확인 (부족 시 InsufficientStockException, 변경 없음)
     * 5. 장바구니 단가로 주문 항목 스냅샷 생성 및 총액 계산
     * 6. 상품 ID 오름차순으로 조건부 재고 차감 (0 rows → InsufficientStockException → 전체 롤백)
     * 7. 주문 저장 (saveAndFlush)
     * 8. 장바구니 비우기
     *
     * 실패 처리:
     * - 어느 단계에서든 예외가 발생하면 트랜잭션 전체가 롤백되어
     *   주문 미생성, 재고 미차감, 장바구니 유지 상태로 남는다.
     *
     * @param userId 주문자
     * @param command 검증을 통과한 주문 커맨드
     * @return 생성(또는 멱등 재반환)된 주문
     */
    @Transactional(
        propagation = Propagation.REQUIRED,
        rollbackFor = Exception.class
    )
    public OrderPlacement executeTransactionalOrder(Long userId, PlaceOrderCommand command) {
        // ===== 2-1: 장바구니 락 =====
        Optional<Cart> lockedCart = cartRepository.findByUserIdForUpdate(userId);

        // ===== 2-2: 멱등성 키 확인 (락 획득 이후 조회해야 선행 요청의 커밋 결과를 볼 수 있음) =====
        if (command.hasCheckoutKey()) {
            Optional<Order> existing = orderRepository.findByUserIdAndCheckoutKey(userId, command.getCheckoutKey());
            if (existing.isPresent()) {
                log.info("[OrderTransactionService] 멱등성 키 재요청 - 기존 주문 반환: userId={}, orderId={}, key={}",
                        userId, existing.get().getOrderId(), command.getCheckoutKey());
                return OrderPlacement.replayed(OrderResult.from(existing.get()));
            }
        }

        // ===== 2-3: 장바구니 항목 로드 =====
        Cart cart = lockedCart.orElseThrow(() -> new EmptyCartException(userId));
        List<CartItem> cartItems = cartRepository.getCartItems(cart.getCartId());
        if (cartItems.isEmpty()) {
            throw new EmptyCartException(userId);
        }

        // ===== 2-4: 현재 재고 확인 =====
        Map<Long, Product> products = loadAndCheckStock(cartItems);

        // ===== 2-5: 주문 항목 스냅샷 (장바구니 단가 사용) =====
        List<OrderItem> orderItems = new ArrayList<>();
        for (CartItem cartItem : cartItems) {
            Product product = products.get(cartItem.getProductId());
            orderItems.add(OrderItem.snapshot(
                    product.getProductId(),
                    product.getName(),
                    cartItem.getQuantity(),
                    cartItem.getUnitPrice()));
        }

        Order order = Order.place(
                userId,
                orderItems,
                command.getShippingAddress().toShippingAddress(),
                command.getPaymentMethod().trim(),
                command.getNote(),
                command.hasCheckoutKey() ? command.getCheckoutKey() : null);

        // ===== 2-6: 조건부 재고 차감 =====
        decreaseStock(cartItems, products);

        // ===== 2-7: 주문 저장 =====
        Order savedOrder = orderRepository.save(order);

        // ===== 2-8: 장바구니 비우기 =====
        cartRepository.clear(cart);

        log.info("[OrderTransactionService] 주문 생성 완료 - orderId={}, userId={}, items={}, totalAmount={}",
                savedOrder.getOrderId(), userId, orderItems.size(), savedOrder.getTotalAmount());

        return OrderPlacement.created(OrderResult.from(savedOrder));
    }

    /**
     * 주문 상태 변경
     *
     * @param requesterId 요청자 ID (null이면 소유권 검사 생략 - 관리자용)
     * @throws OrderNotFoundException 주문이 없거나 요청자 소유가 아님
     */
    @Transactional(rollbackFor = Exception.class)
    public OrderResult changeStatus(Long orderId, Long requesterId, OrderStatus newStatus) {
        Order order = (requesterId == null
                ? orderRepository.findById(orderId)
                : orderRepository.findByIdAndUserId(orderId, requesterId))
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        OrderStatus previous = order.getOrderStatus();
        order.changeStatus(newStatus);

        log.info("[OrderTransactionService] 주문 상태 변경 - orderId={}, {} -> {}, requesterId={}",
                orderId, previous, newStatus, requesterId);
        return OrderResult.from(order);
    }

    /**
     * 결제 상태 변경 (소유권 검사 없음)
     */
    @Transactional(rollbackFor = Exception.class)
    public OrderResult changePaymentStatus(Long orderId, PaymentStatus newPaymentStatus) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        PaymentStatus previous = order.getPaymentStatus();
        order.changePaymentStatus(newPaymentStatus);

        log.info("[OrderTransactionService] 결제 상태 변경 - orderId={}, {} -> {}",
                orderId, previous, newPaymentStatus);
        return OrderResult.from(order);
    }

    /**
     * 멱등성 키로 이미 커밋된 주문 조회
     *
     * 고유 제약조건 경합에서 진 중복 요청이 선행 요청의 주문을 돌려받을 때 사용한다.
     */
    @Transactional(readOnly = true)
    public Optional<OrderResult> findPlacedOrder(Long userId, String checkoutKey) {
        return orderRepository.findByUserIdAndCheckoutKey(userId, checkoutKey)
                .map(OrderResult::from);
    }

    /**
     * 장바구니 항목마다 상품을 다시 조회하여 현재 재고를 확인한다.
     * 첫 번째 부족 항목에서 즉시 중단한다.
     */
    private Map<Long, Product> loadAndCheckStock(List<CartItem> cartItems) {
        Map<Long, Product> products = new HashMap<>();
        for (CartItem cartItem : cartItems) {
            Product product = productRepository.findById(cartItem.getProductId())
                    .orElseThrow(() -> new ProductNotFoundException(cartItem.getProductId()));

            if (!product.canFulfill(cartItem.getQuantity())) {
                log.warn("[OrderTransactionService] 재고 부족 - productId={}, name={}, requested={}, stock={}, active={}",
                        product.getProductId(), product.getName(), cartItem.getQuantity(),
                        product.getStock(), product.isActive());
                throw new InsufficientStockException(product.getName(), cartItem.getQuantity(), product.getStock());
            }
            products.put(product.getProductId(), product);
        }
        return products;
    }

    /**
     * 상품 ID 오름차순으로 재고 차감 (잠금 순서를 고정하여 교착 상태 방지)
     */
    private void decreaseStock(List<CartItem> cartItems, Map<Long, Product> products) {
        List<CartItem> ordered = new ArrayList<>(cartItems);
        ordered.sort(Comparator.comparing(CartItem::getProductId));

        for (CartItem cartItem : ordered) {
            boolean decreased = productRepository.decreaseStock(cartItem.getProductId(), cartItem.getQuantity());
            if (!decreased) {
                Product product = products.get(cartItem.getProductId());
                log.warn("[OrderTransactionService] 재고 차감 실패 (동시 주문) - productId={}, requested={}",
                        cartItem.getProductId(), cartItem.getQuantity());
                throw new InsufficientStockException(product.getName(), cartItem.getQuantity());
            }
        }
    }
}
