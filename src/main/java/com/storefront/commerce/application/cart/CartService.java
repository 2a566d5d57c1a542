package com.storefront.commerce.application.cart;

import com.storefront.commerce.application.cart.dto.AddCartItemCommand;
import com.storefront.commerce.application.cart.dto.CartItemResult;
import com.storefront.commerce.application.cart.dto.CartResult;
import com.storefront.commerce.common.exception.InvalidRequestException;
import com.storefront.commerce.domain.cart.Cart;
import com.storefront.commerce.domain.cart.CartItem;
import com.storefront.commerce.domain.cart.CartItemNotFoundException;
import com.storefront.commerce.domain.cart.CartRepository;
import com.storefront.commerce.domain.cart.InvalidQuantityException;
import com.storefront.commerce.domain.product.InsufficientStockException;
import com.storefront.commerce.domain.product.Product;
import com.storefront.commerce.domain.product.ProductNotFoundException;
import com.storefront.commerce.domain.product.ProductRepository;
import com.storefront.commerce.domain.user.UserNotFoundException;
import com.storefront.commerce.domain.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CartService - Application 계층
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository, ProductRepository 인터페이스에만 의존 (Port)
 * - Infrastructure 계층의 구현체는 DI를 통해 주입됨 (Adapter)
 *
 * 동시성:
 * - 항목 변경과 비우기는 주문 생성과 같은 장바구니 행 잠금(SELECT ... FOR UPDATE)을 먼저 잡는다
 * - 주문 트랜잭션이 읽은 항목과 삭제하는 항목이 항상 일치한다
 *
 * 가격 규칙:
 * - 항목을 담는 시점의 판매가(할인가 우선)를 unitPrice로 고정
 * - 주문은 상품의 현재 가격이 아닌 이 unitPrice로 생성된다
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final UserRepository userRepository;

    public CartService(CartRepository cartRepository,
                       ProductRepository productRepository,
                       UserRepository userRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.userRepository = userRepository;
    }

    /**
     * 사용자의 장바구니 조회 (없으면 빈 장바구니 생성)
     */
    @Transactional
    public CartResult getCart(Long userId) {
        requireUser(userId);
        Cart cart = cartRepository.findOrCreateByUserId(userId);
        return toResult(cart, cartRepository.getCartItems(cart.getCartId()));
    }

    /**
     * 장바구니에 상품 추가
     *
     * 같은 상품이 이미 있으면 수량을 누적한다.
     *
     * @throws ProductNotFoundException 상품 없음
     * @throws InsufficientStockException 판매 중지 상품이거나 누적 수량이 현재 재고 초과
     * @throws InvalidQuantityException 수량이 1 미만 또는 1000 초과
     */
    @Transactional
    public CartResult addItem(Long userId, AddCartItemCommand command) {
        requireUser(userId);
        if (command == null || command.getProductId() == null) {
            throw new InvalidRequestException("productId는 필수입니다");
        }
        int quantity = requireQuantity(command.getQuantity());

        Cart cart = lockOrCreateCart(userId);
        Product product = productRepository.findById(command.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(command.getProductId()));

        Optional<CartItem> existing = cartRepository.findCartItem(cart.getCartId(), product.getProductId());
        int mergedQuantity = existing.map(item -> item.getQuantity() + quantity).orElse(quantity);

        if (!product.canFulfill(mergedQuantity)) {
            throw new InsufficientStockException(product.getName(), mergedQuantity, product.getStock());
        }

        if (existing.isPresent()) {
            existing.get().changeQuantity(mergedQuantity);
            cartRepository.saveCartItem(existing.get());
        } else {
            cartRepository.saveCartItem(
                    CartItem.create(cart.getCartId(), product.getProductId(), quantity, product.getSellingPrice()));
        }

        log.info("[CartService] 장바구니 상품 추가 - userId={}, productId={}, quantity={}",
                userId, product.getProductId(), mergedQuantity);
        return recalculate(cart);
    }

    /**
     * 장바구니 항목 수량 변경
     *
     * @throws CartItemNotFoundException 항목이 없거나 요청자의 장바구니가 아님
     */
    @Transactional
    public CartResult updateItemQuantity(Long userId, Long cartItemId, Integer quantity) {
        int newQuantity = requireQuantity(quantity);
        Cart cart = cartRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));
        CartItem cartItem = findOwnedItem(cart, cartItemId);

        Product product = productRepository.findById(cartItem.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(cartItem.getProductId()));
        if (!product.canFulfill(newQuantity)) {
            throw new InsufficientStockException(product.getName(), newQuantity, product.getStock());
        }

        cartItem.changeQuantity(newQuantity);
        cartRepository.saveCartItem(cartItem);
        return recalculate(cart);
    }

    /**
     * 장바구니에서 항목 제거
     *
     * @throws CartItemNotFoundException 항목이 없거나 요청자의 장바구니가 아님
     */
    @Transactional
    public CartResult removeItem(Long userId, Long cartItemId) {
        Cart cart = cartRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));
        CartItem cartItem = findOwnedItem(cart, cartItemId);

        cartRepository.deleteCartItem(cartItem.getCartItemId());
        log.info("[CartService] 장바구니 항목 삭제 - userId={}, cartItemId={}", userId, cartItemId);
        return recalculate(cart);
    }

    /**
     * 장바구니 비우기 (장바구니가 없거나 비어 있어도 성공)
     */
    @Transactional
    public void clearCart(Long userId) {
        cartRepository.findByUserIdForUpdate(userId).ifPresent(cart -> {
            cartRepository.clear(cart);
            log.info("[CartService] 장바구니 비우기 - userId={}, cartId={}", userId, cart.getCartId());
        });
    }

    /**
     * 장바구니 행 잠금. 장바구니가 없으면 이 트랜잭션에서 생성한 행을 그대로 사용한다.
     */
    private Cart lockOrCreateCart(Long userId) {
        return cartRepository.findByUserIdForUpdate(userId)
                .orElseGet(() -> cartRepository.findOrCreateByUserId(userId));
    }

    private CartItem findOwnedItem(Cart cart, Long cartItemId) {
        return cartRepository.findCartItemById(cartItemId)
                .filter(item -> item.belongsTo(cart.getCartId()))
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));
    }

    /**
     * 장바구니 합계 재계산 후 결과 반환
     */
    private CartResult recalculate(Cart cart) {
        List<CartItem> items = cartRepository.getCartItems(cart.getCartId());
        cart.recalculate(items);
        cartRepository.saveCart(cart);
        return toResult(cart, items);
    }

    private CartResult toResult(Cart cart, List<CartItem> items) {
        Map<Long, String> productNames = productRepository.findAllByIds(
                        items.stream().map(CartItem::getProductId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(Product::getProductId, Product::getName, (a, b) -> a));

        List<CartItemResult> itemResults = items.stream()
                .map(item -> CartItemResult.from(item, productNames.get(item.getProductId())))
                .collect(Collectors.toList());
        return CartResult.from(cart, itemResults);
    }

    private void requireUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
    }

    private int requireQuantity(Integer quantity) {
        if (quantity == null) {
            throw new InvalidQuantityException(null);
        }
        return quantity;
    }
}
