package com.storefront.commerce.domain.cart;

import java.util.List;
import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface CartRepository {
    /**
     * 사용자의 장바구니 조회 또는 생성
     */
    Cart findOrCreateByUserId(Long userId);

    /**
     * 사용자의 장바구니 조회
     */
    Optional<Cart> findByUserId(Long userId);

    /**
     * 사용자의 장바구니 조회 (비관적 락 - SELECT ... FOR UPDATE)
     *
     * 주문 생성 트랜잭션 안에서 호출되어 같은 사용자의 동시 주문을 직렬화한다.
     */
    Optional<Cart> findByUserIdForUpdate(Long userId);

    Optional<CartItem> findCartItemById(Long cartItemId);

    /**
     * 장바구니에서 특정 상품 항목 조회 (같은 상품을 다시 담을 때 수량 누적용)
     */
    Optional<CartItem> findCartItem(Long cartId, Long productId);

    List<CartItem> getCartItems(Long cartId);

    CartItem saveCartItem(CartItem cartItem);

    void deleteCartItem(Long cartItemId);

    Cart saveCart(Cart cart);

    /**
     * 장바구니 비우기: 모든 항목 삭제 + 합계 초기화
     * 항목이 없어도 오류 없이 종료된다.
     */
    void clear(Cart cart);
}
