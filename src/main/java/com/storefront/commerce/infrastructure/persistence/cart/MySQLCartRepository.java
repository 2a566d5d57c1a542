package com.storefront.commerce.infrastructure.persistence.cart;

import com.storefront.commerce.domain.cart.Cart;
import com.storefront.commerce.domain.cart.CartItem;
import com.storefront.commerce.domain.cart.CartRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(CartRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;
    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository, CartItemJpaRepository cartItemJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public Cart findOrCreateByUserId(Long userId) {
        return cartJpaRepository.findByUserId(userId)
                .orElseGet(() -> cartJpaRepository.save(Cart.createFor(userId)));
    }

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        return cartJpaRepository.findByUserId(userId);
    }

    @Override
    public Optional<Cart> findByUserIdForUpdate(Long userId) {
        return cartJpaRepository.findByUserIdForUpdate(userId);
    }

    @Override
    public Optional<CartItem> findCartItemById(Long cartItemId) {
        return cartItemJpaRepository.findById(cartItemId);
    }

    @Override
    public Optional<CartItem> findCartItem(Long cartId, Long productId) {
        return cartItemJpaRepository.findByCartIdAndProductId(cartId, productId);
    }

    @Override
    public List<CartItem> getCartItems(Long cartId) {
        return cartItemJpaRepository.findByCartIdOrderByCartItemIdAsc(cartId);
    }

    @Override
    public CartItem saveCartItem(CartItem cartItem) {
        return cartItemJpaRepository.save(cartItem);
    }

    @Override
    public void deleteCartItem(Long cartItemId) {
        cartItemJpaRepository.deleteById(cartItemId);
    }

    @Override
    public Cart saveCart(Cart cart) {
        return cartJpaRepository.save(cart);
    }

    @Override
    public void clear(Cart cart) {
        cartItemJpaRepository.deleteAllByCartId(cart.getCartId());
        cart.reset();
        cartJpaRepository.save(cart);
    }
}
