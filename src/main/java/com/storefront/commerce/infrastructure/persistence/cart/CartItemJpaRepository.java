package com.storefront.commerce.infrastructure.persistence.cart;

import com.storefront.commerce.domain.cart.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CartItem JPA Repository
 */
public interface CartItemJpaRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findByCartIdOrderByCartItemIdAsc(Long cartId);

    Optional<CartItem> findByCartIdAndProductId(Long cartId, Long productId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM CartItem ci WHERE ci.cartId = :cartId")
    int deleteAllByCartId(@Param("cartId") Long cartId);
}
