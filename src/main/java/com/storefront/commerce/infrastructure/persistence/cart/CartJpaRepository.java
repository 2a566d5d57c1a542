package com.storefront.commerce.infrastructure.persistence.cart;

import com.storefront.commerce.domain.cart.Cart;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Cart JPA Repository
 * Spring Data JPA를 통한 Cart 엔티티 영구 저장소
 */
public interface CartJpaRepository extends JpaRepository<Cart, Long> {

    Optional<Cart> findByUserId(Long userId);

    /**
     * 사용자 장바구니 조회 (비관적 락 - SELECT ... FOR UPDATE)
     *
     * 동시성 제어:
     * - 같은 사용자의 주문 생성 요청은 이 락을 순서대로 획득
     * - 먼저 커밋한 요청이 장바구니를 비우므로 뒤따르는 요청은 빈 장바구니를 보게 됨
     * - 결과: 장바구니 1회 체크아웃당 주문은 최대 1건
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Cart c WHERE c.userId = :userId")
    Optional<Cart> findByUserIdForUpdate(@Param("userId") Long userId);
}
