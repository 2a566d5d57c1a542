package com.storefront.commerce.infrastructure.persistence.product;

import com.storefront.commerce.domain.product.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Product JPA Repository
 * Spring Data JPA를 통한 Product 엔티티 영구 저장소
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    List<Product> findByActiveTrueOrderByProductIdAsc();

    /**
     * 조건부 재고 차감 (원자적 UPDATE)
     *
     * SQL 생성:
     * UPDATE products SET stock = stock - ?, updated_at = ?
     *  WHERE product_id = ? AND stock >= ?
     *
     * 동시성 제어:
     * - 조건 검사와 차감이 한 문장에서 수행되므로 행 잠금 범위 안에서 원자적으로 처리됨
     * - 재고가 부족하면 0 rows 반환 → 호출자가 트랜잭션을 롤백
     * - 재고가 음수가 되는 경우 없음
     *
     * @return 변경된 행 수 (0 또는 1)
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock - :quantity, p.updatedAt = :now " +
           "WHERE p.productId = :productId AND p.stock >= :quantity")
    int decreaseStockIfAvailable(@Param("productId") Long productId,
                                 @Param("quantity") int quantity,
                                 @Param("now") LocalDateTime now);
}
