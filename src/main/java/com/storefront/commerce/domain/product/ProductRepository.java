package com.storefront.commerce.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface ProductRepository {

    Optional<Product> findById(Long productId);

    /**
     * 여러 상품 일괄 조회 (없는 ID는 결과에서 제외)
     */
    List<Product> findAllByIds(Collection<Long> productIds);

    /**
     * 판매 중(active) 상품 목록
     */
    List<Product> findAllActive();

    Product save(Product product);

    /**
     * 조건부 재고 차감
     *
     * stock >= quantity 인 경우에만 원자적으로 차감한다.
     * (UPDATE ... SET stock = stock - :qty WHERE product_id = :id AND stock >= :qty)
     *
     * @return 차감 성공 여부 (false: 재고 부족 또는 상품 없음)
     */
    boolean decreaseStock(Long productId, int quantity);
}
