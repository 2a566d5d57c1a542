package com.storefront.commerce.infrastructure.persistence.product;

import com.storefront.commerce.domain.product.Product;
import com.storefront.commerce.domain.product.ProductConstants;
import com.storefront.commerce.domain.product.ProductRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(ProductRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public List<Product> findAllByIds(Collection<Long> productIds) {
        return productJpaRepository.findAllById(productIds);
    }

    @Override
    public List<Product> findAllActive() {
        return productJpaRepository.findByActiveTrueOrderByProductIdAsc();
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    public boolean decreaseStock(Long productId, int quantity) {
        if (quantity < ProductConstants.MIN_DECREASE_QUANTITY) {
            throw new IllegalArgumentException("차감 수량은 1 이상이어야 합니다");
        }
        return productJpaRepository.decreaseStockIfAvailable(productId, quantity, LocalDateTime.now()) == 1;
    }
}
