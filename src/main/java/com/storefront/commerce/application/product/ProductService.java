package com.storefront.commerce.application.product;

import com.storefront.commerce.application.product.dto.ProductResult;
import com.storefront.commerce.domain.product.ProductNotFoundException;
import com.storefront.commerce.domain.product.ProductRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductService - 상품 조회 (읽기 전용)
 */
@Service
@Transactional(readOnly = true)
public class ProductService {

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    /**
     * 판매 중 상품 목록
     */
    public List<ProductResult> getActiveProducts() {
        return productRepository.findAllActive().stream()
                .map(ProductResult::from)
                .collect(Collectors.toList());
    }

    /**
     * 상품 상세 조회 (판매 중지 상품도 조회 가능)
     *
     * @throws ProductNotFoundException 상품 없음
     */
    public ProductResult getProduct(Long productId) {
        return productRepository.findById(productId)
                .map(ProductResult::from)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }
}
