package com.storefront.commerce.presentation.product;

import com.storefront.commerce.application.product.ProductService;
import com.storefront.commerce.presentation.product.mapper.ProductMapper;
import com.storefront.commerce.presentation.product.response.ProductResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductController - 상품 조회 API (인증 불필요)
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;
    private final ProductMapper productMapper;

    public ProductController(ProductService productService, ProductMapper productMapper) {
        this.productService = productService;
        this.productMapper = productMapper;
    }

    /**
     * GET /products - 판매 중 상품 목록
     */
    @GetMapping
    public ResponseEntity<List<ProductResponse>> getProducts() {
        return ResponseEntity.ok(productService.getActiveProducts().stream()
                .map(productMapper::toProductResponse)
                .collect(Collectors.toList()));
    }

    /**
     * GET /products/{product_id} - 상품 상세
     */
    @GetMapping("/{product_id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("product_id") Long productId) {
        return ResponseEntity.ok(productMapper.toProductResponse(productService.getProduct(productId)));
    }
}
