package com.storefront.commerce.presentation.cart;

import com.storefront.commerce.application.cart.CartService;
import com.storefront.commerce.presentation.cart.mapper.CartMapper;
import com.storefront.commerce.presentation.cart.request.AddCartItemRequest;
import com.storefront.commerce.presentation.cart.request.UpdateQuantityRequest;
import com.storefront.commerce.presentation.cart.response.CartResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리 (모든 변경 API는 변경 후 장바구니 전체를 반환)
 */
@RestController
@RequestMapping("/carts")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /carts - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.getCart(userId)));
    }

    /**
     * POST /carts/items - 장바구니 아이템 추가
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody AddCartItemRequest request) {
        var cart = cartService.addItem(userId, cartMapper.toAddCartItemCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(cartMapper.toCartResponse(cart));
    }

    /**
     * PUT /carts/items/{cart_item_id} - 장바구니 아이템 수량 수정
     */
    @PutMapping("/items/{cart_item_id}")
    public ResponseEntity<CartResponse> updateCartItemQuantity(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_item_id") Long cartItemId,
            @RequestBody UpdateQuantityRequest request) {
        var cart = cartService.updateItemQuantity(userId, cartItemId, request.getQuantity());
        return ResponseEntity.ok(cartMapper.toCartResponse(cart));
    }

    /**
     * DELETE /carts/items/{cart_item_id} - 장바구니 아이템 제거
     */
    @DeleteMapping("/items/{cart_item_id}")
    public ResponseEntity<CartResponse> removeCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("cart_item_id") Long cartItemId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.removeItem(userId, cartItemId)));
    }

    /**
     * DELETE /carts - 장바구니 비우기 (비어 있어도 204)
     */
    @DeleteMapping
    public ResponseEntity<Void> clearCart(@RequestHeader("X-USER-ID") Long userId) {
        cartService.clearCart(userId);
        return ResponseEntity.noContent().build();
    }
}
