package com.storefront.commerce.presentation.user;

import com.storefront.commerce.application.user.UserService;
import com.storefront.commerce.presentation.user.request.DeviceTokenRequest;
import com.storefront.commerce.presentation.user.response.DeviceTokenResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * UserController - 사용자 푸시 설정 API
 */
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    /**
     * PUT /users/device-token - 푸시 디바이스 토큰 등록/해제
     */
    @PutMapping("/device-token")
    public ResponseEntity<DeviceTokenResponse> registerDeviceToken(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody DeviceTokenRequest request) {
        boolean pushEnabled = userService.registerDeviceToken(userId, request.getDeviceToken());
        return ResponseEntity.ok(new DeviceTokenResponse(userId, pushEnabled));
    }
}
