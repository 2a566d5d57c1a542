package com.storefront.commerce.application.user;

import com.storefront.commerce.domain.user.User;
import com.storefront.commerce.domain.user.UserNotFoundException;
import com.storefront.commerce.domain.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * UserService - 푸시 발송용 디바이스 토큰 관리
 */
@Slf4j
@Service
public class UserService {

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * 디바이스 토큰 등록 (공백 토큰은 등록 해제)
     *
     * @return 토큰이 등록된 상태인지 여부
     * @throws UserNotFoundException 사용자 없음
     */
    @Transactional
    public boolean registerDeviceToken(Long userId, String token) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        user.registerDeviceToken(token);
        userRepository.save(user);

        log.info("[UserService] 디바이스 토큰 {} - userId={}", user.hasDeviceToken() ? "등록" : "해제", userId);
        return user.hasDeviceToken();
    }
}
