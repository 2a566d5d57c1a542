package com.storefront.commerce.domain.user;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * User 도메인 엔티티
 *
 * 계정 생성과 인증은 외부 인증 서비스가 담당하며,
 * 이 서비스는 푸시 발송 대상 디바이스 토큰만 관리한다.
 */
@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(columnNames = "email")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "device_token", length = 512)
    private String deviceToken;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static User create(String email, String name) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }
        LocalDateTime now = LocalDateTime.now();
        return User.builder()
                .email(email)
                .name(name)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 디바이스 토큰 등록 (공백이면 토큰 해제)
     */
    public void registerDeviceToken(String token) {
        this.deviceToken = (token == null || token.isBlank()) ? null : token.trim();
        this.updatedAt = LocalDateTime.now();
    }

    public boolean hasDeviceToken() {
        return deviceToken != null && !deviceToken.isBlank();
    }
}
