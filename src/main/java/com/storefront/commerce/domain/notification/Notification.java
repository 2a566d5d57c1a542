package com.storefront.commerce.domain.notification;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification 도메인 엔티티 (인앱 알림)
 *
 * 핵심 비즈니스 규칙:
 * - 생성 시 isRead = false
 * - 생성 이후에는 읽음 여부만 변경 가능
 * - data는 자유 형식 문자열 맵 (JSON 텍스트로 저장)
 */
@Entity
@Table(name = "notifications", indexes = {
    @Index(name = "idx_notifications_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_notifications_user_read", columnList = "user_id, is_read")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "notification_id")
    private Long notificationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "title", nullable = false, updatable = false)
    private String title;

    @Column(name = "message", nullable = false, updatable = false, length = 1000)
    private String message;

    @Column(name = "type", nullable = false, updatable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private NotificationType type;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Convert(converter = NotificationDataConverter.class)
    @Column(name = "data", columnDefinition = "TEXT", updatable = false)
    @Builder.Default
    private Map<String, String> data = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 알림 생성 팩토리 메서드
     *
     * @param type null이면 OTHER
     * @param data null이면 빈 맵
     */
    public static Notification create(Long userId, String title, String message,
                                      NotificationType type, Map<String, String> data) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("알림 제목은 필수입니다");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("알림 내용은 필수입니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return Notification.builder()
                .userId(userId)
                .title(title)
                .message(message)
                .type(type != null ? type : NotificationType.OTHER)
                .read(false)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void markAsRead() {
        if (!this.read) {
            this.read = true;
            this.updatedAt = LocalDateTime.now();
        }
    }
}
