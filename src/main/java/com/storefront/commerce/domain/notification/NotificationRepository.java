package com.storefront.commerce.domain.notification;

import java.util.List;
import java.util.Optional;

/**
 * Notification Repository Interface (Domain Layer - Port)
 */
public interface NotificationRepository {

    Notification save(Notification notification);

    Optional<Notification> findByIdAndUserId(Long notificationId, Long userId);

    /**
     * 조건에 맞는 알림 목록 (최신순, page는 0부터)
     */
    List<Notification> findByUserId(Long userId, NotificationSearchCondition condition, int page, int size);

    long countByUserId(Long userId, NotificationSearchCondition condition);

    /**
     * 필터와 무관한 사용자의 전체 미읽음 개수
     */
    long countUnread(Long userId);

    /**
     * 사용자의 미읽음 알림을 모두 읽음 처리
     *
     * @return 변경된 알림 수
     */
    int markAllAsRead(Long userId);

    void delete(Notification notification);
}
