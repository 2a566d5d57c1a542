package com.storefront.commerce.infrastructure.persistence.notification;

import com.storefront.commerce.domain.notification.Notification;
import com.storefront.commerce.domain.notification.NotificationRepository;
import com.storefront.commerce.domain.notification.NotificationSearchCondition;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Notification Repository 구현
 */
@Repository
@Primary
public class MySQLNotificationRepository implements NotificationRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
            .and(Sort.by(Sort.Direction.DESC, "notificationId"));

    private final NotificationJpaRepository notificationJpaRepository;

    public MySQLNotificationRepository(NotificationJpaRepository notificationJpaRepository) {
        this.notificationJpaRepository = notificationJpaRepository;
    }

    @Override
    public Notification save(Notification notification) {
        return notificationJpaRepository.save(notification);
    }

    @Override
    public Optional<Notification> findByIdAndUserId(Long notificationId, Long userId) {
        return notificationJpaRepository.findByNotificationIdAndUserId(notificationId, userId);
    }

    @Override
    public List<Notification> findByUserId(Long userId, NotificationSearchCondition condition, int page, int size) {
        return notificationJpaRepository.search(
                userId,
                condition.isUnreadOnly(),
                condition.getType(),
                condition.getStartDate(),
                condition.getEndDate(),
                PageRequest.of(page, size, NEWEST_FIRST));
    }

    @Override
    public long countByUserId(Long userId, NotificationSearchCondition condition) {
        return notificationJpaRepository.countSearch(
                userId,
                condition.isUnreadOnly(),
                condition.getType(),
                condition.getStartDate(),
                condition.getEndDate());
    }

    @Override
    public long countUnread(Long userId) {
        return notificationJpaRepository.countByUserIdAndReadFalse(userId);
    }

    @Override
    public int markAllAsRead(Long userId) {
        return notificationJpaRepository.markAllAsRead(userId, LocalDateTime.now());
    }

    @Override
    public void delete(Notification notification) {
        notificationJpaRepository.delete(notification);
    }
}
