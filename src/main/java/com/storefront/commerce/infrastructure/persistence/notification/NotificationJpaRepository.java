package com.storefront.commerce.infrastructure.persistence.notification;

import com.storefront.commerce.domain.notification.Notification;
import com.storefront.commerce.domain.notification.NotificationType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Notification JPA Repository
 */
public interface NotificationJpaRepository extends JpaRepository<Notification, Long> {

    Optional<Notification> findByNotificationIdAndUserId(Long notificationId, Long userId);

    @Query("SELECT n FROM Notification n " +
           "WHERE n.userId = :userId " +
           "AND (:unreadOnly = false OR n.read = false) " +
           "AND (:type IS NULL OR n.type = :type) " +
           "AND (:startDate IS NULL OR n.createdAt >= :startDate) " +
           "AND (:endDate IS NULL OR n.createdAt <= :endDate)")
    List<Notification> search(@Param("userId") Long userId,
                              @Param("unreadOnly") boolean unreadOnly,
                              @Param("type") NotificationType type,
                              @Param("startDate") LocalDateTime startDate,
                              @Param("endDate") LocalDateTime endDate,
                              Pageable pageable);

    @Query("SELECT COUNT(n) FROM Notification n " +
           "WHERE n.userId = :userId " +
           "AND (:unreadOnly = false OR n.read = false) " +
           "AND (:type IS NULL OR n.type = :type) " +
           "AND (:startDate IS NULL OR n.createdAt >= :startDate) " +
           "AND (:endDate IS NULL OR n.createdAt <= :endDate)")
    long countSearch(@Param("userId") Long userId,
                     @Param("unreadOnly") boolean unreadOnly,
                     @Param("type") NotificationType type,
                     @Param("startDate") LocalDateTime startDate,
                     @Param("endDate") LocalDateTime endDate);

    long countByUserIdAndReadFalse(Long userId);

    /**
     * 미읽음 알림 일괄 읽음 처리 (벌크 UPDATE)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Notification n SET n.read = true, n.updatedAt = :now " +
           "WHERE n.userId = :userId AND n.read = false")
    int markAllAsRead(@Param("userId") Long userId, @Param("now") LocalDateTime now);
}
