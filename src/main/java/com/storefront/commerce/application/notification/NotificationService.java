package com.storefront.commerce.application.notification;

import com.storefront.commerce.application.notification.dto.NotificationListResult;
import com.storefront.commerce.application.notification.dto.NotificationResult;
import com.storefront.commerce.common.exception.InvalidRequestException;
import com.storefront.commerce.domain.notification.Notification;
import com.storefront.commerce.domain.notification.NotificationConstants;
import com.storefront.commerce.domain.notification.NotificationNotFoundException;
import com.storefront.commerce.domain.notification.NotificationRepository;
import com.storefront.commerce.domain.notification.NotificationSearchCondition;
import com.storefront.commerce.domain.notification.NotificationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * NotificationService - 사용자 알림 조회/변경 유스케이스
 *
 * 모든 변경 연산은 요청자 소유의 알림에만 적용되며,
 * 다른 사용자의 알림은 존재하지 않는 것처럼 404로 응답한다.
 */
@Slf4j
@Service
public class NotificationService {

    private static final int MAX_PAGE_SIZE = 100;

    private final NotificationRepository notificationRepository;

    public NotificationService(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    /**
     * 알림 목록 조회 (최신순)
     *
     * @param typeRaw null이면 전체 유형
     * @param page 1부터 시작 (null이면 1)
     * @param limit null이면 10
     */
    @Transactional(readOnly = true)
    public NotificationListResult getNotifications(Long userId, boolean unreadOnly, String typeRaw,
                                                   LocalDateTime startDate, LocalDateTime endDate,
                                                   Integer page, Integer limit) {
        int pageNumber = page != null ? page : 1;
        int pageSize = limit != null ? limit : NotificationConstants.DEFAULT_PAGE_SIZE;
        if (pageNumber < 1) {
            throw new InvalidRequestException("page는 1 이상이어야 합니다");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new InvalidRequestException("limit는 1 이상 " + MAX_PAGE_SIZE + " 이하여야 합니다");
        }

        NotificationSearchCondition condition = NotificationSearchCondition.builder()
                .unreadOnly(unreadOnly)
                .type(typeRaw == null || typeRaw.isBlank() ? null : NotificationType.fromString(typeRaw))
                .startDate(startDate)
                .endDate(endDate)
                .build();

        List<NotificationResult> notifications = notificationRepository
                .findByUserId(userId, condition, pageNumber - 1, pageSize)
                .stream()
                .map(NotificationResult::from)
                .collect(Collectors.toList());
        long total = notificationRepository.countByUserId(userId, condition);
        long unreadCount = notificationRepository.countUnread(userId);

        return NotificationListResult.builder()
                .notifications(notifications)
                .page(pageNumber)
                .limit(pageSize)
                .total(total)
                .pages((int) Math.ceil((double) total / pageSize))
                .unreadCount(unreadCount)
                .build();
    }

    /**
     * 알림 읽음 처리
     *
     * @throws NotificationNotFoundException 알림이 없거나 요청자 소유가 아님
     */
    @Transactional
    public NotificationResult markAsRead(Long userId, Long notificationId) {
        Notification notification = findOwned(userId, notificationId);
        notification.markAsRead();
        return NotificationResult.from(notification);
    }

    /**
     * 전체 읽음 처리
     *
     * @return 읽음 처리된 알림 수
     */
    @Transactional
    public int markAllAsRead(Long userId) {
        int updated = notificationRepository.markAllAsRead(userId);
        log.info("[NotificationService] 전체 읽음 처리 - userId={}, updated={}", userId, updated);
        return updated;
    }

    @Transactional
    public void deleteNotification(Long userId, Long notificationId) {
        Notification notification = findOwned(userId, notificationId);
        notificationRepository.delete(notification);
        log.info("[NotificationService] 알림 삭제 - userId={}, notificationId={}", userId, notificationId);
    }

    private Notification findOwned(Long userId, Long notificationId) {
        return notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));
    }
}
