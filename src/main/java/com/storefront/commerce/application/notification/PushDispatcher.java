package com.storefront.commerce.application.notification;

import com.storefront.commerce.application.notification.dto.PushMessage;
import com.storefront.commerce.infrastructure.constants.RetryConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

/**
 * PushDispatcher - 푸시 발송 재시도 래퍼
 *
 * 역할:
 * - PushGateway 호출을 감싸고 PushDeliveryException에 대해서만 재시도
 * - 재시도 초과 시 @Recover에서 RECONCILE 로그를 남기고 종료 (예외 미전파)
 *
 * 재시도 정책:
 * - maxAttempts=3 (최초 호출 포함)
 * - Exponential Backoff with Jitter: 200ms → 400ms (최대 2000ms)
 *
 * NotificationSink와 다른 빈으로 분리하여 @Retryable 프록시가 적용되도록 한다.
 */
@Slf4j
@Component
public class PushDispatcher {

    private final PushGateway pushGateway;

    public PushDispatcher(PushGateway pushGateway) {
        this.pushGateway = pushGateway;
    }

    @Retryable(
        retryFor = PushDeliveryException.class,
        maxAttempts = RetryConstants.PUSH_MAX_ATTEMPTS,
        backoff = @Backoff(
            delay = RetryConstants.PUSH_INITIAL_DELAY_MS,
            multiplier = RetryConstants.PUSH_BACKOFF_MULTIPLIER,
            maxDelay = RetryConstants.PUSH_MAX_DELAY_MS,
            random = true
        )
    )
    public void dispatch(PushMessage message) {
        log.debug("[PushDispatcher] 푸시 발송 시도 - title={}", message.getTitle());
        pushGateway.send(message);
        log.info("[PushDispatcher] 푸시 발송 완료 - title={}", message.getTitle());
    }

    /**
     * 재시도 초과 복구 메서드
     *
     * 푸시는 best-effort이므로 알림 행은 그대로 두고 로그만 남긴다.
     */
    @Recover
    public void recover(PushDeliveryException e, PushMessage message) {
        log.error("[PushDispatcher] RECONCILE 푸시 발송 최종 실패 - title={}, data={}, attempts={}, reason={}",
                message.getTitle(), message.getData(), RetryConstants.PUSH_MAX_ATTEMPTS, e.getMessage());
    }
}
