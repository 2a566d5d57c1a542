package com.storefront.commerce.infrastructure.constants;

/**
 * RetryConstants - 재시도 로직 설정 상수
 *
 * 역할:
 * - 외부 푸시 발송 재시도 횟수, 초기 딜레이, 지수 백오프 배수 통일
 * - @Retryable 속성은 컴파일 타임 상수여야 하므로 여기서 관리
 *
 * 사용 예:
 * - @Retryable(maxAttempts = RetryConstants.PUSH_MAX_ATTEMPTS, ...)
 */
public class RetryConstants {

    // ========== Push Delivery Retry Constants ==========

    /** 푸시 발송 최대 시도 횟수 (최초 1회 포함) */
    public static final int PUSH_MAX_ATTEMPTS = 3;

    /** 푸시 발송 재시도 초기 딜레이 (밀리초) */
    public static final long PUSH_INITIAL_DELAY_MS = 200L;

    /** 푸시 발송 재시도 지수 백오프 배수 (2배 증가) */
    public static final double PUSH_BACKOFF_MULTIPLIER = 2.0;

    /** 푸시 발송 재시도 최대 딜레이 (밀리초) */
    public static final long PUSH_MAX_DELAY_MS = 2000L;

    /*
     * 재시도 횟수 | 딜레이
     * =====================
     * 1회차 실패  | 200ms 전후 (random jitter)
     * 2회차 실패  | 400ms 전후
     * 3회차 실패  | @Recover 호출 (RECONCILE 로그)
     */

    private RetryConstants() {
        throw new AssertionError("RetryConstants는 인스턴스화할 수 없습니다");
    }
}
