package com.storefront.commerce.presentation.common;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 목록 조회 기간 파라미터(yyyy-MM-dd) → 조회 조건 변환
 *
 * startDate는 해당 일 00:00:00부터, endDate는 해당 일 23:59:59.999999999까지 포함한다.
 */
public final class RequestDates {

    private RequestDates() {
        throw new AssertionError("RequestDates는 인스턴스화할 수 없습니다");
    }

    public static LocalDateTime startOfDay(LocalDate date) {
        return date != null ? date.atStartOfDay() : null;
    }

    public static LocalDateTime endOfDay(LocalDate date) {
        return date != null ? date.atTime(LocalTime.MAX) : null;
    }
}
