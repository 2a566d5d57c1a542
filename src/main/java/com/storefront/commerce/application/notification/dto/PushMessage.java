package com.storefront.commerce.application.notification.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * 푸시 발송 요청 (디바이스 토큰 1개 대상)
 */
@Getter
@AllArgsConstructor
public class PushMessage {
    private final String token;
    private final String title;
    private final String body;
    private final Map<String, String> data;
}
