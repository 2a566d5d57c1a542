package com.storefront.commerce.infrastructure.external.push;

import com.storefront.commerce.application.notification.PushDeliveryException;
import com.storefront.commerce.application.notification.PushGateway;
import com.storefront.commerce.application.notification.dto.PushMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HttpPushGateway - HTTP 기반 푸시 제공자 연동 클라이언트
 *
 * 역할:
 * - 디바이스 토큰 1개 대상 메시지를 푸시 제공자 send API로 전송
 * - 연결/읽기 타임아웃은 RestTemplate 생성 시 고정 (PushGatewayConfig)
 *
 * 요청 형식 (FCM HTTP v1 호환):
 * {
 *   "message": {
 *     "token": "...",
 *     "notification": { "title": "...", "body": "..." },
 *     "data": { "orderId": "1", ... }
 *   }
 * }
 *
 * 실패 처리:
 * - 전송 오류, 타임아웃, 4xx/5xx 응답은 모두 PushDeliveryException으로 변환 (PushDispatcher가 재시도)
 */
@Slf4j
public class HttpPushGateway implements PushGateway {

    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String credential;

    public HttpPushGateway(RestTemplate restTemplate, String endpoint, String credential) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
        this.credential = credential;
    }

    @Override
    public void send(PushMessage message) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(credential);

        try {
            restTemplate.postForObject(endpoint, new HttpEntity<>(toPayload(message), headers), String.class);
            log.debug("[HttpPushGateway] 푸시 전송 성공 - endpoint={}, title={}", endpoint, message.getTitle());
        } catch (RestClientException e) {
            log.warn("[HttpPushGateway] 푸시 전송 실패 - endpoint={}, error={}", endpoint, e.getMessage());
            throw new PushDeliveryException("endpoint=" + endpoint, e);
        }
    }

    private Map<String, Object> toPayload(PushMessage message) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("title", message.getTitle());
        notification.put("body", message.getBody());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", message.getToken());
        body.put("notification", notification);
        body.put("data", message.getData() != null ? message.getData() : Map.of());

        return Map.of("message", body);
    }
}
