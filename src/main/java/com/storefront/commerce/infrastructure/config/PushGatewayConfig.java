package com.storefront.commerce.infrastructure.config;

import com.storefront.commerce.application.notification.PushGateway;
import com.storefront.commerce.infrastructure.external.push.DisabledPushGateway;
import com.storefront.commerce.infrastructure.external.push.HttpPushGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * PushGatewayConfig - 푸시 게이트웨이 빈 선택
 *
 * 선택 규칙:
 * - commerce.push.enabled=true 이고 endpoint, credential이 모두 있으면 HttpPushGateway
 * - 그 외에는 DisabledPushGateway
 */
@Slf4j
@Configuration
public class PushGatewayConfig {

    @Bean
    public PushGateway pushGateway(RestTemplateBuilder restTemplateBuilder,
                                   @Value("${commerce.push.enabled:false}") boolean enabled,
                                   @Value("${commerce.push.endpoint:}") String endpoint,
                                   @Value("${commerce.push.credential:}") String credential,
                                   @Value("${commerce.push.connect-timeout-ms:2000}") long connectTimeoutMs,
                                   @Value("${commerce.push.read-timeout-ms:3000}") long readTimeoutMs) {
        if (!enabled || endpoint.isBlank() || credential.isBlank()) {
            log.info("[PushGatewayConfig] 푸시 게이트웨이 비활성화 - enabled={}, endpointConfigured={}, credentialConfigured={}",
                    enabled, !endpoint.isBlank(), !credential.isBlank());
            return new DisabledPushGateway();
        }

        log.info("[PushGatewayConfig] HTTP 푸시 게이트웨이 사용 - endpoint={}, connectTimeoutMs={}, readTimeoutMs={}",
                endpoint, connectTimeoutMs, readTimeoutMs);
        return new HttpPushGateway(
                restTemplateBuilder
                        .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                        .readTimeout(Duration.ofMillis(readTimeoutMs))
                        .build(),
                endpoint,
                credential);
    }
}
