package com.crescent.gateway.web;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.auth.CredentialValidator;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.service.DispatchContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;

import java.time.Duration;
import java.util.UUID;

/**
 * 从入站请求中提取分发上下文
 * <p>
 * 调用方可以用 X-Request-Timeout-Ms 缩短超时，但不能超过 gateway.request-timeout。
 */
@Component
@RequiredArgsConstructor
public class DispatchContextResolver {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String TIMEOUT_HEADER = "X-Request-Timeout-Ms";

    private final GatewayProperties properties;

    public DispatchContext resolve(ServerWebExchange exchange) {
        String requestId = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = "req_" + UUID.randomUUID().toString().replace("-", "");
        }
        String tenantId = exchange.getAttribute(BearerAuthenticationFilter.TENANT_ATTRIBUTE);
        return DispatchContext.builder()
                .requestId(requestId)
                .credential(exchange.getAttribute(BearerAuthenticationFilter.CREDENTIAL_ATTRIBUTE))
                .tenantId(tenantId == null ? CredentialValidator.ANONYMOUS_TENANT : tenantId)
                .timeout(resolveTimeout(exchange.getRequest().getHeaders().getFirst(TIMEOUT_HEADER)))
                .build();
    }

    Duration resolveTimeout(String header) {
        Duration max = properties.getRequestTimeout();
        if (header == null || header.isBlank()) {
            return max;
        }
        long millis;
        try {
            millis = Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            throw GatewayException.badRequest(TIMEOUT_HEADER + " must be a positive integer", TIMEOUT_HEADER);
        }
        if (millis <= 0) {
            throw GatewayException.badRequest(TIMEOUT_HEADER + " must be a positive integer", TIMEOUT_HEADER);
        }
        Duration requested = Duration.ofMillis(millis);
        return requested.compareTo(max) < 0 ? requested : max;
    }
}
