package com.crescent.gateway.web;

import com.crescent.gateway.api.ErrorResponse;
import com.crescent.gateway.core.auth.CredentialValidator;
import com.crescent.gateway.core.error.GatewayException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * /v1/** 接口的 Bearer 凭证校验
 * <p>
 * 凭证本身对网关不透明，是否放行由 {@link CredentialValidator} 决定；
 * 通过后把凭证与租户存入请求属性，供限流与配额使用。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class BearerAuthenticationFilter implements WebFilter {

    public static final String CREDENTIAL_ATTRIBUTE = "crescent.gateway.credential";
    public static final String TENANT_ATTRIBUTE = "crescent.gateway.tenant";

    private static final String PROTECTED_PREFIX = "/v1/";
    private static final String BEARER_PREFIX = "bearer ";

    private final CredentialValidator credentialValidator;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!path.startsWith(PROTECTED_PREFIX)) {
            return chain.filter(exchange);
        }
        String credential = extractCredential(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        return credentialValidator.authenticate(credential)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(tenant -> {
                    if (tenant.isEmpty()) {
                        log.debug("Rejected request to {}: invalid credential", path);
                        return reject(exchange.getResponse(), credential == null
                                ? "Missing bearer credential in Authorization header"
                                : "Invalid API key provided");
                    }
                    if (credential != null) {
                        exchange.getAttributes().put(CREDENTIAL_ATTRIBUTE, credential);
                    }
                    exchange.getAttributes().put(TENANT_ATTRIBUTE, tenant.get());
                    return chain.filter(exchange);
                });
    }

    static String extractCredential(String authorization) {
        if (authorization == null || authorization.length() <= BEARER_PREFIX.length()
                || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String credential = authorization.substring(BEARER_PREFIX.length()).trim();
        return credential.isEmpty() ? null : credential;
    }

    private Mono<Void> reject(ServerHttpResponse response, String message) {
        GatewayException error = GatewayException.unauthorized(message);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ErrorResponse.of(error));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        response.setStatusCode(error.getKind().getStatus());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }
}
