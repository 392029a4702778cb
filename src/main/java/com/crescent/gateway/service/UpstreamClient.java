package com.crescent.gateway.service;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.ModelRoute;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.timeout.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 上游 HTTP 调用
 * <p>
 * 每次调用只尝试一次，不做自动重试。上游非 2xx 响应转换为 UPSTREAM_ERROR，
 * 错误信息保留上游状态码和上游 error.message。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpstreamClient {

    private static final int MAX_ERROR_DETAIL = 500;

    private final UpstreamWebClientManager webClientManager;
    private final ObjectMapper objectMapper;

    /**
     * 同步调用，返回完整 JSON 响应体
     */
    public Mono<JsonNode> exchange(ModelRoute route, JsonNode payload, DispatchContext context) {
        return webClientManager.getWebClient(route)
                .post()
                .uri(route.getEndpointUrl())
                .headers(headers -> applyHeaders(headers, route, context))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toUpstreamError(route, response))
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> GatewayException.upstream(
                        "Upstream " + route.getProviderId() + " returned an empty body")))
                .onErrorMap(e -> !(e instanceof GatewayException), e -> mapTransportError(route, e));
    }

    /**
     * 流式调用，返回上游原始 SSE 数据（由 StreamingProxy 解析）
     */
    public Flux<String> stream(ModelRoute route, JsonNode payload, DispatchContext context) {
        return webClientManager.getWebClient(route)
                .post()
                .uri(route.getEndpointUrl())
                .headers(headers -> applyHeaders(headers, route, context))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toUpstreamError(route, response))
                .bodyToFlux(String.class)
                .onErrorMap(e -> !(e instanceof GatewayException)
                        && (e instanceof WebClientRequestException || e instanceof DecodingException),
                        e -> mapTransportError(route, e));
    }

    private static void applyHeaders(HttpHeaders headers, ModelRoute route, DispatchContext context) {
        if (route.getApiKey() != null && !route.getApiKey().isBlank()) {
            headers.setBearerAuth(route.getApiKey());
            if ("azure".equalsIgnoreCase(route.getProviderId())) {
                headers.set("api-key", route.getApiKey());
            }
        }
        if (context.getRequestId() != null) {
            headers.set("X-Request-Id", context.getRequestId());
        }
    }

    private Mono<Throwable> toUpstreamError(ModelRoute route, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    String detail = extractErrorMessage(body);
                    log.warn("Upstream {} ({}) returned HTTP {}: {}", route.getProviderId(), route.getModelName(),
                            status, detail);
                    return (Throwable) GatewayException.upstream("Upstream " + route.getProviderId()
                            + " returned HTTP " + status + (detail.isEmpty() ? "" : ": " + detail));
                });
    }

    /**
     * 优先取 OpenAI 风格的 error.message，否则截断原始响应体
     */
    String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode message = root.path("error").path("message");
            if (message.isTextual()) {
                return message.asText();
            }
            if (root.path("error").isTextual()) {
                return root.get("error").asText();
            }
            if (root.path("message").isTextual()) {
                return root.get("message").asText();
            }
        } catch (Exception e) {
            log.debug("Upstream error body is not JSON: {}", e.getMessage());
        }
        String trimmed = body.strip();
        return trimmed.length() > MAX_ERROR_DETAIL ? trimmed.substring(0, MAX_ERROR_DETAIL) + "..." : trimmed;
    }

    private static Throwable mapTransportError(ModelRoute route, Throwable error) {
        if (error instanceof WebClientRequestException) {
            Throwable cause = error.getCause();
            if (cause instanceof TimeoutException) {
                return GatewayException.timeout("Upstream " + route.getProviderId() + " read timed out");
            }
            log.error("Failed to reach upstream {} at {}", route.getProviderId(), route.getEndpointUrl(), error);
            return GatewayException.upstream("Failed to reach upstream " + route.getProviderId(), error);
        }
        if (error instanceof DecodingException) {
            return GatewayException.upstream("Upstream " + route.getProviderId() + " returned an invalid body", error);
        }
        return error;
    }
}
