package com.crescent.gateway.core.error;

import org.springframework.http.HttpStatus;

/**
 * 网关错误分类，决定对外的 HTTP 状态码与 OpenAI 错误类型
 */
public enum GatewayErrorKind {

    BAD_REQUEST(HttpStatus.BAD_REQUEST, "invalid_request_error", "invalid_request"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "authentication_error", "invalid_api_key"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "invalid_request_error", "model_not_found"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "rate_limit_error", "rate_limit_exceeded"),
    UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY, "api_error", "upstream_error"),
    UPSTREAM_INTERRUPTED(HttpStatus.BAD_GATEWAY, "api_error", "upstream_interrupted"),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "timeout_error", "timeout"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", "internal_error");

    private final HttpStatus status;
    private final String type;
    private final String defaultCode;

    GatewayErrorKind(HttpStatus status, String type, String defaultCode) {
        this.status = status;
        this.type = type;
        this.defaultCode = defaultCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getType() {
        return type;
    }

    public String getDefaultCode() {
        return defaultCode;
    }
}
