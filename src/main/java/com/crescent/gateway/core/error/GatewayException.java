package com.crescent.gateway.core.error;

import lombok.Getter;

import java.util.concurrent.TimeoutException;

/**
 * 网关统一异常
 * <p>
 * 任何阶段抛出的错误最终都会转换成该异常，再由 GlobalExceptionHandler
 * 或流式编码器渲染为 {@code {error: {message, type, code}}} 信封。
 * message 面向客户端，内部异常只保留在 cause 中用于日志。
 */
@Getter
public class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;
    private final String code;
    private final String param;

    public GatewayException(GatewayErrorKind kind, String message) {
        this(kind, message, kind.getDefaultCode(), null, null);
    }

    public GatewayException(GatewayErrorKind kind, String message, String code, String param, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code == null ? kind.getDefaultCode() : code;
        this.param = param;
    }

    public static GatewayException badRequest(String message) {
        return new GatewayException(GatewayErrorKind.BAD_REQUEST, message);
    }

    public static GatewayException badRequest(String message, String param) {
        return new GatewayException(GatewayErrorKind.BAD_REQUEST, message, null, param, null);
    }

    public static GatewayException unsupportedModel(String message) {
        return new GatewayException(GatewayErrorKind.BAD_REQUEST, message, "model_not_supported", "model", null);
    }

    public static GatewayException notFound(String model) {
        return new GatewayException(GatewayErrorKind.NOT_FOUND,
                "The model '" + model + "' does not exist", null, "model", null);
    }

    public static GatewayException unauthorized(String message) {
        return new GatewayException(GatewayErrorKind.UNAUTHORIZED, message);
    }

    public static GatewayException rateLimited(String message) {
        return new GatewayException(GatewayErrorKind.RATE_LIMITED, message);
    }

    public static GatewayException quotaExceeded(String message) {
        return new GatewayException(GatewayErrorKind.RATE_LIMITED, message, "insufficient_quota", null, null);
    }

    public static GatewayException upstream(String message) {
        return new GatewayException(GatewayErrorKind.UPSTREAM_ERROR, message);
    }

    public static GatewayException upstream(String message, Throwable cause) {
        return new GatewayException(GatewayErrorKind.UPSTREAM_ERROR, message, null, null, cause);
    }

    public static GatewayException interrupted(String message, Throwable cause) {
        return new GatewayException(GatewayErrorKind.UPSTREAM_INTERRUPTED, message, null, null, cause);
    }

    public static GatewayException timeout(String message) {
        return new GatewayException(GatewayErrorKind.TIMEOUT, message);
    }

    public static GatewayException internal(Throwable cause) {
        return new GatewayException(GatewayErrorKind.INTERNAL_ERROR,
                "The gateway failed to process the request", null, null, cause);
    }

    /**
     * 把任意异常归一为 GatewayException，内部错误的原始信息不会外泄
     */
    public static GatewayException from(Throwable error) {
        if (error instanceof GatewayException) {
            return (GatewayException) error;
        }
        if (error instanceof TimeoutException) {
            return timeout("Upstream request timed out");
        }
        return internal(error);
    }

    /**
     * 复制为带有额外上下文的新异常，保留分类与错误码
     */
    public GatewayException withContext(String prefix, String param) {
        return new GatewayException(kind, prefix + ": " + getMessage(), code,
                param != null ? param : this.param, this);
    }
}
