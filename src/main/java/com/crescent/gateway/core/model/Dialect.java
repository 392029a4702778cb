package com.crescent.gateway.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 网关支持的 API 方言
 * <p>
 * 同一枚举同时描述客户端入站协议与上游模型服务的协议。
 */
public enum Dialect {

    CHAT_COMPLETIONS("chat_completions", "/v1/chat/completions"),
    RESPONSES("responses", "/v1/responses"),
    EMBEDDINGS("embeddings", "/v1/embeddings"),
    IMAGES("images", "/v1/images/generations");

    private final String code;
    private final String path;

    Dialect(String code, String path) {
        this.code = code;
        this.path = path;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getPath() {
        return path;
    }

    /**
     * 是否为文本生成类方言（Chat-Completions / Responses 可以互相转换）
     */
    public boolean isTextGeneration() {
        return this == CHAT_COMPLETIONS || this == RESPONSES;
    }

    /**
     * 判断当前客户端方言能否由指定方言的上游服务承载
     */
    public boolean isServableBy(Dialect providerDialect) {
        if (providerDialect == null) {
            return false;
        }
        if (isTextGeneration()) {
            return providerDialect.isTextGeneration();
        }
        return this == providerDialect;
    }

    @JsonCreator
    public static Dialect fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace('-', '_');
        for (Dialect dialect : values()) {
            if (dialect.code.equalsIgnoreCase(normalized) || dialect.name().equalsIgnoreCase(normalized)) {
                return dialect;
            }
        }
        if ("chat".equalsIgnoreCase(normalized)) {
            return CHAT_COMPLETIONS;
        }
        throw new IllegalArgumentException("Unknown dialect: " + value);
    }
}
