package com.crescent.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

/**
 * 分发结果：同步调用为 JSON 响应体，流式调用为 SSE 帧流
 */
@Getter
public final class DispatchResult {

    private final JsonNode body;
    private final Flux<ServerSentEvent<String>> stream;

    private DispatchResult(JsonNode body, Flux<ServerSentEvent<String>> stream) {
        this.body = body;
        this.stream = stream;
    }

    public static DispatchResult of(JsonNode body) {
        return new DispatchResult(body, null);
    }

    public static DispatchResult stream(Flux<ServerSentEvent<String>> stream) {
        return new DispatchResult(null, stream);
    }

    public boolean isStream() {
        return stream != null;
    }
}
