package com.crescent.gateway.core.stream;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.converter.ConverterFactory;
import com.crescent.gateway.core.converter.ResponseConverter;
import com.crescent.gateway.core.dialect.StreamEncoder;
import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.core.model.StreamEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 流式代理
 * <p>
 * 把上游 SSE 字节流逐条转换为客户端方言的 SSE 帧：
 * <ol>
 *   <li>上游数据按到达顺序转发，不引入重排缓冲；上游与客户端之间的预取量受 buffer-size 限制</li>
 *   <li>首字节等待受调用方超时约束，之后相邻两块数据的间隔受 idle-timeout 约束</li>
 *   <li>任何错误都以带内错误帧结束，随后写出 [DONE]，不会直接断开连接</li>
 *   <li>[DONE] 在每个流上恰好写出一次，即使上游没有发送</li>
 *   <li>客户端断开时取消订阅，上游请求随之取消</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamingProxy {

    private static final ServerSentEvent<String> DONE_FRAME =
            ServerSentEvent.<String>builder().data(UpstreamSseParser.DONE).build();

    private final ConverterFactory converterFactory;
    private final UpstreamSseParser sseParser;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;

    /**
     * 代理一次流式调用
     *
     * @param upstream         上游原始数据流（尚未订阅）
     * @param route            目标模型路由
     * @param encoder          本次调用的客户端方言编码器
     * @param firstByteTimeout 等待上游首字节的最长时间
     * @param listener         结束回调
     * @return 客户端 SSE 帧流，总是以 [DONE] 结束
     */
    public Flux<ServerSentEvent<String>> proxy(Flux<String> upstream,
                                               ModelRoute route,
                                               StreamEncoder encoder,
                                               Duration firstByteTimeout,
                                               StreamListener listener) {
        ResponseConverter converter = converterFactory.getResponseConverter(route);
        Duration idleTimeout = properties.getStream().getIdleTimeout();
        int bufferSize = Math.max(1, properties.getStream().getBufferSize());

        AtomicReference<StreamState> state = new AtomicReference<>(StreamState.CONNECTING);
        AtomicInteger emitted = new AtomicInteger();
        AtomicBoolean failed = new AtomicBoolean(false);
        AtomicBoolean doneWritten = new AtomicBoolean(false);

        Flux<ServerSentEvent<String>> body = upstream
                .timeout(Mono.delay(firstByteTimeout), chunk -> Mono.delay(idleTimeout))
                .doOnNext(chunk -> state.compareAndSet(StreamState.CONNECTING, StreamState.OPENED))
                .limitRate(bufferSize)
                .concatMapIterable(sseParser::parse)
                .takeUntil(UpstreamSseParser.DONE::equals)
                .filter(payload -> !UpstreamSseParser.DONE.equals(payload))
                .concatMapIterable(payload -> toEvents(route, converter, payload))
                .concatMap(event -> StreamEvent.ERROR.equals(event.getType())
                        ? Flux.<StreamEvent>error(upstreamError(route, event))
                        : Flux.just(event))
                .concatMapIterable(encoder::encode)
                .doOnNext(frame -> {
                    state.set(StreamState.EMITTING);
                    emitted.incrementAndGet();
                });

        return Flux.defer(() -> Flux.fromIterable(encoder.begin()))
                .concatWith(body)
                .concatWith(Flux.defer(() -> Flux.fromIterable(encoder.complete())))
                .onErrorResume(e -> {
                    GatewayException error = mapError(e, state.get(), firstByteTimeout, idleTimeout);
                    failed.set(true);
                    logFailure(route, error);
                    listener.onFailure(error);
                    return Flux.fromIterable(encoder.fail(error));
                })
                .concatWith(Flux.defer(() -> doneWritten.compareAndSet(false, true)
                        ? Flux.just(DONE_FRAME)
                        : Flux.empty()))
                .doOnComplete(() -> {
                    if (!failed.get()) {
                        listener.onComplete(emitted.get());
                    }
                })
                .doFinally(signal -> {
                    state.set(StreamState.CLOSED);
                    if (signal == SignalType.CANCEL) {
                        log.debug("Stream to {} cancelled by client after {} frame(s)", route.getModelName(), emitted.get());
                        listener.onCancel();
                    }
                });
    }

    private List<StreamEvent> toEvents(ModelRoute route, ResponseConverter converter, String payload) {
        JsonNode chunk;
        try {
            chunk = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparsable SSE data from {}: {}", route.getProviderId(), e.getOriginalMessage());
            return Collections.emptyList();
        }
        return converter.convertChunk(route, chunk);
    }

    private static GatewayException upstreamError(ModelRoute route, StreamEvent event) {
        String message = event.getPayload().path("message").asText("Upstream stream error");
        String code = event.getPayload().path("code").isTextual() ? event.getPayload().get("code").asText() : null;
        return new GatewayException(GatewayErrorKind.UPSTREAM_ERROR,
                "Upstream " + route.getProviderId() + " reported an error: " + message, code, null, null);
    }

    /**
     * 错误归类：已有分类保持不变；超时区分首字节与空闲；其它异常按是否已收到上游数据区分
     */
    static GatewayException mapError(Throwable error, StreamState state, Duration firstByteTimeout, Duration idleTimeout) {
        if (error instanceof GatewayException) {
            return (GatewayException) error;
        }
        if (error instanceof TimeoutException) {
            if (state.hasReceivedData()) {
                return GatewayException.timeout("Upstream stream was idle for more than " + idleTimeout.toMillis() + "ms");
            }
            return GatewayException.timeout("Upstream did not respond within " + firstByteTimeout.toMillis() + "ms");
        }
        if (state.hasReceivedData()) {
            return GatewayException.interrupted("Upstream stream was interrupted", error);
        }
        return GatewayException.upstream("Upstream stream failed before the first byte", error);
    }

    private static void logFailure(ModelRoute route, GatewayException error) {
        if (error.getKind() == GatewayErrorKind.UPSTREAM_INTERRUPTED || error.getKind() == GatewayErrorKind.INTERNAL_ERROR) {
            log.error("Stream to {} ({}) failed: {}", route.getModelName(), route.getProviderId(), error.getMessage(),
                    error.getCause());
        } else {
            log.warn("Stream to {} ({}) failed: {}", route.getModelName(), route.getProviderId(), error.getMessage());
        }
    }
}
