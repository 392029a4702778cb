package com.crescent.gateway.service;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.batch.EmbeddingBatch;
import com.crescent.gateway.core.batch.EmbeddingBatchCoordinator;
import com.crescent.gateway.core.converter.ConverterFactory;
import com.crescent.gateway.core.converter.RequestConverter;
import com.crescent.gateway.core.converter.ResponseConverter;
import com.crescent.gateway.core.dialect.DialectAdapter;
import com.crescent.gateway.core.dialect.DialectAdapterFactory;
import com.crescent.gateway.core.dialect.StreamEncoder;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.hook.HookContext;
import com.crescent.gateway.core.hook.HookRegistry;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.core.model.StreamEvent;
import com.crescent.gateway.core.model.TokenUsage;
import com.crescent.gateway.core.registry.ModelRegistry;
import com.crescent.gateway.core.stream.StreamListener;
import com.crescent.gateway.core.stream.StreamingProxy;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 分发核心
 * <p>
 * 完整处理链路：<br>
 * 1. 入站方言适配器解码请求体（失败直接返回 BAD_REQUEST，不访问上游）<br>
 * 2. 通过模型注册表解析路由，并检查客户端方言能否由该上游方言承载<br>
 * 3. 按调用方凭证限流，按租户检查 token 配额<br>
 * 4. 请求钩子改写请求；同步调用直接请求上游，Embeddings 经分片协调器；流式调用交给 StreamingProxy<br>
 * 5. 入站适配器把统一响应渲染回客户端方言，全程打点监控并累计租户用量
 * <p>
 * 上游错误只包装不重试。调用方超时或客户端断开时取消在途的上游请求及未完成的分片。
 * 每次调用的在途计数只结算一次：同步调用在结果、错误或取消时结算，流式调用在 SSE 流结束时结算。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final DialectAdapterFactory adapterFactory;
    private final ModelRegistry modelRegistry;
    private final ConverterFactory converterFactory;
    private final UpstreamClient upstreamClient;
    private final StreamingProxy streamingProxy;
    private final EmbeddingBatchCoordinator batchCoordinator;
    private final RateLimitService rateLimitService;
    private final QuotaService quotaService;
    private final HookRegistry hookRegistry;
    private final GatewayMetricsService metricsService;
    private final GatewayProperties properties;

    /**
     * 处理一次入站调用
     *
     * @param payload 客户端请求体
     * @param dialect 入站路径对应的方言
     * @param context 调用上下文
     * @return 同步响应体或 SSE 帧流；解码、路由、限流及同步调用的错误以 GatewayException 结束
     */
    public Mono<DispatchResult> handle(JsonNode payload, Dialect dialect, DispatchContext context) {
        return Mono.defer(() -> {
            metricsService.onStart(dialect);
            HookContext hookContext = HookContext.of(context.getRequestId(), context.getTenantId(), dialect);
            AtomicBoolean settled = new AtomicBoolean(false);
            return Mono.defer(() -> dispatch(payload, dialect, context, hookContext))
                    .doOnNext(result -> {
                        // 流式结果由 SSE 流自己结算
                        if (settled.compareAndSet(false, true) && !result.isStream()) {
                            metricsService.onEnd();
                        }
                    })
                    .onErrorMap(GatewayException::from)
                    .doOnError(e -> {
                        if (!settled.compareAndSet(false, true)) {
                            return;
                        }
                        GatewayException error = (GatewayException) e;
                        if (error.getKind().getStatus().is5xxServerError()) {
                            log.warn("Request {} failed: {}", context.getRequestId(), error.getMessage());
                        } else if (log.isDebugEnabled()) {
                            log.debug("Request {} rejected: {}", context.getRequestId(), error.getMessage());
                        }
                        metricsService.recordFailure(error.getKind());
                        metricsService.onEnd();
                        hookRegistry.onError(hookContext, error);
                    })
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            log.debug("Request {} cancelled by client", context.getRequestId());
                            metricsService.recordFailure(GatewayMetricsService.CLIENT_CANCELLED);
                            metricsService.onEnd();
                        }
                    });
        });
    }

    private Mono<DispatchResult> dispatch(JsonNode payload, Dialect dialect, DispatchContext context,
                                          HookContext hookContext) {
        DialectAdapter adapter = adapterFactory.getAdapter(dialect);
        CanonicalRequest decoded = adapter.decode(payload);
        ModelRoute route = modelRegistry.resolve(decoded.getModel());
        checkCompatibility(dialect, route);
        if (log.isDebugEnabled()) {
            log.debug("Dispatching {} request {} for model {} to {} ({}), stream={}",
                    dialect.getCode(), context.getRequestId(), decoded.getModel(),
                    route.getProviderId(), route.getProviderDialect().getCode(), decoded.isStream());
        }
        return rateLimitService.check(context.getCredential())
                .then(Mono.defer(() -> {
                    quotaService.check(context.getTenantId());
                    CanonicalRequest request = hookRegistry.beforeRequest(hookContext, decoded);
                    return request.isStream()
                            ? Mono.just(stream(adapter, request, route, context, hookContext))
                            : unary(adapter, request, route, context, hookContext);
                }));
    }

    /**
     * Chat-Completions 与 Responses 可以互相转换；Embeddings 与 Images 只能由同方言上游承载
     */
    private static void checkCompatibility(Dialect dialect, ModelRoute route) {
        if (!dialect.isServableBy(route.getProviderDialect())) {
            throw GatewayException.unsupportedModel("The model '" + route.getModelName()
                    + "' does not support the " + dialect.getPath() + " endpoint");
        }
    }

    private Mono<DispatchResult> unary(DialectAdapter adapter, CanonicalRequest request, ModelRoute route,
                                       DispatchContext context, HookContext hookContext) {
        Duration timeout = context.getTimeout();
        Mono<CanonicalResponse> call = route.getProviderDialect() == Dialect.EMBEDDINGS
                ? embed(request, route, context).map(batch -> batch.toResponse(route.getModelName()))
                : callUpstream(request, route, context);
        return call
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> GatewayException.timeout("Request exceeded the " + timeout.toMillis() + "ms timeout"))
                .map(upstreamResponse -> {
                    CanonicalResponse response = hookRegistry.afterResponse(hookContext, request, upstreamResponse);
                    DispatchResult result = DispatchResult.of(adapter.encode(response, request));
                    metricsService.recordSuccess(response.getUsage());
                    quotaService.record(context.getTenantId(), response.getUsage());
                    return result;
                });
    }

    private Mono<CanonicalResponse> callUpstream(CanonicalRequest request, ModelRoute route, DispatchContext context) {
        RequestConverter requestConverter = converterFactory.getRequestConverter(route);
        ResponseConverter responseConverter = converterFactory.getResponseConverter(route);
        return Mono.defer(() -> upstreamClient.exchange(route, requestConverter.convert(route, request), context))
                .map(body -> responseConverter.convert(route, body));
    }

    private Mono<EmbeddingBatch> embed(CanonicalRequest request, ModelRoute route, DispatchContext context) {
        GatewayProperties.Embeddings settings = properties.getEmbeddings();
        int chunkSize = route.getMaxBatchSize() != null && route.getMaxBatchSize() > 0
                ? route.getMaxBatchSize()
                : settings.getChunkSize();
        return batchCoordinator.embedBatch(request, chunkSize, settings.getMaxConcurrency(),
                        chunk -> callUpstream(chunk, route, context))
                .doOnNext(batch -> metricsService.recordEmbeddingChunks(batch.getChunkCount()));
    }

    private DispatchResult stream(DialectAdapter adapter, CanonicalRequest request, ModelRoute route,
                                  DispatchContext context, HookContext hookContext) {
        ObservedStreamEncoder encoder = new ObservedStreamEncoder(adapter.openStream(request), hookRegistry, hookContext);
        JsonNode upstreamPayload = converterFactory.getRequestConverter(route).convert(route, request);
        Flux<String> upstream = upstreamClient.stream(route, upstreamPayload, context);

        StreamListener listener = new StreamListener() {
            @Override
            public void onComplete(int emittedFrames) {
                if (log.isDebugEnabled()) {
                    log.debug("Stream {} completed with {} frame(s)", context.getRequestId(), emittedFrames);
                }
                metricsService.recordSuccess(encoder.usage());
                quotaService.record(context.getTenantId(), encoder.usage());
            }

            @Override
            public void onFailure(GatewayException error) {
                metricsService.recordFailure(error.getKind());
                hookRegistry.onError(hookContext, error);
            }

            @Override
            public void onCancel() {
                metricsService.recordFailure(GatewayMetricsService.CLIENT_CANCELLED);
            }
        };

        Flux<ServerSentEvent<String>> frames = streamingProxy
                .proxy(upstream, route, encoder, context.getTimeout(), listener)
                .doFinally(signal -> metricsService.onEnd());
        return DispatchResult.stream(frames);
    }

    /**
     * 在客户端方言编码器之前执行流式钩子，并记下上游报告的 usage
     */
    private static final class ObservedStreamEncoder implements StreamEncoder {

        private final StreamEncoder delegate;
        private final HookRegistry hookRegistry;
        private final HookContext hookContext;
        private volatile TokenUsage usage;

        private ObservedStreamEncoder(StreamEncoder delegate, HookRegistry hookRegistry, HookContext hookContext) {
            this.delegate = delegate;
            this.hookRegistry = hookRegistry;
            this.hookContext = hookContext;
        }

        TokenUsage usage() {
            return usage;
        }

        @Override
        public List<ServerSentEvent<String>> begin() {
            return delegate.begin();
        }

        @Override
        public List<ServerSentEvent<String>> encode(StreamEvent event) {
            StreamEvent observed;
            try {
                observed = hookRegistry.onStreamEvent(hookContext, event);
            } catch (RuntimeException e) {
                // 钩子故障归为网关内部错误，不算作上游中断
                throw GatewayException.from(e);
            }
            if (observed == null) {
                return Collections.emptyList();
            }
            if (StreamEvent.USAGE.equals(observed.getType())) {
                usage = observed.toUsage();
            }
            return delegate.encode(observed);
        }

        @Override
        public List<ServerSentEvent<String>> complete() {
            return delegate.complete();
        }

        @Override
        public List<ServerSentEvent<String>> fail(GatewayException error) {
            return delegate.fail(error);
        }
    }
}
