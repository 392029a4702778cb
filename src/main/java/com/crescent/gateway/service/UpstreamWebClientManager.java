package com.crescent.gateway.service;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.model.ModelRoute;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 上游 WebClient 管理器
 *
 * <p>为每个上游服务（服务商 + 主机）维护专用的 WebClient 和连接池：
 * <ul>
 *   <li><b>按服务复用连接</b>：同一主机上的多个模型路由共享一个连接池</li>
 *   <li><b>自动清理</b>：注册表刷新后，不再被任何路由引用的连接池会被释放</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UpstreamWebClientManager {

    private final GatewayProperties properties;

    /** WebClient 缓存，key 为 {@link ModelRoute#clientKey()} */
    private final Map<String, WebClient> webClientCache = new ConcurrentHashMap<>();
    /** 连接池提供者缓存 */
    private final Map<String, ConnectionProvider> connectionProviderCache = new ConcurrentHashMap<>();
    private final AtomicInteger poolCounter = new AtomicInteger(0);

    /**
     * 获取路由对应的 WebClient，不存在时创建
     *
     * @param route 模型路由
     * @return 该上游服务专用的 WebClient
     */
    public WebClient getWebClient(ModelRoute route) {
        if (route == null || route.getEndpointUrl() == null) {
            throw new IllegalArgumentException("Route and endpoint URL must not be null");
        }
        return webClientCache.computeIfAbsent(route.clientKey(), key -> {
            WebClient client = createWebClient(key);
            log.info("Created WebClient for upstream {}", key);
            return client;
        });
    }

    /**
     * 连接池配置：
     * <ul>
     *   <li>最大连接数：gateway.upstream.max-connections</li>
     *   <li>空闲连接保持 20 秒，连接最长生命周期 10 分钟</li>
     *   <li>响应读取超时：gateway.upstream.read-timeout（流式请求的空闲超时另由 StreamingProxy 控制）</li>
     * </ul>
     */
    private WebClient createWebClient(String key) {
        GatewayProperties.Upstream upstream = properties.getUpstream();

        String poolName = "upstream-pool-" + poolCounter.incrementAndGet();
        ConnectionProvider connectionProvider = ConnectionProvider.builder(poolName)
                .maxConnections(upstream.getMaxConnections())
                .maxIdleTime(Duration.ofSeconds(20))
                .maxLifeTime(Duration.ofMinutes(10))
                .pendingAcquireTimeout(Duration.ofSeconds(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
        connectionProviderCache.put(key, connectionProvider);

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, upstream.getConnectTimeoutMs())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .responseTimeout(upstream.getReadTimeout())
                .compress(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> {
                    configurer.defaultCodecs().maxInMemorySize(upstream.getMaxInMemorySize());
                    configurer.defaultCodecs().enableLoggingRequestDetails(false);
                })
                .build();
    }

    /**
     * 只保留仍被路由引用的连接池
     *
     * @param activeRoutes 当前注册表中的全部路由
     */
    public void retainRoutes(Collection<ModelRoute> activeRoutes) {
        Set<String> activeKeys = new HashSet<>();
        for (ModelRoute route : activeRoutes) {
            activeKeys.add(route.clientKey());
        }
        Set<String> toRemove = new HashSet<>(webClientCache.keySet());
        toRemove.removeAll(activeKeys);
        for (String key : toRemove) {
            remove(key);
        }
        if (!toRemove.isEmpty()) {
            log.info("Cleaned up {} upstream WebClient(s) during registry refresh", toRemove.size());
        }
    }

    private void remove(String key) {
        webClientCache.remove(key);
        ConnectionProvider connectionProvider = connectionProviderCache.remove(key);
        if (connectionProvider != null) {
            connectionProvider.disposeLater()
                    .doOnError(e -> log.warn("Failed to dispose connection pool for {}: {}", key, e.getMessage()))
                    .onErrorResume(e -> Mono.empty())
                    .subscribe();
        }
        log.debug("Removed WebClient for upstream {}", key);
    }

    public int getClientCount() {
        return webClientCache.size();
    }

    @PreDestroy
    public void destroy() {
        log.info("Shutting down UpstreamWebClientManager, cleaning up {} client(s)", webClientCache.size());
        for (String key : new HashSet<>(webClientCache.keySet())) {
            remove(key);
        }
    }
}
