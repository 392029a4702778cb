package com.crescent.gateway.core.registry;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.dao.ModelRouteMapper;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.service.UpstreamWebClientManager;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 模型注册表
 *
 * <p>把请求中的模型名映射到上游路由 {@link ModelRoute}。
 * <ul>
 *   <li><b>不可变快照</b>：所有路由保存在一个只读 Map 中，重新加载时整体构建新 Map 后原子替换</li>
 *   <li><b>无锁读</b>：{@link #resolve(String)} 只读取 AtomicReference，并发查询互不阻塞</li>
 *   <li><b>两路来源</b>：配置文件 gateway.routes 与数据库 model_route 表，数据库同名路由优先</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRegistry {

    private final ModelRouteMapper routeMapper;
    private final GatewayProperties properties;
    private final UpstreamWebClientManager webClientManager;

    private final AtomicReference<Map<String, ModelRoute>> snapshot = new AtomicReference<>(Map.of());

    @PostConstruct
    public void init() {
        reload();
    }

    @Scheduled(fixedDelayString = "${gateway.registry.refresh-interval-ms:30000}",
            initialDelayString = "${gateway.registry.refresh-interval-ms:30000}")
    public void scheduledReload() {
        reload();
    }

    /**
     * 按模型名精确查找路由
     *
     * @param modelName 客户端请求中的模型名
     * @return 对应路由
     * @throws GatewayException NOT_FOUND，未注册该模型
     */
    public ModelRoute resolve(String modelName) {
        ModelRoute route = modelName == null ? null : snapshot.get().get(modelName);
        if (route == null) {
            throw GatewayException.notFound(modelName);
        }
        return route;
    }

    public Optional<ModelRoute> find(String modelName) {
        return Optional.ofNullable(modelName == null ? null : snapshot.get().get(modelName));
    }

    public List<String> listModels() {
        List<String> names = new ArrayList<>(snapshot.get().keySet());
        Collections.sort(names);
        return names;
    }

    public List<ModelRoute> routes() {
        List<ModelRoute> routes = new ArrayList<>(snapshot.get().values());
        routes.sort((a, b) -> a.getModelName().compareTo(b.getModelName()));
        return routes;
    }

    public int size() {
        return snapshot.get().size();
    }

    /**
     * 重新加载配置与数据库中的路由
     * <p>
     * 数据库读取失败时保留当前快照，仅在注册表为空时退回到纯配置路由。
     *
     * @return 加载后的路由数量
     */
    public synchronized int reload() {
        Map<String, ModelRoute> next = new HashMap<>();
        for (GatewayProperties.Route route : properties.getRoutes()) {
            put(next, route.toModelRoute(), "config");
        }

        try {
            List<ModelRoute> stored = routeMapper.findAllEnabled();
            if (stored != null) {
                for (ModelRoute route : stored) {
                    put(next, route, "database");
                }
            }
        } catch (Exception e) {
            if (!snapshot.get().isEmpty()) {
                log.warn("Failed to load model routes from database, keeping {} existing route(s): {}",
                        snapshot.get().size(), e.getMessage());
                return snapshot.get().size();
            }
            log.warn("Failed to load model routes from database, using configured routes only: {}", e.getMessage());
        }

        install(next);
        return next.size();
    }

    /**
     * 直接替换整个快照（管理接口与测试使用）
     */
    public synchronized void replaceAll(Collection<ModelRoute> routes) {
        Map<String, ModelRoute> next = new HashMap<>();
        for (ModelRoute route : routes) {
            put(next, route, "manual");
        }
        install(next);
    }

    private void install(Map<String, ModelRoute> next) {
        Map<String, ModelRoute> previous = snapshot.getAndSet(Map.copyOf(next));
        webClientManager.retainRoutes(next.values());
        if (previous.size() != next.size() || !previous.keySet().equals(next.keySet())) {
            log.info("Model registry reloaded: {} route(s) {}", next.size(), next.keySet());
        }
    }

    private void put(Map<String, ModelRoute> target, ModelRoute route, String source) {
        if (route == null || !route.isActive()) {
            return;
        }
        if (isBlank(route.getModelName()) || isBlank(route.getEndpointUrl()) || route.getProviderDialect() == null) {
            log.warn("Skipping incomplete {} route: {}", source, route);
            return;
        }
        target.put(route.getModelName(), route);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
