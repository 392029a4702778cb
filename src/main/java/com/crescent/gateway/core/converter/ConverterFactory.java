package com.crescent.gateway.core.converter;

import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 转换器工厂
 * <p>
 * 按上游方言选择并缓存转换器。同一方言的所有路由共享同一组转换器。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConverterFactory {

    private final List<RequestConverter> requestConverters;
    private final List<ResponseConverter> responseConverters;

    // 转换器缓存：providerDialect -> converter
    private final Map<Dialect, RequestConverter> requestConverterCache = new ConcurrentHashMap<>();
    private final Map<Dialect, ResponseConverter> responseConverterCache = new ConcurrentHashMap<>();

    /**
     * 获取请求转换器
     *
     * @param route 模型路由
     * @return 请求转换器
     */
    public RequestConverter getRequestConverter(ModelRoute route) {
        return requestConverterCache.computeIfAbsent(requireDialect(route), dialect ->
                requestConverters.stream()
                        .filter(converter -> converter.supports(route))
                        .findFirst()
                        .orElseThrow(() -> new IllegalStateException("No request converter found for dialect: " + dialect)));
    }

    /**
     * 获取响应转换器
     *
     * @param route 模型路由
     * @return 响应转换器
     */
    public ResponseConverter getResponseConverter(ModelRoute route) {
        return responseConverterCache.computeIfAbsent(requireDialect(route), dialect ->
                responseConverters.stream()
                        .filter(converter -> converter.supports(route))
                        .findFirst()
                        .orElseThrow(() -> new IllegalStateException("No response converter found for dialect: " + dialect)));
    }

    private static Dialect requireDialect(ModelRoute route) {
        if (route.getProviderDialect() == null) {
            throw new IllegalStateException("Route " + route.getModelName() + " has no provider dialect");
        }
        return route.getProviderDialect();
    }
}
