package com.crescent.gateway.core.converter;

import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.ModelRoute;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 请求转换器接口
 * <p>
 * 负责将网关统一请求转换为上游服务所用方言的请求体。
 */
public interface RequestConverter {

    /**
     * 将网关统一请求转换为上游请求体
     *
     * @param route   目标模型路由
     * @param request 网关统一请求
     * @return 上游请求体（JSON 节点）
     */
    JsonNode convert(ModelRoute route, CanonicalRequest request);

    /**
     * 检查是否支持该路由的转换
     *
     * @param route 模型路由
     * @return 是否支持
     */
    boolean supports(ModelRoute route);
}
