package com.crescent.gateway.core.converter;

import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.core.model.StreamEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 响应转换器接口
 * <p>
 * 负责将上游服务的响应转换为网关统一格式。
 */
public interface ResponseConverter {

    /**
     * 将上游同步响应转换为统一响应
     *
     * @param route        模型路由
     * @param upstreamBody 上游原始响应
     * @return 统一响应
     * @throws com.crescent.gateway.core.error.GatewayException 上游返回错误体或格式不可识别时抛出 UPSTREAM_ERROR
     */
    CanonicalResponse convert(ModelRoute route, JsonNode upstreamBody);

    /**
     * 将一条上游 SSE 数据转换为零到多个统一流式事件
     *
     * @param route 模型路由
     * @param chunk 已去除 {@code data:} 前缀并解析为 JSON 的单条数据
     * @return 统一流式事件，按上游顺序排列
     */
    List<StreamEvent> convertChunk(ModelRoute route, JsonNode chunk);

    /**
     * 检查是否支持该路由的转换
     *
     * @param route 模型路由
     * @return 是否支持
     */
    boolean supports(ModelRoute route);
}
