package com.crescent.gateway.core.dialect;

import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.Dialect;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * 入站方言适配器接口
 * <p>
 * 负责客户端线上格式与网关统一格式之间的双向转换，每种方言一个实现。
 * 解码与编码均为同步、无阻塞的纯转换，不做任何 I/O。
 */
public interface DialectAdapter {

    /**
     * 适配器负责的客户端方言
     */
    Dialect dialect();

    /**
     * 将客户端请求体解码为统一请求
     *
     * @param payload 客户端原始请求体
     * @return 统一请求
     * @throws com.crescent.gateway.core.error.GatewayException 请求体不符合方言格式时抛出 BAD_REQUEST
     */
    CanonicalRequest decode(JsonNode payload);

    /**
     * 将统一响应渲染为客户端格式
     *
     * @param response 统一响应
     * @param request  对应的统一请求（用于回显模型名、编码格式等）
     * @return 客户端响应体
     */
    JsonNode encode(CanonicalResponse response, CanonicalRequest request);

    /**
     * 为一次流式调用创建编码器，编码器持有本次调用的帧状态，不可复用
     *
     * @param request 对应的统一请求
     * @return 流式编码器
     */
    StreamEncoder openStream(CanonicalRequest request);
}
