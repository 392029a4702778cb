package com.crescent.gateway.core.hook;

import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;

/**
 * 请求钩子：发往上游之前可以改写请求，同步调用返回之后可以改写响应
 * <p>
 * 在分发线程上同步执行，不允许阻塞。抛出的异常会终止本次调用。
 */
public interface RequestHook extends GatewayHook {

    /**
     * 路由解析完成、请求发往上游之前调用
     *
     * @return 继续使用的请求，不修改时直接返回入参；模型名的修改不会重新路由
     */
    default CanonicalRequest beforeRequest(HookContext context, CanonicalRequest request) {
        return request;
    }

    /**
     * 同步调用收到上游响应之后、渲染为客户端格式之前调用
     *
     * @return 继续使用的响应
     */
    default CanonicalResponse afterResponse(HookContext context, CanonicalRequest request, CanonicalResponse response) {
        return response;
    }
}
