package com.crescent.gateway.core.hook;

import com.crescent.gateway.core.model.StreamEvent;

/**
 * 流式钩子：每个上游事件在编码为客户端帧之前经过一次
 */
public interface StreamingHook extends GatewayHook {

    /**
     * @return 替换后的事件；返回 null 表示丢弃该事件
     */
    StreamEvent onEvent(HookContext context, StreamEvent event);
}
