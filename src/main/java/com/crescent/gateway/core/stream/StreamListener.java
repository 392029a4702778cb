package com.crescent.gateway.core.stream;

import com.crescent.gateway.core.error.GatewayException;

/**
 * 流式调用结束时的回调，由分发层用于监控打点
 */
public interface StreamListener {

    StreamListener NOOP = new StreamListener() {
    };

    /**
     * 上游正常结束
     *
     * @param emittedFrames 写给客户端的帧数（不含前置帧与 [DONE]）
     */
    default void onComplete(int emittedFrames) {
    }

    /**
     * 出错并已写出带内错误帧
     */
    default void onFailure(GatewayException error) {
    }

    /**
     * 客户端断开或调用方超时导致取消
     */
    default void onCancel() {
    }
}
