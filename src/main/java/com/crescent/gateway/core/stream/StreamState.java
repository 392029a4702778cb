package com.crescent.gateway.core.stream;

/**
 * 单次流式调用的生命周期
 * <p>
 * CONNECTING：已发出上游请求，尚未收到首字节；OPENED：收到上游首字节；
 * EMITTING：已向客户端写出至少一帧；CLOSED：[DONE] 已写出或连接已取消。
 */
public enum StreamState {
    CONNECTING,
    OPENED,
    EMITTING,
    CLOSED;

    /**
     * 是否已经收到过上游数据，决定中途出错归类为 UPSTREAM_INTERRUPTED 还是 UPSTREAM_ERROR
     */
    public boolean hasReceivedData() {
        return this != CONNECTING;
    }
}
