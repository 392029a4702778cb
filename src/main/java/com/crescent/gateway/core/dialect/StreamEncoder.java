package com.crescent.gateway.core.dialect;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.StreamEvent;
import org.springframework.http.codec.ServerSentEvent;

import java.util.List;

/**
 * 单次流式调用的帧编码器
 * <p>
 * 由 StreamingProxy 按顺序驱动：begin → encode* → complete 或 fail。
 * 每个方法返回零到多个 SSE 帧，终止标记 [DONE] 不由编码器产生。
 */
public interface StreamEncoder {

    /**
     * 流打开时的前置帧
     */
    List<ServerSentEvent<String>> begin();

    /**
     * 编码一个上游事件
     */
    List<ServerSentEvent<String>> encode(StreamEvent event);

    /**
     * 上游正常结束时的收尾帧
     */
    List<ServerSentEvent<String>> complete();

    /**
     * 流中出错时的带内错误帧
     */
    List<ServerSentEvent<String>> fail(GatewayException error);
}
