package com.crescent.gateway.core.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 网关内部统一响应
 * <p>
 * 上游响应转换器产出，入站方言适配器负责渲染回客户端格式。
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CanonicalResponse {
    private final String id;
    private final String model;
    @Builder.Default
    private final ResponseStatus status = ResponseStatus.COMPLETED;
    /** 秒级时间戳 */
    private final long createdAt;
    @Singular("block")
    private final List<ContentBlock> output;
    private final TokenUsage usage;
    /** Chat-Completions 的 finish_reason，如 stop / length */
    private final String finishReason;

    /**
     * 按顺序拼接所有文本块
     */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : output) {
            if (block.isText() && block.getText() != null) {
                sb.append(block.getText());
            }
        }
        return sb.toString();
    }

    public String role() {
        for (ContentBlock block : output) {
            if (block.isText() && block.getRole() != null) {
                return block.getRole();
            }
        }
        return "assistant";
    }
}
