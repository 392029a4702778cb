package com.crescent.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 标准的 OpenAI ChatCompletion 响应格式
 * <p>
 * 同步响应使用 {@code chat.completion} + message，流式分片使用 {@code chat.completion.chunk} + delta。
 * 字段声明顺序即序列化顺序。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "标准 ChatCompletion 响应格式（OpenAI 兼容）")
public class ChatCompletionResponse {

    @Schema(description = "响应 ID")
    private String id;

    @Schema(description = "对象类型", example = "chat.completion")
    private String object;

    @Schema(description = "创建时间戳")
    private Long created;

    @Schema(description = "模型名称")
    private String model;

    @Schema(description = "选择列表")
    private List<Choice> choices;

    @Schema(description = "使用情况")
    private Usage usage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "响应选择项")
    public static class Choice {
        private Integer index;

        @Schema(description = "完整消息（同步响应）")
        private Message message;

        @Schema(description = "增量内容（流式分片）")
        private Message delta;

        @Schema(description = "完成原因")
        @JsonProperty("finish_reason")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String finishReason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Message {
        private String role;
        private String content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Token 使用情况")
    public static class Usage {
        @JsonProperty("prompt_tokens")
        private Integer promptTokens;

        @JsonProperty("completion_tokens")
        private Integer completionTokens;

        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }
}
