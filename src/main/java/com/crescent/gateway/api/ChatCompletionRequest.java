package com.crescent.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 标准的 OpenAI ChatCompletion 请求格式
 * <p>
 * 仅用于接口文档；入站请求由 ChatCompletionsAdapter 直接按 JSON 树解码，
 * 未列出的字段（tools、response_format 等）原样透传给上游。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "标准 ChatCompletion 请求格式（OpenAI 兼容）")
public class ChatCompletionRequest {

    @Schema(description = "模型名称", example = "gpt-4o", requiredMode = Schema.RequiredMode.REQUIRED)
    private String model;

    @Schema(description = "消息列表", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<ChatMessage> messages;

    @Schema(description = "温度参数", example = "0.7")
    private Double temperature;

    @Schema(description = "是否流式输出", example = "false", defaultValue = "false")
    private Boolean stream;

    @Schema(description = "最大 token 数", example = "1000")
    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @Schema(description = "Top-p 采样", example = "1.0")
    @JsonProperty("top_p")
    private Double topP;

    @Schema(description = "停止序列")
    private List<String> stop;

    @Schema(description = "用户标识")
    private String user;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "聊天消息")
    public static class ChatMessage {
        @Schema(description = "角色", example = "user", requiredMode = Schema.RequiredMode.REQUIRED)
        private String role;

        @Schema(description = "消息内容：字符串或 [{type: text, text}] 数组", example = "Hello!")
        private Object content;
    }
}
