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
 * Responses 接口响应格式
 * <p>
 * 文本位于 {@code output[].content[].text}；流式事件中的 response 快照也使用该结构。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Responses 响应格式")
public class ResponsesResponse {

    private String id;

    @Builder.Default
    private String object = "response";

    @JsonProperty("created_at")
    private Long createdAt;

    @Schema(description = "状态", example = "completed")
    private String status;

    private String model;

    private List<OutputItem> output;

    private Usage usage;

    private ErrorDetail error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OutputItem {
        @Builder.Default
        private String type = "message";
        private String id;
        private String status;
        private String role;
        private List<OutputText> content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OutputText {
        @Builder.Default
        private String type = "output_text";
        private String text;
        @Builder.Default
        private List<Object> annotations = List.of();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        @JsonProperty("input_tokens")
        private Integer inputTokens;

        @JsonProperty("output_tokens")
        private Integer outputTokens;

        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorDetail {
        private String code;
        private String message;
    }
}
