package com.crescent.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Responses 接口请求格式（仅用于接口文档）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Responses 请求格式")
public class ResponsesRequest {

    @Schema(description = "模型名称", example = "gpt-4o", requiredMode = Schema.RequiredMode.REQUIRED)
    private String model;

    @Schema(description = "输入：字符串，或 message 项数组", example = "Count to 5",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private Object input;

    @Schema(description = "系统指令")
    private String instructions;

    @Schema(description = "是否流式输出", defaultValue = "false")
    private Boolean stream;

    @Schema(description = "温度参数", example = "0.7")
    private Double temperature;

    @Schema(description = "最大输出 token 数")
    @JsonProperty("max_output_tokens")
    private Integer maxOutputTokens;
}
