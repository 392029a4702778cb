package com.crescent.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 图片生成请求格式（仅用于接口文档）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "图片生成请求格式")
public class ImageGenerationRequest {

    @Schema(description = "模型名称，缺省为 dall-e-3", example = "dall-e-3")
    private String model;

    @Schema(description = "图片描述", example = "A lighthouse at dusk", requiredMode = Schema.RequiredMode.REQUIRED)
    private String prompt;

    @Schema(description = "生成数量（1-10）", example = "1")
    private Integer n;

    @Schema(description = "图片尺寸", example = "1024x1024")
    private String size;

    @Schema(description = "返回格式：url 或 b64_json", defaultValue = "url")
    @JsonProperty("response_format")
    private String responseFormat;
}
