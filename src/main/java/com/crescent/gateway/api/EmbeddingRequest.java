package com.crescent.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Embeddings 请求格式（仅用于接口文档）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Embeddings 请求格式")
public class EmbeddingRequest {

    @Schema(description = "模型名称", example = "text-embedding-3-small", requiredMode = Schema.RequiredMode.REQUIRED)
    private String model;

    @Schema(description = "输入：字符串或字符串数组，数量不受上游单批限制", requiredMode = Schema.RequiredMode.REQUIRED)
    private Object input;

    @Schema(description = "输出维度（正整数）", example = "512")
    private Integer dimensions;

    @Schema(description = "编码格式：float 或 base64", defaultValue = "float")
    @JsonProperty("encoding_format")
    private String encodingFormat;
}
