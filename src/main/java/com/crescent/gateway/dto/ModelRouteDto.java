package com.crescent.gateway.dto;

import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模型路由展示DTO，上游密钥只显示掩码
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "模型路由信息")
public class ModelRouteDto {

    @Schema(description = "对外模型名", example = "gpt-4o")
    private String modelName;

    @Schema(description = "服务商", example = "openai")
    private String providerId;

    @Schema(description = "上游方言", example = "chat_completions")
    private Dialect providerDialect;

    @Schema(description = "上游地址")
    private String endpointUrl;

    @Schema(description = "发往上游的模型名")
    private String upstreamModel;

    @Schema(description = "单次上游 embedding 请求的最大输入条数")
    private Integer maxBatchSize;

    @Schema(description = "上游密钥（掩码）", example = "sk-a****xyz9")
    private String apiKey;

    public static ModelRouteDto from(ModelRoute route) {
        return ModelRouteDto.builder()
                .modelName(route.getModelName())
                .providerId(route.getProviderId())
                .providerDialect(route.getProviderDialect())
                .endpointUrl(route.getEndpointUrl())
                .upstreamModel(route.resolveUpstreamModel())
                .maxBatchSize(route.getMaxBatchSize())
                .apiKey(mask(route.getApiKey()))
                .build();
    }

    static String mask(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return null;
        }
        if (apiKey.length() <= 8) {
            return "****";
        }
        return apiKey.substring(0, 4) + "****" + apiKey.substring(apiKey.length() - 4);
    }
}
