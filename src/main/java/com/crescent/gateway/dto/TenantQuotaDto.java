package com.crescent.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@Schema(description = "租户 token 配额与当前窗口用量")
public class TenantQuotaDto {

    @Schema(description = "租户 ID", example = "team-a")
    private String tenantId;

    private long inputTokens;

    private long outputTokens;

    private long totalTokens;

    @Schema(description = "当前窗口额度，0 表示不限", example = "1000000")
    private long quotaLimit;

    @Schema(description = "剩余额度，不限额时为空")
    private Long remaining;

    @Schema(description = "下次重置时间（ISO-8601），不自动重置时为空")
    private String resetAt;

    private String lastUpdated;
}
