package com.crescent.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "租户额度设置")
public class QuotaLimitRequest {

    @Schema(description = "当前窗口的 token 额度，0 表示不限", example = "100000", requiredMode = Schema.RequiredMode.REQUIRED)
    private Long limit;
}
