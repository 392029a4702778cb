package com.crescent.gateway.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Schema(description = "网关请求指标快照")
public class MetricsSnapshotDto {

    @Schema(description = "累计请求数（成功 + 失败）")
    private long totalRequests;

    private long successRequests;

    private long failedRequests;

    @Schema(description = "成功率", example = "0.98")
    private double successRate;

    @Schema(description = "当前处理中的请求数")
    private int inflightRequests;

    @Schema(description = "按方言统计的请求数，key 为 chat_completions / responses / embeddings / images")
    private Map<String, Long> requestsByDialect;

    @Schema(description = "累计上游 embedding 分片调用数")
    private long embeddingChunks;

    @Schema(description = "累计 token 用量（上游报告值）")
    private long totalTokens;

    @Schema(description = "失败原因分布，按次数降序")
    private List<FailureReasonStatDto> failureReasons;
}
