package com.crescent.gateway.service;

import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.TokenUsage;
import com.crescent.gateway.dto.FailureReasonStatDto;
import com.crescent.gateway.dto.MetricsSnapshotDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存中的请求指标
 * <p>
 * 总请求数在最终判定成功/失败时才自增，保证 totalRequests = successRequests + failedRequests。
 * 全部计数无锁，读取时复制。
 */
@Slf4j
@Service
public class GatewayMetricsService {

    public static final String CLIENT_CANCELLED = "CLIENT_CANCELLED";

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong successRequests = new AtomicLong(0);
    private final AtomicLong failedRequests = new AtomicLong(0);
    private final AtomicLong totalTokens = new AtomicLong(0);
    private final AtomicLong embeddingChunks = new AtomicLong(0);
    private final AtomicInteger inflight = new AtomicInteger(0);
    private final Map<Dialect, AtomicLong> requestsByDialect = new EnumMap<>(Dialect.class);
    private final ConcurrentHashMap<String, Long> failureReasonTotals = new ConcurrentHashMap<>();

    public GatewayMetricsService() {
        for (Dialect dialect : Dialect.values()) {
            requestsByDialect.put(dialect, new AtomicLong(0));
        }
    }

    /**
     * 请求进入分发核心
     */
    public void onStart(Dialect dialect) {
        inflight.incrementAndGet();
        requestsByDialect.get(dialect).incrementAndGet();
    }

    /**
     * 请求结束（成功、失败或取消），只减到 0 为止
     */
    public void onEnd() {
        int v;
        do {
            v = inflight.get();
            if (v <= 0) {
                return;
            }
        } while (!inflight.compareAndSet(v, v - 1));
    }

    public void recordSuccess(TokenUsage usage) {
        totalRequests.incrementAndGet();
        successRequests.incrementAndGet();
        if (usage != null) {
            totalTokens.addAndGet(usage.getTotalTokens());
        }
    }

    public void recordFailure(GatewayErrorKind kind) {
        recordFailure(reasonKey(kind));
    }

    public void recordFailure(String reasonKey) {
        totalRequests.incrementAndGet();
        failedRequests.incrementAndGet();
        if (reasonKey == null || reasonKey.isBlank()) {
            reasonKey = "UNKNOWN";
        }
        failureReasonTotals.merge(reasonKey, 1L, Long::sum);
    }

    public void recordEmbeddingChunks(int chunks) {
        embeddingChunks.addAndGet(chunks);
    }

    public int inflight() {
        return inflight.get();
    }

    static String reasonKey(GatewayErrorKind kind) {
        if (kind == null) {
            return "UNKNOWN";
        }
        return kind == GatewayErrorKind.NOT_FOUND ? "MODEL_NOT_FOUND" : kind.name();
    }

    public MetricsSnapshotDto snapshot() {
        MetricsSnapshotDto dto = new MetricsSnapshotDto();
        long success = successRequests.get();
        long failed = failedRequests.get();
        long total = totalRequests.get();
        dto.setTotalRequests(total);
        dto.setSuccessRequests(success);
        dto.setFailedRequests(failed);
        dto.setSuccessRate(total == 0 ? 1.0d : (double) success / total);
        dto.setInflightRequests(inflight.get());
        dto.setEmbeddingChunks(embeddingChunks.get());
        dto.setTotalTokens(totalTokens.get());

        Map<String, Long> byDialect = new LinkedHashMap<>();
        requestsByDialect.forEach((dialect, count) -> byDialect.put(dialect.getCode(), count.get()));
        dto.setRequestsByDialect(byDialect);

        List<FailureReasonStatDto> reasons = new ArrayList<>();
        long failedTotal = failureReasonTotals.values().stream().mapToLong(Long::longValue).sum();
        for (Map.Entry<String, Long> entry : failureReasonTotals.entrySet()) {
            double ratio = failedTotal == 0 ? 0.0d : (double) entry.getValue() / failedTotal;
            reasons.add(new FailureReasonStatDto(entry.getKey(), entry.getValue(), ratio));
        }
        reasons.sort(Comparator.comparing(FailureReasonStatDto::getCount).reversed());
        dto.setFailureReasons(reasons);
        return dto;
    }
}
