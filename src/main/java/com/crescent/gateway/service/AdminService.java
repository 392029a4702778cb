package com.crescent.gateway.service;

import com.crescent.gateway.core.registry.ModelRegistry;
import com.crescent.gateway.dto.MetricsSnapshotDto;
import com.crescent.gateway.dto.ModelRouteDto;
import com.crescent.gateway.dto.TenantQuotaDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    private final ModelRegistry modelRegistry;
    private final GatewayMetricsService metricsService;
    private final UpstreamWebClientManager webClientManager;
    private final QuotaService quotaService;

    public List<ModelRouteDto> getRoutes() {
        return modelRegistry.routes().stream()
                .map(ModelRouteDto::from)
                .collect(Collectors.toList());
    }

    /**
     * 立即重新加载路由；读取数据库是阻塞操作，放到 boundedElastic 上执行
     */
    public Mono<Integer> reloadRoutes() {
        log.info("Manual registry reload requested");
        return Mono.fromCallable(modelRegistry::reload)
                .subscribeOn(Schedulers.boundedElastic());
    }

    public List<TenantQuotaDto> getQuotas() {
        return quotaService.listUsage();
    }

    public TenantQuotaDto getQuota(String tenantId) {
        return quotaService.getUsage(tenantId);
    }

    public TenantQuotaDto setQuotaLimit(String tenantId, long limit) {
        return quotaService.setLimit(tenantId, limit);
    }

    public TenantQuotaDto resetQuota(String tenantId) {
        quotaService.reset(tenantId);
        log.info("Token usage of tenant {} reset", tenantId);
        return quotaService.getUsage(tenantId);
    }

    public int resetAllQuotas() {
        return quotaService.resetAll();
    }

    public MetricsSnapshotDto getMetrics() {
        MetricsSnapshotDto snapshot = metricsService.snapshot();
        if (log.isDebugEnabled()) {
            log.debug("Metrics snapshot: {} request(s), {} upstream client(s)",
                    snapshot.getTotalRequests(), webClientManager.getClientCount());
        }
        return snapshot;
    }
}
