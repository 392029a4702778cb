package com.crescent.gateway.web;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.dto.MetricsSnapshotDto;
import com.crescent.gateway.dto.ModelRouteDto;
import com.crescent.gateway.dto.QuotaLimitRequest;
import com.crescent.gateway.dto.TenantQuotaDto;
import com.crescent.gateway.service.AdminService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "管理控制器", description = "模型路由、租户配额与请求指标")
public class AdminController {

    private final AdminService adminService;

    @Operation(summary = "获取模型路由", description = "当前注册表中的全部路由，上游密钥已掩码")
    @GetMapping("/models")
    public List<ModelRouteDto> getRoutes() {
        return adminService.getRoutes();
    }

    /**
     * 强制重新加载路由（配置 + 数据库），通常在修改 model_route 表后调用
     */
    @Operation(summary = "重新加载模型路由")
    @PostMapping("/models/reload")
    public Mono<Map<String, Integer>> reloadRoutes() {
        return adminService.reloadRoutes().map(count -> Map.of("routes", count));
    }

    @Operation(summary = "租户配额列表", description = "已产生用量或单独设置过额度的租户")
    @GetMapping("/quotas")
    public List<TenantQuotaDto> getQuotas() {
        return adminService.getQuotas();
    }

    @Operation(summary = "查询租户配额")
    @GetMapping("/quotas/{tenantId}")
    public TenantQuotaDto getQuota(@PathVariable("tenantId") String tenantId) {
        return adminService.getQuota(tenantId);
    }

    /**
     * 单独设置租户额度，请求体 {"limit": 100000}，0 表示不限
     */
    @Operation(summary = "设置租户配额")
    @PutMapping("/quotas/{tenantId}")
    public TenantQuotaDto setQuota(@PathVariable("tenantId") String tenantId, @RequestBody QuotaLimitRequest request) {
        if (request == null || request.getLimit() == null) {
            throw GatewayException.badRequest("Missing required parameter: 'limit'", "limit");
        }
        return adminService.setQuotaLimit(tenantId, request.getLimit());
    }

    @Operation(summary = "重置租户用量")
    @PostMapping("/quotas/{tenantId}/reset")
    public TenantQuotaDto resetQuota(@PathVariable("tenantId") String tenantId) {
        return adminService.resetQuota(tenantId);
    }

    @Operation(summary = "重置全部租户用量")
    @PostMapping("/quotas/reset")
    public Map<String, Integer> resetAllQuotas() {
        return Map.of("tenants", adminService.resetAllQuotas());
    }

    @Operation(summary = "获取请求指标", description = "按方言的请求数、失败原因分布与在途请求数")
    @GetMapping("/metrics")
    public MetricsSnapshotDto getMetrics() {
        return adminService.getMetrics();
    }
}
