package com.crescent.gateway.web;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.dao.ModelRouteMapper;
import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.TokenUsage;
import com.crescent.gateway.core.registry.ModelRegistry;
import com.crescent.gateway.service.AdminService;
import com.crescent.gateway.service.GatewayMetricsService;
import com.crescent.gateway.service.QuotaService;
import com.crescent.gateway.service.UpstreamWebClientManager;
import com.crescent.gateway.support.TestRoutes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AdminControllerTest {

    private final ModelRouteMapper routeMapper = mock(ModelRouteMapper.class);
    private final GatewayMetricsService metricsService = new GatewayMetricsService();
    private final GatewayProperties properties = new GatewayProperties();
    private final QuotaService quotaService = new QuotaService(properties);
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ModelRegistry registry = new ModelRegistry(routeMapper, new GatewayProperties(),
                mock(UpstreamWebClientManager.class));
        registry.replaceAll(List.of(TestRoutes.chat("gpt-4o")));
        properties.getQuota().setEnabled(true);
        properties.getQuota().setDefaultLimit(1000L);
        AdminService adminService = new AdminService(registry, metricsService, mock(UpstreamWebClientManager.class),
                quotaService);
        client = WebTestClient.bindToController(new AdminController(adminService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldListRoutesWithMaskedKeys() {
        client.get()
                .uri("/admin/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].modelName").isEqualTo("gpt-4o")
                .jsonPath("$[0].providerDialect").isEqualTo("chat_completions")
                .jsonPath("$[0].apiKey").isEqualTo("sk-t****0000");
    }

    @Test
    void shouldReloadRoutesFromDatabase() {
        when(routeMapper.findAllEnabled()).thenReturn(List.of(
                TestRoutes.chat("gpt-4o"), TestRoutes.embeddings("text-embedding-3-small")));

        client.post()
                .uri("/admin/models/reload")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.routes").isEqualTo(2);
    }

    @Test
    void shouldExposeMetricsSnapshot() {
        metricsService.onStart(Dialect.EMBEDDINGS);
        metricsService.recordFailure(GatewayErrorKind.TIMEOUT);
        metricsService.onEnd();

        client.get()
                .uri("/admin/metrics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalRequests").isEqualTo(1)
                .jsonPath("$.failedRequests").isEqualTo(1)
                .jsonPath("$.requestsByDialect.embeddings").isEqualTo(1)
                .jsonPath("$.failureReasons[0].reasonKey").isEqualTo("TIMEOUT");
    }

    @Test
    void shouldReportTenantQuotaUsage() {
        quotaService.record("team-a", TokenUsage.of(30, 12, 42));

        client.get()
                .uri("/admin/quotas")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].tenantId").isEqualTo("team-a")
                .jsonPath("$[0].totalTokens").isEqualTo(42)
                .jsonPath("$[0].quotaLimit").isEqualTo(1000)
                .jsonPath("$[0].remaining").isEqualTo(958);
    }

    @Test
    void shouldOverrideAndResetTenantQuota() {
        quotaService.record("team-a", TokenUsage.of(30, 12, 42));

        client.put()
                .uri("/admin/quotas/team-a")
                .bodyValue("{\"limit\":50}")
                .header("Content-Type", "application/json")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.quotaLimit").isEqualTo(50)
                .jsonPath("$.remaining").isEqualTo(8);

        client.post()
                .uri("/admin/quotas/team-a/reset")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalTokens").isEqualTo(0)
                .jsonPath("$.quotaLimit").isEqualTo(50);

        client.post()
                .uri("/admin/quotas/reset")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tenants").isEqualTo(1);
    }

    @Test
    void shouldRejectQuotaUpdateWithoutLimit() {
        client.put()
                .uri("/admin/quotas/team-a")
                .bodyValue("{}")
                .header("Content-Type", "application/json")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.param").isEqualTo("limit");

        client.put()
                .uri("/admin/quotas/team-a")
                .bodyValue("{\"limit\":-1}")
                .header("Content-Type", "application/json")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
