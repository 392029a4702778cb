package com.crescent.gateway.service;

import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.TokenUsage;
import com.crescent.gateway.dto.MetricsSnapshotDto;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GatewayMetricsServiceTest {

    @Test
    void shouldKeepTotalsConsistentAndNeverGoBelowZeroInflight() {
        GatewayMetricsService metrics = new GatewayMetricsService();
        metrics.onStart(Dialect.CHAT_COMPLETIONS);
        metrics.onStart(Dialect.CHAT_COMPLETIONS);
        metrics.onStart(Dialect.RESPONSES);
        metrics.recordSuccess(TokenUsage.of(1, 2, 3));
        metrics.recordFailure(GatewayErrorKind.NOT_FOUND);
        metrics.recordFailure(GatewayMetricsService.CLIENT_CANCELLED);
        metrics.recordFailure(GatewayErrorKind.NOT_FOUND);
        for (int i = 0; i < 5; i++) {
            metrics.onEnd();
        }

        MetricsSnapshotDto snapshot = metrics.snapshot();
        assertEquals(4, snapshot.getTotalRequests());
        assertEquals(snapshot.getTotalRequests(), snapshot.getSuccessRequests() + snapshot.getFailedRequests());
        assertEquals(0.25, snapshot.getSuccessRate(), 1e-9);
        assertEquals(0, snapshot.getInflightRequests());
        assertEquals(3, snapshot.getTotalTokens());
        assertEquals(2L, snapshot.getRequestsByDialect().get("chat_completions"));
        assertEquals("MODEL_NOT_FOUND", snapshot.getFailureReasons().get(0).getReasonKey());
        assertEquals(2L, snapshot.getFailureReasons().get(0).getCount());
    }
}
