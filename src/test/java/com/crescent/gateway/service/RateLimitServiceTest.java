package com.crescent.gateway.service;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.error.GatewayException;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RateLimitServiceTest {

    private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
    private final GatewayProperties properties = new GatewayProperties();
    private final RateLimitService rateLimitService = new RateLimitService(redisTemplate, properties);

    private void enable(int requestsPerWindow) {
        properties.getRateLimit().setEnabled(true);
        properties.getRateLimit().setRequestsPerWindow(requestsPerWindow);
        properties.getRateLimit().setWindowSeconds(60);
    }

    @Test
    void shouldSkipRedisWhenDisabled() {
        StepVerifier.create(rateLimitService.check("sk-client")).verifyComplete();
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldAllowUntilLimitThenReject() {
        enable(2);
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("60"))).thenReturn(2L, 3L);

        StepVerifier.create(rateLimitService.check("sk-client")).verifyComplete();
        StepVerifier.create(rateLimitService.check("sk-client"))
                .expectErrorSatisfies(e -> assertEquals(GatewayErrorKind.RATE_LIMITED,
                        ((GatewayException) e).getKind()))
                .verify(Duration.ofSeconds(5));
        verify(redisTemplate, times(2)).execute(any(RedisScript.class),
                eq(List.of(RateLimitService.getRedisKey("sk-client"))), eq("60"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFailOpenWhenRedisIsDown() {
        enable(1);
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("60")))
                .thenThrow(new RedisConnectionFailureException("down"));

        StepVerifier.create(rateLimitService.check("sk-client")).verifyComplete();
    }

    @Test
    void shouldHashCredentialInRedisKey() {
        String key = RateLimitService.getRedisKey("sk-secret-value");
        assertTrue(key.startsWith("crescent:ratelimit:"));
        assertFalse(key.contains("sk-secret-value"));
        assertEquals("crescent:ratelimit:anonymous", RateLimitService.getRedisKey(null));
        assertNotEquals(key, RateLimitService.getRedisKey("sk-other"));
    }
}
