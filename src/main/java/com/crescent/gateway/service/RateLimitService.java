package com.crescent.gateway.service;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.error.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

/**
 * 按调用方凭证的固定窗口限流
 * <p>
 * 计数保存在 Redis，使用 Lua 脚本保证自增与设置过期时间的原子性。
 * Redis 不可用时放行请求并记录告警。
 */
@Slf4j
@Service
public class RateLimitService {

    private static final String RATE_LIMIT_KEY_PREFIX = "crescent:ratelimit:";

    /**
     * Lua 脚本：计数 +1，窗口内首次计数时设置过期时间，返回当前计数
     */
    private static final String INCREMENT_SCRIPT =
            "local current = redis.call('incr', KEYS[1]) " +
            "if current == 1 then " +
            "  redis.call('expire', KEYS[1], ARGV[1]) " +
            "end " +
            "return current";

    private final StringRedisTemplate stringRedisTemplate;
    private final GatewayProperties properties;
    private final DefaultRedisScript<Long> incrementScript;

    public RateLimitService(StringRedisTemplate stringRedisTemplate, GatewayProperties properties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.properties = properties;
        this.incrementScript = new DefaultRedisScript<>();
        this.incrementScript.setScriptText(INCREMENT_SCRIPT);
        this.incrementScript.setResultType(Long.class);
    }

    /**
     * 检查并计数一次调用
     *
     * @param credential 调用方凭证，可为空
     * @return 未超限时正常完成；超限时以 RATE_LIMITED 结束
     */
    public Mono<Void> check(String credential) {
        GatewayProperties.RateLimit settings = properties.getRateLimit();
        if (!settings.isEnabled()) {
            return Mono.empty();
        }
        String redisKey = getRedisKey(credential);
        // RedisTemplate 是阻塞调用，切到 boundedElastic 执行
        return Mono.fromCallable(() -> increment(redisKey, settings.getWindowSeconds()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(count -> {
                    if (count > settings.getRequestsPerWindow()) {
                        return Mono.error(GatewayException.rateLimited("Rate limit exceeded: "
                                + settings.getRequestsPerWindow() + " requests per "
                                + settings.getWindowSeconds() + "s"));
                    }
                    return Mono.<Void>empty();
                });
    }

    private long increment(String redisKey, int windowSeconds) {
        try {
            Long result = stringRedisTemplate.execute(
                    incrementScript,
                    Collections.singletonList(redisKey),
                    String.valueOf(windowSeconds));
            return result == null ? 0L : result;
        } catch (Exception e) {
            // Redis 故障时放行，优先保证可用性
            log.warn("Rate limit check failed, allowing request: {}", e.getMessage());
            return 0L;
        }
    }

    /**
     * 凭证只以摘要形式出现在 Redis key 中
     */
    static String getRedisKey(String credential) {
        if (credential == null || credential.isEmpty()) {
            return RATE_LIMIT_KEY_PREFIX + "anonymous";
        }
        return RATE_LIMIT_KEY_PREFIX + DigestUtils.md5DigestAsHex(credential.getBytes(StandardCharsets.UTF_8));
    }
}
