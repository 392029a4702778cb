package com.crescent.gateway.service;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.auth.CredentialValidator;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.TokenUsage;
import com.crescent.gateway.dto.TenantQuotaDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按租户的 token 配额
 * <p>
 * 用量保存在内存中，按 reset-period 划分窗口，窗口到期后在下次访问或定时清理时归零。
 * 检查发生在请求发往上游之前，只要当前窗口用量未达到额度就放行，因此单个请求可能超出剩余额度。
 * 每个租户的记录是不可变对象，通过 {@link ConcurrentHashMap#compute} 原子替换。
 */
@Slf4j
@Service
public class QuotaService {

    private final GatewayProperties properties;
    private final Clock clock;
    private final Map<String, TenantUsage> usages = new ConcurrentHashMap<>();

    @Autowired
    public QuotaService(GatewayProperties properties) {
        this(properties, Clock.systemDefaultZone());
    }

    QuotaService(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 检查租户是否还有额度
     *
     * @throws GatewayException RATE_LIMITED（insufficient_quota），当前窗口用量已达到额度
     */
    public void check(String tenantId) {
        GatewayProperties.Quota settings = properties.getQuota();
        if (!settings.isEnabled()) {
            return;
        }
        String key = tenantKey(tenantId);
        TenantUsage usage = current(key);
        long limit = limitOf(key, usage);
        if (limit > 0 && usage.totalTokens >= limit) {
            log.debug("Tenant {} exhausted its quota: {}/{} tokens", key, usage.totalTokens, limit);
            throw GatewayException.quotaExceeded("You exceeded your token quota of " + limit
                    + " tokens" + (usage.resetAt == null ? "" : "; it resets at " + usage.resetAt));
        }
    }

    /**
     * 记录一次成功调用的 token 用量，上游未返回 usage 时不记录
     */
    public void record(String tenantId, TokenUsage tokenUsage) {
        if (!properties.getQuota().isEnabled() || tokenUsage == null) {
            return;
        }
        Instant now = clock.instant();
        usages.compute(tenantKey(tenantId), (key, existing) -> rollOver(key, existing, now).plus(tokenUsage, now));
    }

    public TenantQuotaDto getUsage(String tenantId) {
        String key = tenantKey(tenantId);
        return toDto(key, current(key));
    }

    public List<TenantQuotaDto> listUsage() {
        List<TenantQuotaDto> result = new ArrayList<>(usages.size());
        for (String tenantId : usages.keySet()) {
            result.add(toDto(tenantId, current(tenantId)));
        }
        result.sort(Comparator.comparing(TenantQuotaDto::getTenantId));
        return result;
    }

    /**
     * 为租户单独设置额度，优先于配置文件
     *
     * @param limit 额度，0 表示不限
     */
    public TenantQuotaDto setLimit(String tenantId, long limit) {
        if (limit < 0) {
            throw GatewayException.badRequest("'limit' must not be negative", "limit");
        }
        Instant now = clock.instant();
        String key = tenantKey(tenantId);
        TenantUsage updated = usages.compute(key, (k, existing) -> rollOver(k, existing, now).withLimit(limit, now));
        log.info("Token quota of tenant {} set to {}", key, limit);
        return toDto(key, updated);
    }

    public void reset(String tenantId) {
        Instant now = clock.instant();
        usages.computeIfPresent(tenantKey(tenantId), (key, existing) -> existing.cleared(nextResetAt(now), now));
    }

    /**
     * @return 被重置的租户数
     */
    public int resetAll() {
        Instant now = clock.instant();
        Instant resetAt = nextResetAt(now);
        int count = 0;
        for (String key : usages.keySet()) {
            if (usages.computeIfPresent(key, (k, existing) -> existing.cleared(resetAt, now)) != null) {
                count++;
            }
        }
        log.info("Reset token usage of {} tenant(s)", count);
        return count;
    }

    /**
     * 定时把已过期的窗口归零
     */
    @Scheduled(fixedDelayString = "${gateway.quota.sweep-interval-ms:60000}")
    public void sweepExpired() {
        if (!properties.getQuota().isEnabled()) {
            return;
        }
        Instant now = clock.instant();
        for (String key : usages.keySet()) {
            usages.computeIfPresent(key, (k, existing) -> rollOver(k, existing, now));
        }
    }

    private TenantUsage current(String tenantId) {
        Instant now = clock.instant();
        TenantUsage usage = usages.get(tenantId);
        if (usage == null) {
            return TenantUsage.empty(nextResetAt(now));
        }
        return usage.isExpired(now) ? usage.cleared(nextResetAt(now), usage.lastUpdated) : usage;
    }

    private TenantUsage rollOver(String tenantId, TenantUsage existing, Instant now) {
        if (existing == null) {
            return TenantUsage.empty(nextResetAt(now));
        }
        if (existing.isExpired(now)) {
            log.debug("Token quota window of tenant {} expired, usage reset", tenantId);
            return existing.cleared(nextResetAt(now), now);
        }
        return existing;
    }

    private long limitOf(String tenantId, TenantUsage usage) {
        if (usage.limitOverride != null) {
            return usage.limitOverride;
        }
        GatewayProperties.Quota settings = properties.getQuota();
        Long configured = settings.getLimits().get(tenantId);
        return configured != null ? configured : settings.getDefaultLimit();
    }

    Instant nextResetAt(Instant now) {
        ZonedDateTime time = now.atZone(clock.getZone());
        switch (properties.getQuota().getResetPeriod()) {
            case HOURLY:
                return time.truncatedTo(ChronoUnit.HOURS).plusHours(1).toInstant();
            case DAILY:
                return time.toLocalDate().plusDays(1).atStartOfDay(clock.getZone()).toInstant();
            case WEEKLY:
                return time.toLocalDate().with(TemporalAdjusters.next(DayOfWeek.MONDAY))
                        .atStartOfDay(clock.getZone()).toInstant();
            case MONTHLY:
                LocalDate firstOfNextMonth = time.toLocalDate().with(TemporalAdjusters.firstDayOfNextMonth());
                return firstOfNextMonth.atStartOfDay(clock.getZone()).toInstant();
            case NEVER:
            default:
                return null;
        }
    }

    private TenantQuotaDto toDto(String tenantId, TenantUsage usage) {
        long limit = limitOf(tenantId, usage);
        return TenantQuotaDto.builder()
                .tenantId(tenantId)
                .inputTokens(usage.inputTokens)
                .outputTokens(usage.outputTokens)
                .totalTokens(usage.totalTokens)
                .quotaLimit(limit)
                .remaining(limit > 0 ? Math.max(0L, limit - usage.totalTokens) : null)
                .resetAt(usage.resetAt == null ? null : usage.resetAt.toString())
                .lastUpdated(usage.lastUpdated == null ? null : usage.lastUpdated.toString())
                .build();
    }

    private static String tenantKey(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? CredentialValidator.ANONYMOUS_TENANT : tenantId;
    }

    /**
     * 单个租户在当前窗口内的用量
     */
    private static final class TenantUsage {
        private final long inputTokens;
        private final long outputTokens;
        private final long totalTokens;
        /** 通过管理接口设置的额度，为空时使用配置 */
        private final Long limitOverride;
        /** 为空表示不自动重置 */
        private final Instant resetAt;
        private final Instant lastUpdated;

        private TenantUsage(long inputTokens, long outputTokens, long totalTokens, Long limitOverride,
                            Instant resetAt, Instant lastUpdated) {
            this.inputTokens = inputTokens;
            this.outputTokens = outputTokens;
            this.totalTokens = totalTokens;
            this.limitOverride = limitOverride;
            this.resetAt = resetAt;
            this.lastUpdated = lastUpdated;
        }

        static TenantUsage empty(Instant resetAt) {
            return new TenantUsage(0L, 0L, 0L, null, resetAt, null);
        }

        boolean isExpired(Instant now) {
            return resetAt != null && !now.isBefore(resetAt);
        }

        TenantUsage plus(TokenUsage usage, Instant now) {
            return new TenantUsage(inputTokens + usage.getPromptTokens(),
                    outputTokens + usage.getCompletionTokens(),
                    totalTokens + usage.getTotalTokens(),
                    limitOverride, resetAt, now);
        }

        TenantUsage withLimit(long limit, Instant now) {
            return new TenantUsage(inputTokens, outputTokens, totalTokens, limit, resetAt, now);
        }

        TenantUsage cleared(Instant nextResetAt, Instant now) {
            return new TenantUsage(0L, 0L, 0L, limitOverride, nextResetAt, now);
        }
    }
}
