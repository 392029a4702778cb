package com.crescent.gateway.config;

import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 网关配置，对应 application.yml 中的 gateway.* 节点
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** 单次调用的默认超时；调用方通过请求头传入的超时不能超过该值 */
    private Duration requestTimeout = Duration.ofSeconds(120);

    private Upstream upstream = new Upstream();

    private StreamSettings stream = new StreamSettings();

    private Embeddings embeddings = new Embeddings();

    private Auth auth = new Auth();

    private RateLimit rateLimit = new RateLimit();

    private Registry registry = new Registry();

    private Quota quota = new Quota();

    /** 静态路由，数据库中同名路由会覆盖这里的配置 */
    private List<Route> routes = new ArrayList<>();

    @Data
    public static class Upstream {
        private int connectTimeoutMs = 5000;
        private Duration readTimeout = Duration.ofSeconds(120);
        private int maxConnections = 200;
        private int maxInMemorySize = 16 * 1024 * 1024;
    }

    @Data
    public static class StreamSettings {
        /** 两个上游分片之间允许的最长间隔 */
        private Duration idleTimeout = Duration.ofSeconds(60);
        /** 上游读取与客户端写出之间的预取窗口 */
        private int bufferSize = 64;
    }

    @Data
    public static class Embeddings {
        private int chunkSize = 96;
        private int maxConcurrency = 4;
    }

    @Data
    public static class Auth {
        private Set<String> apiKeys = new LinkedHashSet<>();
        /** 按租户分组的 key；租户 ID 用于配额统计 */
        private List<Tenant> tenants = new ArrayList<>();
    }

    @Data
    public static class Tenant {
        private String id;
        private Set<String> apiKeys = new LinkedHashSet<>();
    }

    @Data
    public static class Quota {
        private boolean enabled = false;
        /** 租户默认 token 额度，0 表示不限 */
        private long defaultLimit = 0L;
        private QuotaResetPeriod resetPeriod = QuotaResetPeriod.DAILY;
        /** 按租户 ID 覆盖默认额度 */
        private Map<String, Long> limits = new LinkedHashMap<>();
        /** 清理过期窗口的间隔 */
        private long sweepIntervalMs = 60000L;
    }

    public enum QuotaResetPeriod {
        HOURLY,
        DAILY,
        WEEKLY,
        MONTHLY,
        NEVER
    }

    @Data
    public static class RateLimit {
        private boolean enabled = false;
        private int requestsPerWindow = 600;
        private int windowSeconds = 60;
    }

    @Data
    public static class Registry {
        private long refreshIntervalMs = 30000L;
    }

    @Data
    public static class Route {
        private String modelName;
        private String providerId;
        private Dialect providerDialect;
        private String endpointUrl;
        private String apiKey;
        private String upstreamModel;
        private Integer maxBatchSize;
        private Boolean enabled = true;

        public ModelRoute toModelRoute() {
            return ModelRoute.builder()
                    .modelName(modelName)
                    .providerId(providerId)
                    .providerDialect(providerDialect)
                    .endpointUrl(endpointUrl)
                    .apiKey(apiKey)
                    .upstreamModel(upstreamModel)
                    .maxBatchSize(maxBatchSize)
                    .enabled(enabled)
                    .build();
        }
    }
}
