package com.crescent.gateway.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 对应数据库中的 model_route 表（或配置文件中的 gateway.routes）
 * <p>
 * 每一个对象描述一个对外模型名到上游服务端点的映射。
 * 加载进注册表之后不再修改，只会被新的快照整体替换。
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString(exclude = "apiKey")
public class ModelRoute {
    private Long id;
    private String modelName;     // 客户端请求中的 model, e.g. "gpt-4o"
    private String providerId;    // e.g. "openai"
    private Dialect providerDialect;
    private String endpointUrl;   // 完整的上游地址, e.g. "https://api.openai.com/v1/chat/completions"
    private String apiKey;
    /** 发往上游时改写的模型名；为空则沿用 modelName */
    private String upstreamModel;
    /** 单次上游 embedding 请求允许的最大输入条数；为空时使用全局配置 */
    private Integer maxBatchSize;
    private Boolean enabled;

    public String resolveUpstreamModel() {
        if (upstreamModel == null || upstreamModel.isBlank()) {
            return modelName;
        }
        return upstreamModel;
    }

    public boolean isActive() {
        return enabled == null || enabled;
    }

    /**
     * 连接池复用键：同一服务商、同一主机共享一个 WebClient
     */
    public String clientKey() {
        String origin = endpointUrl;
        if (endpointUrl != null) {
            int schemeEnd = endpointUrl.indexOf("://");
            int pathStart = schemeEnd < 0 ? -1 : endpointUrl.indexOf('/', schemeEnd + 3);
            if (pathStart > 0) {
                origin = endpointUrl.substring(0, pathStart);
            }
        }
        return providerId + "@" + origin;
    }
}
