package com.crescent.gateway.core.auth;

import com.crescent.gateway.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * 基于配置项 gateway.auth 的默认校验实现
 * <p>
 * 未配置任何 key 时放行所有请求。属于 gateway.auth.tenants 的 key 归到对应租户，
 * 其它 key 以摘要作为租户 ID，无凭证的调用归到 anonymous。
 */
@Component
@RequiredArgsConstructor
public class StaticCredentialValidator implements CredentialValidator {

    private final GatewayProperties properties;

    @Override
    public Mono<String> authenticate(String credential) {
        GatewayProperties.Auth auth = properties.getAuth();
        if (credential != null) {
            for (GatewayProperties.Tenant tenant : auth.getTenants()) {
                if (tenant.getApiKeys().contains(credential)) {
                    return Mono.just(tenant.getId());
                }
            }
        }
        Set<String> keys = auth.getApiKeys();
        boolean open = (keys == null || keys.isEmpty()) && auth.getTenants().isEmpty();
        if (open || (credential != null && keys != null && keys.contains(credential))) {
            return Mono.just(defaultTenant(credential));
        }
        return Mono.empty();
    }

    public static String defaultTenant(String credential) {
        if (credential == null) {
            return ANONYMOUS_TENANT;
        }
        return "key-" + DigestUtils.md5DigestAsHex(credential.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }
}
