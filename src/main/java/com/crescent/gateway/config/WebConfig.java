package com.crescent.gateway.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Web配置类
 *
 * <p>入站请求体可能包含大批量 embedding 输入，放宽默认的 256KB 内存缓冲上限。
 * 上游调用使用的 WebClient 由 {@link com.crescent.gateway.service.UpstreamWebClientManager} 按服务商管理。
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebFluxConfigurer {

    private final GatewayProperties properties;

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        configurer.defaultCodecs().maxInMemorySize(properties.getUpstream().getMaxInMemorySize());
    }
}
