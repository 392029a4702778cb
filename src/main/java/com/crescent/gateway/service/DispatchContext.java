package com.crescent.gateway.service;

import com.crescent.gateway.core.auth.CredentialValidator;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 单次入站调用的上下文：请求 ID、调用方凭证、租户与超时
 */
@Value
@Builder
public class DispatchContext {

    String requestId;
    /** 不透明凭证，仅用于鉴权与限流，不会转发给上游 */
    String credential;
    /** 凭证所属租户，用于 token 配额 */
    @Builder.Default
    String tenantId = CredentialValidator.ANONYMOUS_TENANT;
    Duration timeout;
}
