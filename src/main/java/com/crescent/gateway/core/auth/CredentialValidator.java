package com.crescent.gateway.core.auth;

import reactor.core.publisher.Mono;

/**
 * 外部凭证校验协作者
 * <p>
 * 网关只把 Bearer 凭证当作不透明字符串交给实现方判断，实现方同时给出调用方所属的租户。
 */
public interface CredentialValidator {

    /** 无凭证调用所属的租户 */
    String ANONYMOUS_TENANT = "anonymous";

    /**
     * @param credential Authorization 头中 Bearer 之后的部分，可能为 null
     * @return 放行时返回租户 ID；拒绝时返回空
     */
    Mono<String> authenticate(String credential);
}
