package com.crescent.gateway.core.hook;

import com.crescent.gateway.core.model.Dialect;
import lombok.Value;

/**
 * 传给钩子的调用信息
 */
@Value(staticConstructor = "of")
public class HookContext {
    String requestId;
    String tenantId;
    Dialect dialect;
}
