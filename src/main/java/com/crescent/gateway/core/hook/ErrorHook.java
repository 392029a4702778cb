package com.crescent.gateway.core.hook;

import com.crescent.gateway.core.error.GatewayException;

/**
 * 错误钩子：调用以错误结束时通知，包括流式调用的带内错误
 * <p>
 * 只做观察，钩子自身的异常会被记录并忽略。
 */
public interface ErrorHook extends GatewayHook {

    void onError(HookContext context, GatewayException error);
}
