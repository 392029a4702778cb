package com.crescent.gateway.core.hook;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 钩子注册表
 * <p>
 * 启动时收集全部 {@link GatewayHook} Bean，并按实现的子接口分组。
 * 没有注册任何钩子时各方法直接返回入参。
 */
@Slf4j
@Component
public class HookRegistry {

    private final List<RequestHook> requestHooks = new ArrayList<>();
    private final List<StreamingHook> streamingHooks = new ArrayList<>();
    private final List<ErrorHook> errorHooks = new ArrayList<>();

    @Autowired
    public HookRegistry(ObjectProvider<GatewayHook> hooks) {
        this(hooks.orderedStream().collect(Collectors.toList()));
    }

    public HookRegistry(List<? extends GatewayHook> hooks) {
        for (GatewayHook hook : hooks) {
            boolean matched = false;
            if (hook instanceof RequestHook) {
                requestHooks.add((RequestHook) hook);
                matched = true;
            }
            if (hook instanceof StreamingHook) {
                streamingHooks.add((StreamingHook) hook);
                matched = true;
            }
            if (hook instanceof ErrorHook) {
                errorHooks.add((ErrorHook) hook);
                matched = true;
            }
            if (!matched) {
                log.warn("Hook {} implements no known hook type and will never be called", hook.name());
            }
        }
        if (!hooks.isEmpty()) {
            log.info("Registered hooks: request={}, streaming={}, error={}",
                    requestHooks.size(), streamingHooks.size(), errorHooks.size());
        }
    }

    public static HookRegistry empty() {
        return new HookRegistry(Collections.emptyList());
    }

    public boolean hasStreamingHooks() {
        return !streamingHooks.isEmpty();
    }

    public CanonicalRequest beforeRequest(HookContext context, CanonicalRequest request) {
        CanonicalRequest current = request;
        for (RequestHook hook : requestHooks) {
            current = hook.beforeRequest(context, current);
            if (current == null) {
                throw GatewayException.internal(new IllegalStateException(
                        "Request hook " + hook.name() + " returned no request"));
            }
        }
        return current;
    }

    public CanonicalResponse afterResponse(HookContext context, CanonicalRequest request, CanonicalResponse response) {
        CanonicalResponse current = response;
        for (RequestHook hook : requestHooks) {
            current = hook.afterResponse(context, request, current);
            if (current == null) {
                throw GatewayException.internal(new IllegalStateException(
                        "Request hook " + hook.name() + " returned no response"));
            }
        }
        return current;
    }

    /**
     * @return 经过全部流式钩子后的事件；被某个钩子丢弃时返回 null
     */
    public StreamEvent onStreamEvent(HookContext context, StreamEvent event) {
        StreamEvent current = event;
        for (StreamingHook hook : streamingHooks) {
            current = hook.onEvent(context, current);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public void onError(HookContext context, GatewayException error) {
        for (ErrorHook hook : errorHooks) {
            try {
                hook.onError(context, error);
            } catch (RuntimeException e) {
                log.warn("Error hook {} failed for request {}: {}", hook.name(), context.getRequestId(), e.getMessage());
            }
        }
    }
}
