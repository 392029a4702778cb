package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Set;

/**
 * 转换器共用的小工具
 */
final class ConverterSupport {

    /**
     * 在 Chat-Completions 与 Responses 之间语义一致、可以直接搬运的参数
     */
    static final Set<String> PORTABLE_OPTIONS = Set.of(
            "top_p", "user", "metadata", "store", "parallel_tool_calls", "seed");

    private ConverterSupport() {
    }

    /**
     * 同方言时原样复制全部透传参数；跨方言时只复制可移植参数，并按 renames 改名
     */
    static void copyOptions(ObjectNode target, CanonicalRequest request, boolean sameDialect,
                            Map<String, String> renames) {
        for (Map.Entry<String, JsonNode> entry : request.getExtraOptions().entrySet()) {
            String name = entry.getKey();
            if (target.has(name)) {
                continue;
            }
            if (sameDialect || PORTABLE_OPTIONS.contains(name)) {
                target.set(name, entry.getValue());
            } else if (renames.containsKey(name) && !target.has(renames.get(name))) {
                target.set(renames.get(name), entry.getValue());
            }
        }
    }

    /**
     * 上游在 200 响应体里携带 error 对象时转换为 UPSTREAM_ERROR
     */
    static void rejectErrorBody(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw GatewayException.upstream("Upstream returned a non-object response body");
        }
        JsonNode error = body.get("error");
        if (error != null && error.isObject()) {
            throw GatewayException.upstream("Upstream error: " + error.path("message").asText("unknown error"));
        }
    }

    static TokenUsage readUsage(JsonNode usage, String promptField, String completionField) {
        if (usage == null || !usage.isObject()) {
            return null;
        }
        int prompt = usage.path(promptField).asInt(0);
        int completion = usage.path(completionField).asInt(0);
        int total = usage.path("total_tokens").asInt(prompt + completion);
        return TokenUsage.of(prompt, completion, total);
    }

    static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
