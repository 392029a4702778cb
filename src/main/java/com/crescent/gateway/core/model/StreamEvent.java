package com.crescent.gateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * 统一流式事件：type 为判别字段，payload 为关联数据
 * <p>
 * 网关自身识别的类型见下方常量，其它类型来自上游协议扩展，按原样透传。
 * 终止标记 [DONE] 不属于事件，由 StreamingProxy 在关闭时写出。
 */
@Value
public class StreamEvent {

    public static final String MESSAGE_START = "message.start";
    public static final String TEXT_DELTA = "text.delta";
    public static final String MESSAGE_DONE = "message.done";
    public static final String USAGE = "usage";
    public static final String ERROR = "error";

    String type;
    JsonNode payload;

    public static StreamEvent of(String type, JsonNode payload) {
        return new StreamEvent(type, payload == null ? JsonNodeFactory.instance.objectNode() : payload);
    }

    public static StreamEvent messageStart(String role) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("role", role == null ? "assistant" : role);
        return new StreamEvent(MESSAGE_START, payload);
    }

    public static StreamEvent textDelta(String text) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("text", text);
        return new StreamEvent(TEXT_DELTA, payload);
    }

    public static StreamEvent messageDone(String finishReason) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("finish_reason", finishReason == null ? "stop" : finishReason);
        return new StreamEvent(MESSAGE_DONE, payload);
    }

    public static StreamEvent usage(TokenUsage usage) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("prompt_tokens", usage.getPromptTokens());
        payload.put("completion_tokens", usage.getCompletionTokens());
        payload.put("total_tokens", usage.getTotalTokens());
        return new StreamEvent(USAGE, payload);
    }

    public static StreamEvent error(String message, String code) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("message", message);
        if (code != null) {
            payload.put("code", code);
        }
        return new StreamEvent(ERROR, payload);
    }

    public String text() {
        return payload.path("text").asText("");
    }

    public String role() {
        return payload.path("role").asText("assistant");
    }

    public String finishReason() {
        return payload.path("finish_reason").asText("stop");
    }

    public TokenUsage toUsage() {
        return TokenUsage.of(payload.path("prompt_tokens").asInt(0),
                payload.path("completion_tokens").asInt(0),
                payload.path("total_tokens").asInt(0));
    }
}
