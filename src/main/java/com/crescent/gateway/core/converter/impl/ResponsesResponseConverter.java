package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.converter.ResponseConverter;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.core.model.ResponseStatus;
import com.crescent.gateway.core.model.StreamEvent;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 解析 Responses 上游响应
 * <p>
 * 生命周期类事件（created、in_progress、*.done 等）由入站编码器重新生成，这里直接吸收；
 * 只有文本增量、消息开始、完成、用量与错误会转换为统一事件，其余类型原样透传。
 */
@Component
public class ResponsesResponseConverter implements ResponseConverter {

    private static final Set<String> LIFECYCLE_EVENTS = Set.of(
            "response.created",
            "response.in_progress",
            "response.queued",
            "response.content_part.added",
            "response.content_part.done",
            "response.output_text.done",
            "response.output_item.done");

    @Override
    public CanonicalResponse convert(ModelRoute route, JsonNode upstreamBody) {
        ConverterSupport.rejectErrorBody(upstreamBody);
        JsonNode output = upstreamBody.get("output");
        if (output == null || !output.isArray()) {
            throw GatewayException.upstream("Upstream response from " + route.getProviderId() + " has no output");
        }
        ResponseStatus status = ResponseStatus.fromCode(ConverterSupport.textOrNull(upstreamBody.get("status")));
        CanonicalResponse.CanonicalResponseBuilder builder = CanonicalResponse.builder()
                .id(ConverterSupport.textOrNull(upstreamBody.get("id")))
                .model(route.getModelName())
                .status(status)
                .createdAt(upstreamBody.path("created_at").asLong(0))
                .finishReason(status == ResponseStatus.INCOMPLETE ? "length" : "stop")
                .usage(ConverterSupport.readUsage(upstreamBody.get("usage"), "input_tokens", "output_tokens"));

        for (JsonNode item : output) {
            if (!"message".equals(item.path("type").asText())) {
                continue;
            }
            String role = item.path("role").asText("assistant");
            for (JsonNode part : item.path("content")) {
                if ("output_text".equals(part.path("type").asText())) {
                    builder.block(ContentBlock.text(role, part.path("text").asText("")));
                }
            }
        }
        return builder.build();
    }

    @Override
    public List<StreamEvent> convertChunk(ModelRoute route, JsonNode chunk) {
        String type = chunk.path("type").asText("");
        if (LIFECYCLE_EVENTS.contains(type)) {
            return Collections.emptyList();
        }
        switch (type) {
            case "response.output_item.added": {
                JsonNode item = chunk.path("item");
                if (!"message".equals(item.path("type").asText())) {
                    return Collections.emptyList();
                }
                return List.of(StreamEvent.messageStart(item.path("role").asText("assistant")));
            }
            case "response.output_text.delta":
                return List.of(StreamEvent.textDelta(chunk.path("delta").asText("")));
            case "response.completed":
            case "response.incomplete": {
                // 与 Chat-Completions 上游一致：先结束消息，再给出 usage
                List<StreamEvent> events = new ArrayList<>(2);
                events.add(StreamEvent.messageDone("response.incomplete".equals(type) ? "length" : "stop"));
                TokenUsage usage = ConverterSupport.readUsage(chunk.path("response").get("usage"),
                        "input_tokens", "output_tokens");
                if (usage != null) {
                    events.add(StreamEvent.usage(usage));
                }
                return events;
            }
            case "response.failed": {
                JsonNode error = chunk.path("response").path("error");
                return List.of(StreamEvent.error(error.path("message").asText("Upstream response failed"),
                        ConverterSupport.textOrNull(error.get("code"))));
            }
            case "error":
                return List.of(StreamEvent.error(chunk.path("message").asText("Upstream stream error"),
                        ConverterSupport.textOrNull(chunk.get("code"))));
            default:
                return List.of(StreamEvent.of(type.isEmpty() ? "unknown" : type, chunk));
        }
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.RESPONSES;
    }
}
