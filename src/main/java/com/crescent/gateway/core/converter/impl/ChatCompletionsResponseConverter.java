package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.converter.ResponseConverter;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.core.model.StreamEvent;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析 Chat-Completions 上游响应
 * <p>
 * 同步响应读取 {@code choices[0].message}；流式分片中 delta.role、delta.content、
 * finish_reason 与 usage 分别映射为 message.start、text.delta、message.done 与 usage 事件。
 */
@Slf4j
@Component
public class ChatCompletionsResponseConverter implements ResponseConverter {

    @Override
    public CanonicalResponse convert(ModelRoute route, JsonNode upstreamBody) {
        ConverterSupport.rejectErrorBody(upstreamBody);
        JsonNode choice = upstreamBody.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw GatewayException.upstream("Upstream response from " + route.getProviderId() + " has no choices");
        }
        JsonNode message = choice.path("message");
        return CanonicalResponse.builder()
                .id(ConverterSupport.textOrNull(upstreamBody.get("id")))
                .model(route.getModelName())
                .createdAt(upstreamBody.path("created").asLong(0))
                .block(ContentBlock.text(message.path("role").asText("assistant"),
                        ConverterSupport.textOrNull(message.get("content"))))
                .finishReason(ConverterSupport.textOrNull(choice.get("finish_reason")))
                .usage(ConverterSupport.readUsage(upstreamBody.get("usage"), "prompt_tokens", "completion_tokens"))
                .build();
    }

    @Override
    public List<StreamEvent> convertChunk(ModelRoute route, JsonNode chunk) {
        JsonNode error = chunk.get("error");
        if (error != null && error.isObject()) {
            return List.of(StreamEvent.error(error.path("message").asText("Upstream stream error"),
                    ConverterSupport.textOrNull(error.get("code"))));
        }
        JsonNode choices = chunk.get("choices");
        JsonNode usage = chunk.get("usage");
        if (choices == null && (usage == null || usage.isNull())) {
            // 非标准分片（例如服务商自定义事件）按原样透传
            String type = chunk.path("type").asText(chunk.path("object").asText("unknown"));
            return List.of(StreamEvent.of(type, chunk));
        }

        List<StreamEvent> events = new ArrayList<>(3);
        JsonNode choice = choices == null ? null : choices.path(0);
        if (choice != null && !choice.isMissingNode()) {
            JsonNode delta = choice.path("delta");
            if (delta.path("role").isTextual()) {
                events.add(StreamEvent.messageStart(delta.get("role").asText()));
            }
            JsonNode content = delta.get("content");
            if (content != null && content.isTextual() && !content.asText().isEmpty()) {
                events.add(StreamEvent.textDelta(content.asText()));
            }
            JsonNode finishReason = choice.get("finish_reason");
            if (finishReason != null && !finishReason.isNull()) {
                events.add(StreamEvent.messageDone(finishReason.asText()));
            }
        }
        TokenUsage tokenUsage = ConverterSupport.readUsage(usage, "prompt_tokens", "completion_tokens");
        if (tokenUsage != null) {
            events.add(StreamEvent.usage(tokenUsage));
        }
        if (events.isEmpty() && log.isDebugEnabled()) {
            log.debug("Ignored empty chunk from {}", route.getProviderId());
        }
        return events.isEmpty() ? Collections.emptyList() : events;
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.CHAT_COMPLETIONS;
    }
}
