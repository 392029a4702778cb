package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.converter.RequestConverter;
import com.crescent.gateway.core.model.CanonicalMessage;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 构造发往 Chat-Completions 上游的请求体
 * <p>
 * 流式请求总是附带 {@code stream_options.include_usage}，以便在流尾拿到用量；
 * 客户端是否需要 usage 帧由入站编码器决定。
 */
@Component
@RequiredArgsConstructor
public class ChatCompletionsRequestConverter implements RequestConverter {

    private static final Map<String, String> FROM_RESPONSES = Map.of("max_output_tokens", "max_tokens");

    private final ObjectMapper objectMapper;

    @Override
    public JsonNode convert(ModelRoute route, CanonicalRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", route.resolveUpstreamModel());

        ArrayNode messages = payload.putArray("messages");
        for (CanonicalMessage message : request.getMessages()) {
            messages.addObject()
                    .put("role", message.getRole())
                    .put("content", message.getContent());
        }
        if (request.getTemperature() != null) {
            payload.put("temperature", request.getTemperature());
        }
        payload.put("stream", request.isStream());

        boolean sameDialect = request.getDialect() == Dialect.CHAT_COMPLETIONS;
        ConverterSupport.copyOptions(payload, request, sameDialect, FROM_RESPONSES);
        if (request.isStream() && !payload.has("stream_options")) {
            payload.putObject("stream_options").put("include_usage", true);
        }
        return payload;
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.CHAT_COMPLETIONS;
    }
}
