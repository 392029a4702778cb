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

import java.util.List;
import java.util.Map;

/**
 * 构造发往 Responses 上游的请求体
 * <p>
 * 开头连续的 system 消息合并为 instructions，其余消息转为 message 输入项。
 */
@Component
@RequiredArgsConstructor
public class ResponsesRequestConverter implements RequestConverter {

    private static final Map<String, String> FROM_CHAT = Map.of(
            "max_tokens", "max_output_tokens",
            "max_completion_tokens", "max_output_tokens");

    private final ObjectMapper objectMapper;

    @Override
    public JsonNode convert(ModelRoute route, CanonicalRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", route.resolveUpstreamModel());

        List<CanonicalMessage> messages = request.getMessages();
        int first = 0;
        StringBuilder instructions = new StringBuilder();
        while (first < messages.size() && "system".equals(messages.get(first).getRole())) {
            if (instructions.length() > 0) {
                instructions.append("\n\n");
            }
            instructions.append(messages.get(first).getContent());
            first++;
        }
        if (first > 0) {
            payload.put("instructions", instructions.toString());
        }

        ArrayNode input = payload.putArray("input");
        for (CanonicalMessage message : messages.subList(first, messages.size())) {
            input.addObject()
                    .put("type", "message")
                    .put("role", message.getRole())
                    .put("content", message.getContent());
        }
        if (request.getTemperature() != null) {
            payload.put("temperature", request.getTemperature());
        }
        payload.put("stream", request.isStream());

        boolean sameDialect = request.getDialect() == Dialect.RESPONSES;
        ConverterSupport.copyOptions(payload, request, sameDialect, FROM_CHAT);
        return payload;
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.RESPONSES;
    }
}
