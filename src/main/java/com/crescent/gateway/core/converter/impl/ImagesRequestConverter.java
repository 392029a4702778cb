package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.converter.RequestConverter;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 构造发往图片生成上游的请求体：改写模型名，其余参数原样透传
 */
@Component
@RequiredArgsConstructor
public class ImagesRequestConverter implements RequestConverter {

    private final ObjectMapper objectMapper;

    @Override
    public JsonNode convert(ModelRoute route, CanonicalRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", route.resolveUpstreamModel());
        payload.put("prompt", request.getPrompt());
        ConverterSupport.copyOptions(payload, request, true, Map.of());
        return payload;
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.IMAGES;
    }
}
