package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.converter.RequestConverter;
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
 * 构造发往 Embeddings 上游的请求体
 * <p>
 * 每次只携带一个分片的输入；上游总是以 float 格式返回，客户端要求的 base64 由入站适配器编码。
 */
@Component
@RequiredArgsConstructor
public class EmbeddingsRequestConverter implements RequestConverter {

    private final ObjectMapper objectMapper;

    @Override
    public JsonNode convert(ModelRoute route, CanonicalRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", route.resolveUpstreamModel());
        ArrayNode input = payload.putArray("input");
        request.getInputs().forEach(input::add);
        if (request.getDimensions() != null) {
            payload.put("dimensions", request.getDimensions());
        }
        payload.put("encoding_format", "float");
        ConverterSupport.copyOptions(payload, request, true, Map.of());
        return payload;
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.EMBEDDINGS;
    }
}
