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
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;

/**
 * 解析 Embeddings 上游响应，向量按上游返回的 index 排序
 * <p>
 * index 是相对于本次上游请求（即一个分片）的下标。
 */
@Component
public class EmbeddingsResponseConverter implements ResponseConverter {

    @Override
    public CanonicalResponse convert(ModelRoute route, JsonNode upstreamBody) {
        ConverterSupport.rejectErrorBody(upstreamBody);
        JsonNode data = upstreamBody.get("data");
        if (data == null || !data.isArray()) {
            throw GatewayException.upstream("Upstream response from " + route.getProviderId() + " has no data");
        }

        List<ContentBlock> blocks = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            blocks.add(ContentBlock.embedding(index, readVector(item.get("embedding"), index)));
        }
        blocks.sort(Comparator.comparingInt(ContentBlock::getIndex));

        JsonNode usage = upstreamBody.get("usage");
        TokenUsage tokenUsage = null;
        if (usage != null && usage.isObject()) {
            int prompt = usage.path("prompt_tokens").asInt(0);
            tokenUsage = TokenUsage.of(prompt, 0, usage.path("total_tokens").asInt(prompt));
        }
        return CanonicalResponse.builder()
                .model(route.getModelName())
                .output(blocks)
                .usage(tokenUsage)
                .build();
    }

    private static float[] readVector(JsonNode embedding, int index) {
        if (embedding != null && embedding.isArray()) {
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                JsonNode value = embedding.get(i);
                if (!value.isNumber()) {
                    throw GatewayException.upstream("Upstream embedding " + index + " contains a non-numeric value");
                }
                vector[i] = value.floatValue();
            }
            return vector;
        }
        if (embedding != null && embedding.isTextual()) {
            byte[] bytes;
            try {
                bytes = Base64.getDecoder().decode(embedding.asText());
            } catch (IllegalArgumentException e) {
                throw GatewayException.upstream("Upstream embedding " + index + " is not valid base64", e);
            }
            ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
            float[] vector = new float[buffer.remaining() / Float.BYTES];
            buffer.asFloatBuffer().get(vector);
            return vector;
        }
        throw GatewayException.upstream("Upstream embedding " + index + " is missing");
    }

    @Override
    public List<StreamEvent> convertChunk(ModelRoute route, JsonNode chunk) {
        throw GatewayException.internal(new UnsupportedOperationException("Embeddings do not stream"));
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.EMBEDDINGS;
    }
}
