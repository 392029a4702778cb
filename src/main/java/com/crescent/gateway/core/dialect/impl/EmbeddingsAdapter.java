package com.crescent.gateway.core.dialect.impl;

import com.crescent.gateway.api.EmbeddingResponse;
import com.crescent.gateway.core.dialect.AbstractDialectAdapter;
import com.crescent.gateway.core.dialect.StreamEncoder;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Set;

/**
 * Embeddings 方言适配器
 * <p>
 * 只支持同步调用。input 为字符串或字符串数组，条数不受上游单批上限约束，
 * 超出部分由 EmbeddingBatchCoordinator 分片处理。
 */
@Component
public class EmbeddingsAdapter extends AbstractDialectAdapter {

    static final String ENCODING_FORMAT = "encoding_format";

    private static final Set<String> KNOWN_FIELDS = Set.of("model", "input", "dimensions", "stream");
    private static final Set<String> ENCODING_FORMATS = Set.of("float", "base64");

    public EmbeddingsAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Dialect dialect() {
        return Dialect.EMBEDDINGS;
    }

    @Override
    public CanonicalRequest decode(JsonNode payload) {
        requireObject(payload);
        CanonicalRequest.CanonicalRequestBuilder builder = CanonicalRequest.builder()
                .dialect(Dialect.EMBEDDINGS)
                .model(requireModel(payload))
                .dimensions(readDimensions(payload));

        if (readStream(payload)) {
            throw GatewayException.badRequest("Streaming is not supported for embeddings", "stream");
        }

        JsonNode input = payload.get("input");
        if (input == null || input.isNull()) {
            throw GatewayException.badRequest("Missing required parameter: 'input'", "input");
        }
        if (input.isTextual()) {
            builder.input(requireText(input, "input"));
        } else if (input.isArray()) {
            if (input.isEmpty()) {
                throw GatewayException.badRequest("'input' must not be empty", "input");
            }
            for (int i = 0; i < input.size(); i++) {
                JsonNode item = input.get(i);
                if (!item.isTextual()) {
                    throw GatewayException.badRequest("input[" + i + "] must be a string; token arrays are not supported",
                            "input");
                }
                builder.input(requireText(item, "input[" + i + "]"));
            }
        } else {
            throw GatewayException.badRequest("'input' must be a string or an array of strings", "input");
        }

        JsonNode encodingFormat = payload.get(ENCODING_FORMAT);
        if (encodingFormat != null && !encodingFormat.isNull()
                && !(encodingFormat.isTextual() && ENCODING_FORMATS.contains(encodingFormat.asText()))) {
            throw GatewayException.badRequest("'encoding_format' must be one of: float, base64", ENCODING_FORMAT);
        }

        copyExtraOptions(payload, KNOWN_FIELDS, builder);
        return builder.build();
    }

    private static String requireText(JsonNode node, String param) {
        if (node.asText().isEmpty()) {
            throw GatewayException.badRequest(param + " must not be an empty string", "input");
        }
        return node.asText();
    }

    private static Integer readDimensions(JsonNode payload) {
        JsonNode node = payload.get("dimensions");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber() || node.asInt() <= 0) {
            throw GatewayException.badRequest("'dimensions' must be a positive integer", "dimensions");
        }
        return node.asInt();
    }

    @Override
    public JsonNode encode(CanonicalResponse response, CanonicalRequest request) {
        boolean base64 = request.hasOption(ENCODING_FORMAT)
                && "base64".equals(request.option(ENCODING_FORMAT).asText());

        List<EmbeddingResponse.EmbeddingData> data = new ArrayList<>(response.getOutput().size());
        for (ContentBlock block : response.getOutput()) {
            if (block.getType() != ContentBlock.Type.EMBEDDING) {
                continue;
            }
            data.add(EmbeddingResponse.EmbeddingData.builder()
                    .embedding(base64 ? toBase64(block.getEmbedding()) : block.getEmbedding())
                    .index(block.getIndex())
                    .build());
        }

        TokenUsage usage = response.getUsage();
        EmbeddingResponse body = EmbeddingResponse.builder()
                .data(data)
                .model(request.getModel())
                .usage(usage == null ? null : EmbeddingResponse.Usage.builder()
                        .promptTokens(usage.getPromptTokens())
                        .totalTokens(usage.getTotalTokens())
                        .build())
                .build();
        return objectMapper.valueToTree(body);
    }

    /**
     * 与 OpenAI 一致：little-endian float32 字节序列的 base64
     */
    static String toBase64(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return Base64.getEncoder().encodeToString(buffer.array());
    }

    @Override
    public StreamEncoder openStream(CanonicalRequest request) {
        throw GatewayException.badRequest("Streaming is not supported for embeddings", "stream");
    }
}
