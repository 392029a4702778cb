package com.crescent.gateway.core.dialect.impl;

import com.crescent.gateway.api.ImageResponse;
import com.crescent.gateway.core.dialect.AbstractDialectAdapter;
import com.crescent.gateway.core.dialect.StreamEncoder;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.Dialect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 图片生成方言适配器（/v1/images/generations）
 * <p>
 * 只支持同步调用。未指定 model 时使用 dall-e-3，n、size、quality 等参数原样透传给上游。
 */
@Component
public class ImagesAdapter extends AbstractDialectAdapter {

    static final String DEFAULT_MODEL = "dall-e-3";

    private static final int MAX_IMAGES = 10;
    private static final Set<String> KNOWN_FIELDS = Set.of("model", "prompt", "stream");
    private static final Set<String> RESPONSE_FORMATS = Set.of("url", "b64_json");

    public ImagesAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Dialect dialect() {
        return Dialect.IMAGES;
    }

    @Override
    public CanonicalRequest decode(JsonNode payload) {
        requireObject(payload);
        JsonNode model = payload.get("model");
        String modelName = model == null || model.isNull() ? DEFAULT_MODEL : requireModel(payload);

        if (readStream(payload)) {
            throw GatewayException.badRequest("Streaming is not supported for image generation", "stream");
        }

        JsonNode prompt = payload.get("prompt");
        if (prompt == null || prompt.isNull() || (prompt.isTextual() && prompt.asText().isBlank())) {
            throw GatewayException.badRequest("Missing required parameter: 'prompt'", "prompt");
        }
        if (!prompt.isTextual()) {
            throw GatewayException.badRequest("'prompt' must be a string", "prompt");
        }

        JsonNode n = payload.get("n");
        if (n != null && !n.isNull() && (!n.isIntegralNumber() || n.asInt() < 1 || n.asInt() > MAX_IMAGES)) {
            throw GatewayException.badRequest("'n' must be an integer between 1 and " + MAX_IMAGES, "n");
        }
        JsonNode responseFormat = payload.get("response_format");
        if (responseFormat != null && !responseFormat.isNull()
                && !(responseFormat.isTextual() && RESPONSE_FORMATS.contains(responseFormat.asText()))) {
            throw GatewayException.badRequest("'response_format' must be one of: url, b64_json", "response_format");
        }

        CanonicalRequest.CanonicalRequestBuilder builder = CanonicalRequest.builder()
                .dialect(Dialect.IMAGES)
                .model(modelName)
                .prompt(prompt.asText());
        copyExtraOptions(payload, KNOWN_FIELDS, builder);
        return builder.build();
    }

    @Override
    public JsonNode encode(CanonicalResponse response, CanonicalRequest request) {
        List<ImageResponse.ImageData> data = new ArrayList<>(response.getOutput().size());
        for (ContentBlock block : response.getOutput()) {
            if (block.getType() != ContentBlock.Type.IMAGE) {
                continue;
            }
            data.add(ImageResponse.ImageData.builder()
                    .url(block.getUrl())
                    .b64Json(block.getB64Json())
                    .revisedPrompt(block.getRevisedPrompt())
                    .build());
        }
        long created = response.getCreatedAt() > 0 ? response.getCreatedAt() : Instant.now().getEpochSecond();
        return objectMapper.valueToTree(ImageResponse.builder()
                .created(created)
                .data(data)
                .build());
    }

    @Override
    public StreamEncoder openStream(CanonicalRequest request) {
        throw GatewayException.badRequest("Streaming is not supported for image generation", "stream");
    }
}
