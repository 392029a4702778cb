package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.converter.ResponseConverter;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.core.model.StreamEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 解析图片生成上游响应，data 中每一项为一个图片块，顺序与上游一致
 */
@Component
public class ImagesResponseConverter implements ResponseConverter {

    @Override
    public CanonicalResponse convert(ModelRoute route, JsonNode upstreamBody) {
        ConverterSupport.rejectErrorBody(upstreamBody);
        JsonNode data = upstreamBody.get("data");
        if (data == null || !data.isArray()) {
            throw GatewayException.upstream("Upstream response from " + route.getProviderId() + " has no data");
        }

        CanonicalResponse.CanonicalResponseBuilder builder = CanonicalResponse.builder()
                .model(route.getModelName())
                .createdAt(upstreamBody.path("created").asLong(0L))
                .usage(ConverterSupport.readUsage(upstreamBody.get("usage"), "input_tokens", "output_tokens"));
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            String url = ConverterSupport.textOrNull(item.get("url"));
            String b64Json = ConverterSupport.textOrNull(item.get("b64_json"));
            if (url == null && b64Json == null) {
                throw GatewayException.upstream("Upstream image " + i + " has neither url nor b64_json");
            }
            builder.block(ContentBlock.image(i, url, b64Json, ConverterSupport.textOrNull(item.get("revised_prompt"))));
        }
        return builder.build();
    }

    @Override
    public List<StreamEvent> convertChunk(ModelRoute route, JsonNode chunk) {
        throw GatewayException.internal(new UnsupportedOperationException("Image generation does not stream"));
    }

    @Override
    public boolean supports(ModelRoute route) {
        return route.getProviderDialect() == Dialect.IMAGES;
    }
}
