package com.crescent.gateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 网关内部统一请求
 * <p>
 * 由入站方言适配器解码得到，每个入站调用独享一份，分发之后不再修改。
 * 文本类方言使用 {@link #messages}，Embeddings 使用 {@link #inputs}，Images 使用 {@link #prompt}。
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CanonicalRequest {

    /** 客户端使用的方言 */
    private final Dialect dialect;

    private final String model;

    @Singular
    private final List<CanonicalMessage> messages;

    @Singular
    private final List<String> inputs;

    /** 仅 Images 使用 */
    private final String prompt;

    private final Double temperature;

    private final boolean stream;

    /** 仅 Embeddings 使用，必须为正数 */
    private final Integer dimensions;

    /**
     * 其它透传参数（max_tokens、top_p、stop、user 等），保持原始 JSON 值
     */
    @Singular("option")
    private final Map<String, JsonNode> extraOptions;

    public JsonNode option(String name) {
        return extraOptions.get(name);
    }

    public boolean hasOption(String name) {
        JsonNode value = extraOptions.get(name);
        return value != null && !value.isNull();
    }
}
