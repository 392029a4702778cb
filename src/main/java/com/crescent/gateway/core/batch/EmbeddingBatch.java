package com.crescent.gateway.core.batch;

import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.TokenUsage;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次完整 embedding 批处理的结果，results 与 inputs 按下标一一对应
 */
@Getter
public class EmbeddingBatch {

    private final List<String> inputs;
    private final int chunkSize;
    private final int chunkCount;
    private final List<float[]> results;
    private final TokenUsage usage;

    EmbeddingBatch(List<String> inputs, int chunkSize, int chunkCount, float[][] results, TokenUsage usage) {
        if (results.length != inputs.size()) {
            throw new IllegalStateException("Embedding batch has " + results.length + " results for "
                    + inputs.size() + " inputs");
        }
        this.inputs = inputs;
        this.chunkSize = chunkSize;
        this.chunkCount = chunkCount;
        List<float[]> vectors = new ArrayList<>(results.length);
        Collections.addAll(vectors, results);
        this.results = Collections.unmodifiableList(vectors);
        this.usage = usage;
    }

    /**
     * 转换为统一响应，index 为原始输入下标
     */
    public CanonicalResponse toResponse(String model) {
        CanonicalResponse.CanonicalResponseBuilder builder = CanonicalResponse.builder()
                .model(model)
                .usage(usage);
        for (int i = 0; i < results.size(); i++) {
            builder.block(ContentBlock.embedding(i, results.get(i)));
        }
        return builder.build();
    }
}
