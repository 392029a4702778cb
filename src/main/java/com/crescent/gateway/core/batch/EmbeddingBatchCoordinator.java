package com.crescent.gateway.core.batch;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * Embedding 分片协调器
 * <p>
 * 把超出上游单批上限的输入切成连续分片（最后一片可以更短），并发调用上游，
 * 再按原始偏移拼回结果：
 * <ul>
 *   <li>并发数不超过 maxConcurrency，无论分片完成顺序如何，输出顺序与输入一致</li>
 *   <li>任一分片失败则整批失败，错误信息带上该分片的输入区间，其余未完成的分片被取消</li>
 *   <li>chunkSize 不小于输入条数时退化为一次调用</li>
 * </ul>
 */
@Slf4j
@Component
public class EmbeddingBatchCoordinator {

    /**
     * 执行一次分片批处理
     *
     * @param request        统一请求，inputs 为全部输入
     * @param chunkSize      每个分片的最大条数
     * @param maxConcurrency 同时在途的分片数上限
     * @param chunkCall      单个分片的上游调用；分片请求的 inputs 只包含该分片，返回向量的 index 相对于分片
     * @return 批处理结果
     */
    public Mono<EmbeddingBatch> embedBatch(CanonicalRequest request,
                                           int chunkSize,
                                           int maxConcurrency,
                                           Function<CanonicalRequest, Mono<CanonicalResponse>> chunkCall) {
        List<String> inputs = request.getInputs();
        if (inputs.isEmpty()) {
            return Mono.error(GatewayException.badRequest("'input' must not be empty", "input"));
        }
        if (chunkSize <= 0) {
            return Mono.error(GatewayException.internal(new IllegalArgumentException("chunkSize must be positive")));
        }
        int size = inputs.size();
        int chunkCount = (size + chunkSize - 1) / chunkSize;
        int concurrency = Math.max(1, Math.min(maxConcurrency, chunkCount));
        if (log.isDebugEnabled()) {
            log.debug("Embedding batch for {}: {} input(s) in {} chunk(s), concurrency {}",
                    request.getModel(), size, chunkCount, concurrency);
        }

        return Flux.range(0, chunkCount)
                .flatMap(chunk -> {
                    int start = chunk * chunkSize;
                    int end = Math.min(start + chunkSize, size);
                    return embedChunk(request, start, end, chunkCall);
                }, concurrency)
                // flatMap 的下游信号是串行的，这里写入结果数组无需同步
                .reduceWith(() -> new Accumulator(size), Accumulator::add)
                .map(acc -> new EmbeddingBatch(inputs, chunkSize, chunkCount, acc.vectors, acc.usage));
    }

    private Mono<ChunkResult> embedChunk(CanonicalRequest request, int start, int end,
                                         Function<CanonicalRequest, Mono<CanonicalResponse>> chunkCall) {
        CanonicalRequest chunkRequest = request.toBuilder()
                .clearInputs()
                .inputs(request.getInputs().subList(start, end))
                .build();
        return Mono.defer(() -> chunkCall.apply(chunkRequest))
                .map(response -> toChunkResult(response, start, end))
                .onErrorMap(e -> GatewayException.from(e)
                        .withContext("embedding chunk input[" + start + ".." + end + ") failed", "input"));
    }

    private static ChunkResult toChunkResult(CanonicalResponse response, int start, int end) {
        int expected = end - start;
        float[][] vectors = new float[expected][];
        for (ContentBlock block : response.getOutput()) {
            if (block.getType() != ContentBlock.Type.EMBEDDING) {
                continue;
            }
            int index = block.getIndex();
            if (index < 0 || index >= expected || vectors[index] != null) {
                throw GatewayException.upstream("Upstream returned an unexpected embedding index " + index);
            }
            vectors[index] = block.getEmbedding();
        }
        for (int i = 0; i < expected; i++) {
            if (vectors[i] == null) {
                throw GatewayException.upstream("Upstream returned no embedding for index " + i
                        + " (expected " + expected + ")");
            }
        }
        return new ChunkResult(start, vectors, response.getUsage());
    }

    private static final class ChunkResult {
        private final int start;
        private final float[][] vectors;
        private final TokenUsage usage;

        private ChunkResult(int start, float[][] vectors, TokenUsage usage) {
            this.start = start;
            this.vectors = vectors;
            this.usage = usage;
        }
    }

    private static final class Accumulator {
        private final float[][] vectors;
        private TokenUsage usage;

        private Accumulator(int size) {
            this.vectors = new float[size][];
        }

        private Accumulator add(ChunkResult chunk) {
            System.arraycopy(chunk.vectors, 0, vectors, chunk.start, chunk.vectors.length);
            if (chunk.usage != null) {
                usage = usage == null ? chunk.usage : usage.plus(chunk.usage);
            }
            return this;
        }
    }
}
