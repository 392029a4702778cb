package com.crescent.gateway.web;

import com.crescent.gateway.api.ChatCompletionRequest;
import com.crescent.gateway.api.ChatCompletionResponse;
import com.crescent.gateway.api.EmbeddingRequest;
import com.crescent.gateway.api.EmbeddingResponse;
import com.crescent.gateway.api.ErrorResponse;
import com.crescent.gateway.api.ImageGenerationRequest;
import com.crescent.gateway.api.ImageResponse;
import com.crescent.gateway.api.ModelListResponse;
import com.crescent.gateway.api.ResponsesRequest;
import com.crescent.gateway.api.ResponsesResponse;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.registry.ModelRegistry;
import com.crescent.gateway.service.DispatchContext;
import com.crescent.gateway.service.DispatchResult;
import com.crescent.gateway.service.GatewayService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
@Tag(name = "AI网关控制器", description = "OpenAI 兼容的统一模型访问入口")
public class GatewayController {

    private final GatewayService gatewayService;
    private final ModelRegistry modelRegistry;
    private final DispatchContextResolver contextResolver;

    /**
     * Chat-Completions：stream=true 时返回 SSE，否则返回 JSON
     */
    @Operation(
        summary = "Chat Completions",
        description = "按 model 路由到上游服务，上游可以是 Chat-Completions 或 Responses 协议",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ChatCompletionRequest.class))
        )
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "成功；流式请求返回 text/event-stream，以 [DONE] 结束",
            content = @Content(schema = @Schema(implementation = ChatCompletionResponse.class))),
        @ApiResponse(responseCode = "400", description = "请求参数错误",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "模型不存在"),
        @ApiResponse(responseCode = "502", description = "上游错误"),
        @ApiResponse(responseCode = "504", description = "超时")
    })
    @PostMapping(value = "/v1/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> chatCompletions(@RequestBody JsonNode body, ServerWebExchange exchange) {
        return dispatch(body, Dialect.CHAT_COMPLETIONS, exchange);
    }

    @Operation(
        summary = "Responses",
        description = "统一 Responses 接口；stream=true 时按 Responses 事件序列输出",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ResponsesRequest.class))
        )
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "成功",
            content = @Content(schema = @Schema(implementation = ResponsesResponse.class))),
        @ApiResponse(responseCode = "400", description = "请求参数错误",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "模型不存在")
    })
    @PostMapping(value = "/v1/responses", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> responses(@RequestBody JsonNode body, ServerWebExchange exchange) {
        return dispatch(body, Dialect.RESPONSES, exchange);
    }

    /**
     * Embeddings：输入条数超过上游单批上限时自动分片，对调用方透明
     */
    @Operation(
        summary = "Embeddings",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = EmbeddingRequest.class))
        )
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "成功",
            content = @Content(schema = @Schema(implementation = EmbeddingResponse.class))),
        @ApiResponse(responseCode = "400", description = "请求参数错误",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/v1/embeddings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> embeddings(@RequestBody JsonNode body, ServerWebExchange exchange) {
        return dispatch(body, Dialect.EMBEDDINGS, exchange);
    }

    /**
     * 图片生成：model 缺省为 dall-e-3，只支持同步调用
     */
    @Operation(
        summary = "Image Generations",
        requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ImageGenerationRequest.class))
        )
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "成功",
            content = @Content(schema = @Schema(implementation = ImageResponse.class))),
        @ApiResponse(responseCode = "400", description = "请求参数错误",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "模型不存在")
    })
    @PostMapping(value = "/v1/images/generations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> imageGenerations(@RequestBody JsonNode body, ServerWebExchange exchange) {
        return dispatch(body, Dialect.IMAGES, exchange);
    }

    @Operation(summary = "模型列表", description = "当前注册表中的全部模型，按名称排序")
    @GetMapping("/v1/models")
    public ModelListResponse models() {
        // 两次读取之间注册表可能被重新加载，已下线的模型直接跳过
        List<ModelListResponse.ModelData> data = modelRegistry.listModels().stream()
                .map(modelRegistry::find)
                .flatMap(Optional::stream)
                .map(route -> ModelListResponse.ModelData.builder()
                        .id(route.getModelName())
                        .created(0L)
                        .ownedBy(route.getProviderId())
                        .build())
                .collect(Collectors.toList());
        return new ModelListResponse(data);
    }

    @Operation(summary = "健康检查")
    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    private Mono<ResponseEntity<Object>> dispatch(JsonNode body, Dialect dialect, ServerWebExchange exchange) {
        return Mono.fromCallable(() -> contextResolver.resolve(exchange))
                .flatMap(context -> gatewayService.handle(body, dialect, context)
                        .map(result -> toResponse(result, context)));
    }

    private static ResponseEntity<Object> toResponse(DispatchResult result, DispatchContext context) {
        if (result.isStream()) {
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_EVENT_STREAM)
                    .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                    .header("X-Accel-Buffering", "no")
                    .header(DispatchContextResolver.REQUEST_ID_HEADER, context.getRequestId())
                    .body(result.getStream());
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(DispatchContextResolver.REQUEST_ID_HEADER, context.getRequestId())
                .body(result.getBody());
    }
}
