package com.crescent.gateway.core.dialect.impl;

import com.crescent.gateway.api.ChatCompletionResponse;
import com.crescent.gateway.api.ErrorResponse;
import com.crescent.gateway.core.dialect.AbstractDialectAdapter;
import com.crescent.gateway.core.dialect.StreamEncoder;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalMessage;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.StreamEvent;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Chat-Completions 方言适配器
 * <p>
 * 请求：{model, messages[], temperature?, stream?, ...}，其余字段透传。<br>
 * 响应：{@code chat.completion}；流式为 {@code chat.completion.chunk} 序列，
 * 首帧携带 role，结束帧携带 finish_reason，开启 {@code stream_options.include_usage} 时追加 usage 帧。
 */
@Component
public class ChatCompletionsAdapter extends AbstractDialectAdapter {

    private static final Set<String> KNOWN_FIELDS = Set.of("model", "messages", "temperature", "stream");

    public ChatCompletionsAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Dialect dialect() {
        return Dialect.CHAT_COMPLETIONS;
    }

    @Override
    public CanonicalRequest decode(JsonNode payload) {
        requireObject(payload);
        CanonicalRequest.CanonicalRequestBuilder builder = CanonicalRequest.builder()
                .dialect(Dialect.CHAT_COMPLETIONS)
                .model(requireModel(payload))
                .temperature(readTemperature(payload))
                .stream(readStream(payload));

        JsonNode messages = payload.get("messages");
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            throw GatewayException.badRequest("'messages' must be a non-empty array", "messages");
        }
        for (int i = 0; i < messages.size(); i++) {
            builder.message(decodeMessage(messages.get(i), i));
        }

        copyExtraOptions(payload, KNOWN_FIELDS, builder);
        return builder.build();
    }

    private CanonicalMessage decodeMessage(JsonNode message, int index) {
        String param = "messages[" + index + "]";
        if (message == null || !message.isObject()) {
            throw GatewayException.badRequest(param + " must be an object", param);
        }
        JsonNode role = message.get("role");
        if (role == null || !role.isTextual() || role.asText().isBlank()) {
            throw GatewayException.badRequest(param + ".role is required", param + ".role");
        }
        return CanonicalMessage.of(role.asText(), readContent(message.get("content"), param + ".content"));
    }

    /**
     * content 可以是字符串、{type: text, text} 片段数组或 null（例如仅含 tool_calls 的 assistant 消息）
     */
    private static String readContent(JsonNode content, String param) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : content) {
                String type = part.path("type").asText("");
                if (!"text".equals(type) || !part.path("text").isTextual()) {
                    throw GatewayException.badRequest(param + " only supports text parts", param);
                }
                sb.append(part.get("text").asText());
            }
            return sb.toString();
        }
        throw GatewayException.badRequest(param + " must be a string or an array of text parts", param);
    }

    @Override
    public JsonNode encode(CanonicalResponse response, CanonicalRequest request) {
        ChatCompletionResponse body = ChatCompletionResponse.builder()
                .id(completionId(response.getId()))
                .object("chat.completion")
                .created(response.getCreatedAt() > 0 ? response.getCreatedAt() : Instant.now().getEpochSecond())
                .model(request.getModel())
                .choices(List.of(ChatCompletionResponse.Choice.builder()
                        .index(0)
                        .message(ChatCompletionResponse.Message.builder()
                                .role(response.role())
                                .content(response.text())
                                .build())
                        .finishReason(response.getFinishReason() == null ? "stop" : response.getFinishReason())
                        .build()))
                .usage(toUsage(response.getUsage()))
                .build();
        return objectMapper.valueToTree(body);
    }

    @Override
    public StreamEncoder openStream(CanonicalRequest request) {
        boolean includeUsage = request.hasOption("stream_options")
                && request.option("stream_options").path("include_usage").asBoolean(false);
        return new ChunkEncoder(request.getModel(), includeUsage);
    }

    private static String completionId(String upstreamId) {
        if (upstreamId != null && upstreamId.startsWith("chatcmpl-")) {
            return upstreamId;
        }
        return "chatcmpl-" + UUID.randomUUID().toString().replace("-", "");
    }

    private static ChatCompletionResponse.Usage toUsage(TokenUsage usage) {
        if (usage == null) {
            return null;
        }
        return ChatCompletionResponse.Usage.builder()
                .promptTokens(usage.getPromptTokens())
                .completionTokens(usage.getCompletionTokens())
                .totalTokens(usage.getTotalTokens())
                .build();
    }

    /**
     * 单次流式调用的 chunk 编码器
     */
    private final class ChunkEncoder implements StreamEncoder {

        private final String id = completionId(null);
        private final long created = Instant.now().getEpochSecond();
        private final String model;
        private final boolean includeUsage;
        private boolean roleSent;
        private boolean finished;
        private TokenUsage pendingUsage;

        private ChunkEncoder(String model, boolean includeUsage) {
            this.model = model;
            this.includeUsage = includeUsage;
        }

        @Override
        public List<ServerSentEvent<String>> begin() {
            return Collections.emptyList();
        }

        @Override
        public List<ServerSentEvent<String>> encode(StreamEvent event) {
            switch (event.getType()) {
                case StreamEvent.MESSAGE_START:
                    if (roleSent) {
                        return Collections.emptyList();
                    }
                    roleSent = true;
                    return List.of(chunk(ChatCompletionResponse.Message.builder().role(event.role()).build(), null));
                case StreamEvent.TEXT_DELTA:
                    ChatCompletionResponse.Message.MessageBuilder delta = ChatCompletionResponse.Message.builder()
                            .content(event.text());
                    if (!roleSent) {
                        roleSent = true;
                        delta.role("assistant");
                    }
                    return List.of(chunk(delta.build(), null));
                case StreamEvent.MESSAGE_DONE:
                    return finish(event.finishReason());
                case StreamEvent.USAGE:
                    if (!includeUsage) {
                        return Collections.emptyList();
                    }
                    if (!finished) {
                        // usage chunk 必须排在 finish_reason 之后
                        pendingUsage = event.toUsage();
                        return Collections.emptyList();
                    }
                    return List.of(usageChunk(event.toUsage()));
                default:
                    ObjectNode unknown = objectMapper.createObjectNode();
                    unknown.put("type", "unknown");
                    unknown.put("event", event.getType());
                    unknown.set("data", event.getPayload());
                    return List.of(dataFrame(unknown));
            }
        }

        @Override
        public List<ServerSentEvent<String>> complete() {
            return finish("stop");
        }

        @Override
        public List<ServerSentEvent<String>> fail(GatewayException error) {
            return List.of(dataFrame(ErrorResponse.of(error)));
        }

        private List<ServerSentEvent<String>> finish(String finishReason) {
            if (finished) {
                return Collections.emptyList();
            }
            finished = true;
            List<ServerSentEvent<String>> frames = new ArrayList<>(2);
            frames.add(chunk(ChatCompletionResponse.Message.builder().build(), finishReason));
            if (pendingUsage != null) {
                frames.add(usageChunk(pendingUsage));
                pendingUsage = null;
            }
            return frames;
        }

        private ServerSentEvent<String> usageChunk(TokenUsage usage) {
            return dataFrame(ChatCompletionResponse.builder()
                    .id(id)
                    .object("chat.completion.chunk")
                    .created(created)
                    .model(model)
                    .choices(List.of())
                    .usage(toUsage(usage))
                    .build());
        }

        private ServerSentEvent<String> chunk(ChatCompletionResponse.Message delta, String finishReason) {
            return dataFrame(ChatCompletionResponse.builder()
                    .id(id)
                    .object("chat.completion.chunk")
                    .created(created)
                    .model(model)
                    .choices(List.of(ChatCompletionResponse.Choice.builder()
                            .index(0)
                            .delta(delta)
                            .finishReason(finishReason)
                            .build()))
                    .build());
        }
    }
}
