package com.crescent.gateway.core.dialect.impl;

import com.crescent.gateway.api.ResponsesResponse;
import com.crescent.gateway.core.dialect.AbstractDialectAdapter;
import com.crescent.gateway.core.dialect.StreamEncoder;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalMessage;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.ResponseStatus;
import com.crescent.gateway.core.model.StreamEvent;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Responses 方言适配器
 * <p>
 * input 可以是字符串，也可以是 message 项数组；instructions 转换为首条 system 消息。
 * 流式输出遵循 Responses 事件序列：
 * <pre>
 * response.created → response.in_progress → response.output_item.added → response.content_part.added
 *   → response.output_text.delta* → response.output_text.done → response.content_part.done
 *   → response.output_item.done → response.completed
 * </pre>
 * 失败时输出 error 与 response.failed。每个帧都带 {@code event:} 行和递增的 sequence_number。
 */
@Component
public class ResponsesAdapter extends AbstractDialectAdapter {

    private static final Set<String> KNOWN_FIELDS = Set.of("model", "input", "instructions", "temperature", "stream");
    private static final Set<String> TEXT_PART_TYPES = Set.of("input_text", "output_text", "text");

    public ResponsesAdapter(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Dialect dialect() {
        return Dialect.RESPONSES;
    }

    @Override
    public CanonicalRequest decode(JsonNode payload) {
        requireObject(payload);
        CanonicalRequest.CanonicalRequestBuilder builder = CanonicalRequest.builder()
                .dialect(Dialect.RESPONSES)
                .model(requireModel(payload))
                .temperature(readTemperature(payload))
                .stream(readStream(payload));

        JsonNode instructions = payload.get("instructions");
        if (instructions != null && !instructions.isNull()) {
            if (!instructions.isTextual()) {
                throw GatewayException.badRequest("'instructions' must be a string", "instructions");
            }
            builder.message(CanonicalMessage.of("system", instructions.asText()));
        }

        JsonNode input = payload.get("input");
        if (input == null || input.isNull()) {
            throw GatewayException.badRequest("Missing required parameter: 'input'", "input");
        }
        if (input.isTextual()) {
            builder.message(CanonicalMessage.of("user", input.asText()));
        } else if (input.isArray()) {
            if (input.isEmpty()) {
                throw GatewayException.badRequest("'input' must not be empty", "input");
            }
            for (int i = 0; i < input.size(); i++) {
                builder.message(decodeItem(input.get(i), i));
            }
        } else {
            throw GatewayException.badRequest("'input' must be a string or an array of items", "input");
        }

        copyExtraOptions(payload, KNOWN_FIELDS, builder);
        return builder.build();
    }

    private static CanonicalMessage decodeItem(JsonNode item, int index) {
        String param = "input[" + index + "]";
        if (item == null || !item.isObject()) {
            throw GatewayException.badRequest(param + " must be an object", param);
        }
        String type = item.path("type").asText("message");
        if (!"message".equals(type)) {
            throw GatewayException.badRequest("Unsupported input item type '" + type + "'", param + ".type");
        }
        JsonNode role = item.get("role");
        if (role == null || !role.isTextual() || role.asText().isBlank()) {
            throw GatewayException.badRequest(param + ".role is required", param + ".role");
        }
        JsonNode content = item.get("content");
        String contentParam = param + ".content";
        if (content == null || content.isNull()) {
            throw GatewayException.badRequest(contentParam + " is required", contentParam);
        }
        if (content.isTextual()) {
            return CanonicalMessage.of(role.asText(), content.asText());
        }
        if (!content.isArray()) {
            throw GatewayException.badRequest(contentParam + " must be a string or an array of text parts", contentParam);
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : content) {
            if (!TEXT_PART_TYPES.contains(part.path("type").asText("")) || !part.path("text").isTextual()) {
                throw GatewayException.badRequest(contentParam + " only supports text parts", contentParam);
            }
            sb.append(part.get("text").asText());
        }
        return CanonicalMessage.of(role.asText(), sb.toString());
    }

    @Override
    public JsonNode encode(CanonicalResponse response, CanonicalRequest request) {
        String id = response.getId() != null && response.getId().startsWith("resp_")
                ? response.getId() : newId("resp_");
        ResponsesResponse body = ResponsesResponse.builder()
                .id(id)
                .createdAt(response.getCreatedAt() > 0 ? response.getCreatedAt() : Instant.now().getEpochSecond())
                .status(response.getStatus().getCode())
                .model(request.getModel())
                .output(List.of(messageItem(newId("msg_"), "completed", response.role(), response.text())))
                .usage(toUsage(response.getUsage()))
                .build();
        return objectMapper.valueToTree(body);
    }

    @Override
    public StreamEncoder openStream(CanonicalRequest request) {
        return new EventEncoder(request.getModel());
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }

    private static ResponsesResponse.OutputItem messageItem(String id, String status, String role, String text) {
        List<ResponsesResponse.OutputText> content = text == null
                ? List.of()
                : List.of(ResponsesResponse.OutputText.builder().text(text).build());
        return ResponsesResponse.OutputItem.builder()
                .id(id)
                .status(status)
                .role(role)
                .content(content)
                .build();
    }

    private static ResponsesResponse.Usage toUsage(TokenUsage usage) {
        if (usage == null) {
            return null;
        }
        return ResponsesResponse.Usage.builder()
                .inputTokens(usage.getPromptTokens())
                .outputTokens(usage.getCompletionTokens())
                .totalTokens(usage.getTotalTokens())
                .build();
    }

    /**
     * 单次流式调用的事件编码器，按顺序补齐生命周期事件
     */
    private final class EventEncoder implements StreamEncoder {

        private final String responseId = newId("resp_");
        private final String itemId = newId("msg_");
        private final long createdAt = Instant.now().getEpochSecond();
        private final String model;
        private final StringBuilder text = new StringBuilder();
        private int sequence;
        private String role = "assistant";
        private boolean itemOpened;
        private boolean itemClosed;
        private TokenUsage usage;

        private EventEncoder(String model) {
            this.model = model;
        }

        @Override
        public List<ServerSentEvent<String>> begin() {
            List<ServerSentEvent<String>> frames = new ArrayList<>(2);
            frames.add(responseFrame("response.created", ResponseStatus.IN_PROGRESS, null));
            frames.add(responseFrame("response.in_progress", ResponseStatus.IN_PROGRESS, null));
            return frames;
        }

        @Override
        public List<ServerSentEvent<String>> encode(StreamEvent event) {
            List<ServerSentEvent<String>> frames = new ArrayList<>(4);
            switch (event.getType()) {
                case StreamEvent.MESSAGE_START:
                    if (!itemOpened) {
                        role = event.role();
                    }
                    openItem(frames);
                    break;
                case StreamEvent.TEXT_DELTA:
                    openItem(frames);
                    text.append(event.text());
                    ObjectNode delta = itemEvent("response.output_text.delta");
                    delta.put("content_index", 0);
                    delta.put("delta", event.text());
                    frames.add(eventFrame("response.output_text.delta", delta));
                    break;
                case StreamEvent.MESSAGE_DONE:
                    openItem(frames);
                    closeItem(frames);
                    break;
                case StreamEvent.USAGE:
                    usage = event.toUsage();
                    break;
                default:
                    ObjectNode unknown = objectMapper.createObjectNode();
                    unknown.put("type", "unknown");
                    unknown.put("sequence_number", sequence++);
                    unknown.put("event", event.getType());
                    unknown.set("data", event.getPayload());
                    frames.add(eventFrame("unknown", unknown));
                    break;
            }
            return frames;
        }

        @Override
        public List<ServerSentEvent<String>> complete() {
            List<ServerSentEvent<String>> frames = new ArrayList<>(5);
            openItem(frames);
            closeItem(frames);
            frames.add(responseFrame("response.completed", ResponseStatus.COMPLETED, null));
            return frames;
        }

        @Override
        public List<ServerSentEvent<String>> fail(GatewayException error) {
            List<ServerSentEvent<String>> frames = new ArrayList<>(2);
            ObjectNode errorEvent = objectMapper.createObjectNode();
            errorEvent.put("type", "error");
            errorEvent.put("sequence_number", sequence++);
            errorEvent.put("code", error.getCode());
            errorEvent.put("message", error.getMessage());
            errorEvent.put("param", error.getParam());
            frames.add(eventFrame("error", errorEvent));
            frames.add(responseFrame("response.failed", ResponseStatus.FAILED,
                    ResponsesResponse.ErrorDetail.builder()
                            .code(error.getCode())
                            .message(error.getMessage())
                            .build()));
            return frames;
        }

        private void openItem(List<ServerSentEvent<String>> frames) {
            if (itemOpened) {
                return;
            }
            itemOpened = true;
            ObjectNode added = itemEvent("response.output_item.added");
            added.remove("item_id");
            added.set("item", objectMapper.valueToTree(messageItem(itemId, "in_progress", role, null)));
            frames.add(eventFrame("response.output_item.added", added));

            ObjectNode partAdded = itemEvent("response.content_part.added");
            partAdded.put("content_index", 0);
            partAdded.set("part", objectMapper.valueToTree(ResponsesResponse.OutputText.builder().text("").build()));
            frames.add(eventFrame("response.content_part.added", partAdded));
        }

        private void closeItem(List<ServerSentEvent<String>> frames) {
            if (itemClosed) {
                return;
            }
            itemClosed = true;
            ObjectNode textDone = itemEvent("response.output_text.done");
            textDone.put("content_index", 0);
            textDone.put("text", text.toString());
            frames.add(eventFrame("response.output_text.done", textDone));

            ObjectNode partDone = itemEvent("response.content_part.done");
            partDone.put("content_index", 0);
            partDone.set("part", objectMapper.valueToTree(
                    ResponsesResponse.OutputText.builder().text(text.toString()).build()));
            frames.add(eventFrame("response.content_part.done", partDone));

            ObjectNode itemDone = itemEvent("response.output_item.done");
            itemDone.remove("item_id");
            itemDone.set("item", objectMapper.valueToTree(messageItem(itemId, "completed", role, text.toString())));
            frames.add(eventFrame("response.output_item.done", itemDone));
        }

        private ObjectNode itemEvent(String type) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", type);
            node.put("sequence_number", sequence++);
            node.put("item_id", itemId);
            node.put("output_index", 0);
            return node;
        }

        private ServerSentEvent<String> responseFrame(String type, ResponseStatus status,
                                                      ResponsesResponse.ErrorDetail error) {
            List<ResponsesResponse.OutputItem> output = new ArrayList<>(1);
            if (itemClosed) {
                output.add(messageItem(itemId, "completed", role, text.toString()));
            } else if (itemOpened) {
                output.add(messageItem(itemId, "in_progress", role, text.toString()));
            }
            ResponsesResponse snapshot = ResponsesResponse.builder()
                    .id(responseId)
                    .createdAt(createdAt)
                    .status(status.getCode())
                    .model(model)
                    .output(output)
                    .usage(status == ResponseStatus.COMPLETED ? toUsage(usage) : null)
                    .error(error)
                    .build();
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", type);
            node.put("sequence_number", sequence++);
            node.set("response", objectMapper.valueToTree(snapshot));
            return eventFrame(type, node);
        }
    }
}
