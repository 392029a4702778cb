package com.crescent.gateway.core.dialect;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.codec.ServerSentEvent;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * 方言适配器公共逻辑：请求体字段校验、未知字段透传与 SSE 帧序列化
 */
public abstract class AbstractDialectAdapter implements DialectAdapter {

    protected final ObjectMapper objectMapper;

    protected AbstractDialectAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected static JsonNode requireObject(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw GatewayException.badRequest("Request body must be a JSON object");
        }
        return payload;
    }

    protected static String requireModel(JsonNode payload) {
        JsonNode model = payload.get("model");
        if (model == null || model.isNull()) {
            throw GatewayException.badRequest("Missing required parameter: 'model'", "model");
        }
        if (!model.isTextual() || model.asText().isBlank()) {
            throw GatewayException.badRequest("'model' must be a non-empty string", "model");
        }
        return model.asText();
    }

    /**
     * 读取 temperature，取值范围 [0, 2]
     */
    protected static Double readTemperature(JsonNode payload) {
        JsonNode node = payload.get("temperature");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw GatewayException.badRequest("'temperature' must be a number", "temperature");
        }
        double value = node.asDouble();
        if (value < 0 || value > 2) {
            throw GatewayException.badRequest("'temperature' must be between 0 and 2", "temperature");
        }
        return value;
    }

    protected static boolean readStream(JsonNode payload) {
        JsonNode node = payload.get("stream");
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isBoolean()) {
            throw GatewayException.badRequest("'stream' must be a boolean", "stream");
        }
        return node.asBoolean();
    }

    /**
     * 把未被方言显式识别的字段原样放入 extraOptions
     */
    protected static void copyExtraOptions(JsonNode payload, Set<String> knownFields,
                                           CanonicalRequest.CanonicalRequestBuilder builder) {
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!knownFields.contains(entry.getKey())) {
                builder.option(entry.getKey(), entry.getValue());
            }
        }
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw GatewayException.internal(e);
        }
    }

    protected ServerSentEvent<String> dataFrame(Object value) {
        return ServerSentEvent.<String>builder().data(toJson(value)).build();
    }

    protected ServerSentEvent<String> eventFrame(String event, Object value) {
        return ServerSentEvent.<String>builder().event(event).data(toJson(value)).build();
    }
}
