package com.crescent.gateway.core.dialect.impl;

import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmbeddingsAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EmbeddingsAdapter adapter = new EmbeddingsAdapter(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void shouldDecodeSingleStringAndArrayInputs() throws Exception {
        assertEquals(List.of("hello"),
                adapter.decode(json("{\"model\":\"e\",\"input\":\"hello\"}")).getInputs());
        CanonicalRequest request = adapter.decode(json("{\"model\":\"e\",\"input\":[\"a\",\"b\"],\"dimensions\":256}"));
        assertEquals(List.of("a", "b"), request.getInputs());
        assertEquals(256, request.getDimensions());
    }

    @Test
    void shouldRejectInvalidDimensionsAndInputs() throws Exception {
        GatewayException negative = assertThrows(GatewayException.class,
                () -> adapter.decode(json("{\"model\":\"e\",\"input\":\"a\",\"dimensions\":-1}")));
        assertEquals(GatewayErrorKind.BAD_REQUEST, negative.getKind());
        assertEquals("dimensions", negative.getParam());
        assertThrows(GatewayException.class, () -> adapter.decode(json("{\"model\":\"e\",\"input\":[]}")));
        assertThrows(GatewayException.class, () -> adapter.decode(json("{\"model\":\"e\",\"input\":[[1,2,3]]}")));
        assertThrows(GatewayException.class, () -> adapter.decode(json("{\"model\":\"e\",\"input\":[\"\"]}")));
        assertThrows(GatewayException.class,
                () -> adapter.decode(json("{\"model\":\"e\",\"input\":\"a\",\"encoding_format\":\"int8\"}")));
        assertThrows(GatewayException.class,
                () -> adapter.decode(json("{\"model\":\"e\",\"input\":\"a\",\"stream\":true}")));
    }

    @Test
    void shouldEncodeVectorsInInputOrder() throws Exception {
        CanonicalRequest request = adapter.decode(json("{\"model\":\"text-embedding-3-small\",\"input\":[\"a\",\"b\"]}"));
        CanonicalResponse response = CanonicalResponse.builder()
                .block(ContentBlock.embedding(0, new float[]{0.5f, -1.0f}))
                .block(ContentBlock.embedding(1, new float[]{0.25f, 2.0f}))
                .usage(TokenUsage.of(2, 0, 2))
                .build();

        JsonNode body = adapter.encode(response, request);

        assertEquals("list", body.get("object").asText());
        assertEquals("text-embedding-3-small", body.get("model").asText());
        assertEquals(2, body.get("data").size());
        assertEquals("embedding", body.at("/data/0/object").asText());
        assertEquals(1, body.at("/data/1/index").asInt());
        assertEquals(0.25, body.at("/data/1/embedding/0").asDouble(), 1e-6);
        assertEquals(2, body.at("/usage/prompt_tokens").asInt());
    }

    @Test
    void shouldEncodeBase64AsLittleEndianFloats() throws Exception {
        CanonicalRequest request = adapter.decode(json(
                "{\"model\":\"e\",\"input\":\"a\",\"encoding_format\":\"base64\"}"));
        CanonicalResponse response = CanonicalResponse.builder()
                .block(ContentBlock.embedding(0, new float[]{1.5f, -2.0f}))
                .build();

        JsonNode body = adapter.encode(response, request);

        String encoded = body.at("/data/0/embedding").asText();
        ByteBuffer buffer = ByteBuffer.wrap(Base64.getDecoder().decode(encoded)).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(1.5f, buffer.getFloat());
        assertEquals(-2.0f, buffer.getFloat());
        assertTrue(body.at("/usage").isMissingNode());
    }

    @Test
    void shouldRefuseToOpenStream() throws Exception {
        CanonicalRequest request = adapter.decode(json("{\"model\":\"e\",\"input\":\"a\"}"));
        assertThrows(GatewayException.class, () -> adapter.openStream(request));
    }
}
