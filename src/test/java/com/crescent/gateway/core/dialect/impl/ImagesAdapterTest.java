package com.crescent.gateway.core.dialect.impl;

import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.Dialect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImagesAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ImagesAdapter adapter = new ImagesAdapter(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private GatewayException rejected(String body) {
        return assertThrows(GatewayException.class, () -> adapter.decode(json(body)));
    }

    @Test
    void shouldDefaultModelAndKeepImageOptions() throws Exception {
        CanonicalRequest request = adapter.decode(json(
                "{\"prompt\":\"a lighthouse\",\"n\":2,\"size\":\"1024x1024\",\"response_format\":\"b64_json\"}"));

        assertEquals(Dialect.IMAGES, request.getDialect());
        assertEquals("dall-e-3", request.getModel());
        assertEquals("a lighthouse", request.getPrompt());
        assertFalse(request.isStream());
        assertEquals(2, request.option("n").asInt());
        assertEquals("1024x1024", request.option("size").asText());
        assertEquals("b64_json", request.option("response_format").asText());

        assertEquals("dall-e-2", adapter.decode(json("{\"model\":\"dall-e-2\",\"prompt\":\"x\"}")).getModel());
    }

    @Test
    void shouldRequirePrompt() {
        assertEquals("prompt", rejected("{\"model\":\"dall-e-3\"}").getParam());
        assertEquals("prompt", rejected("{\"prompt\":\"   \"}").getParam());
        assertEquals("prompt", rejected("{\"prompt\":[\"a\"]}").getParam());
    }

    @Test
    void shouldValidateCountAndResponseFormat() {
        assertEquals("n", rejected("{\"prompt\":\"x\",\"n\":0}").getParam());
        assertEquals("n", rejected("{\"prompt\":\"x\",\"n\":11}").getParam());
        assertEquals("n", rejected("{\"prompt\":\"x\",\"n\":1.5}").getParam());
        assertEquals("response_format", rejected("{\"prompt\":\"x\",\"response_format\":\"png\"}").getParam());
    }

    @Test
    void shouldRejectStreaming() {
        GatewayException error = rejected("{\"prompt\":\"x\",\"stream\":true}");
        assertEquals(GatewayErrorKind.BAD_REQUEST, error.getKind());
        assertEquals("stream", error.getParam());
    }

    @Test
    void shouldEncodeImagesInOrder() throws Exception {
        CanonicalRequest request = adapter.decode(json("{\"prompt\":\"a lighthouse\"}"));
        CanonicalResponse response = CanonicalResponse.builder()
                .createdAt(1700000000L)
                .block(ContentBlock.image(0, "https://images.example.com/0.png", null, "a red lighthouse"))
                .block(ContentBlock.image(1, null, "aGVsbG8=", null))
                .build();

        JsonNode body = adapter.encode(response, request);

        assertEquals(1700000000L, body.get("created").asLong());
        assertEquals(2, body.get("data").size());
        assertEquals("https://images.example.com/0.png", body.at("/data/0/url").asText());
        assertEquals("a red lighthouse", body.at("/data/0/revised_prompt").asText());
        assertFalse(body.get("data").get(0).has("b64_json"));
        assertEquals("aGVsbG8=", body.at("/data/1/b64_json").asText());
        assertTrue(body.get("data").get(1).path("url").isMissingNode());
    }
}
