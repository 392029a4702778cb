package com.crescent.gateway.core.converter.impl;

import com.crescent.gateway.core.dialect.impl.ChatCompletionsAdapter;
import com.crescent.gateway.core.dialect.impl.EmbeddingsAdapter;
import com.crescent.gateway.core.dialect.impl.ImagesAdapter;
import com.crescent.gateway.core.dialect.impl.ResponsesAdapter;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.ModelRoute;
import com.crescent.gateway.support.TestRoutes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestConverterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ChatCompletionsAdapter chatAdapter = new ChatCompletionsAdapter(objectMapper);
    private final ResponsesAdapter responsesAdapter = new ResponsesAdapter(objectMapper);
    private final EmbeddingsAdapter embeddingsAdapter = new EmbeddingsAdapter(objectMapper);
    private final ImagesAdapter imagesAdapter = new ImagesAdapter(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void shouldPassChatRequestThroughWithUpstreamModelName() throws Exception {
        ModelRoute route = TestRoutes.chat("gpt-4o").toBuilder().upstreamModel("gpt-4o-2024-08-06").build();
        CanonicalRequest request = chatAdapter.decode(json("""
                {"model":"gpt-4o","temperature":0.5,"max_tokens":16,"logprobs":true,
                 "messages":[{"role":"user","content":"hi"}]}
                """));

        JsonNode payload = new ChatCompletionsRequestConverter(objectMapper).convert(route, request);

        assertEquals("gpt-4o-2024-08-06", payload.get("model").asText());
        assertEquals("hi", payload.at("/messages/0/content").asText());
        assertEquals(0.5, payload.get("temperature").asDouble());
        assertFalse(payload.get("stream").asBoolean());
        assertEquals(16, payload.get("max_tokens").asInt());
        assertTrue(payload.get("logprobs").asBoolean());
        assertFalse(payload.has("stream_options"));
    }

    @Test
    void shouldAskChatUpstreamForUsageWhenStreaming() throws Exception {
        CanonicalRequest request = chatAdapter.decode(json(
                "{\"model\":\"gpt-4o\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}"));

        JsonNode payload = new ChatCompletionsRequestConverter(objectMapper).convert(TestRoutes.chat("gpt-4o"), request);

        assertTrue(payload.get("stream").asBoolean());
        assertTrue(payload.at("/stream_options/include_usage").asBoolean());
    }

    @Test
    void shouldTranslateResponsesRequestForChatUpstream() throws Exception {
        CanonicalRequest request = responsesAdapter.decode(json("""
                {"model":"gpt-4o","instructions":"Be brief","input":"Count to 5",
                 "max_output_tokens":32,"top_p":0.9,"reasoning":{"effort":"low"}}
                """));

        JsonNode payload = new ChatCompletionsRequestConverter(objectMapper).convert(TestRoutes.chat("gpt-4o"), request);

        assertEquals("system", payload.at("/messages/0/role").asText());
        assertEquals("Be brief", payload.at("/messages/0/content").asText());
        assertEquals("Count to 5", payload.at("/messages/1/content").asText());
        assertEquals(32, payload.get("max_tokens").asInt());
        assertEquals(0.9, payload.get("top_p").asDouble());
        assertFalse(payload.has("reasoning"));
        assertFalse(payload.has("max_output_tokens"));
    }

    @Test
    void shouldTranslateChatRequestForResponsesUpstream() throws Exception {
        CanonicalRequest request = chatAdapter.decode(json("""
                {"model":"gpt-4o","max_tokens":64,"presence_penalty":1,
                 "messages":[{"role":"system","content":"A"},{"role":"system","content":"B"},
                             {"role":"user","content":"hi"}]}
                """));

        JsonNode payload = new ResponsesRequestConverter(objectMapper).convert(TestRoutes.responses("gpt-4o"), request);

        assertEquals("A\n\nB", payload.get("instructions").asText());
        assertEquals(1, payload.get("input").size());
        assertEquals("message", payload.at("/input/0/type").asText());
        assertEquals("user", payload.at("/input/0/role").asText());
        assertEquals(64, payload.get("max_output_tokens").asInt());
        assertFalse(payload.has("presence_penalty"));
    }

    @Test
    void shouldAlwaysRequestFloatEmbeddingsForOneChunk() throws Exception {
        CanonicalRequest request = embeddingsAdapter.decode(json(
                "{\"model\":\"e\",\"input\":[\"a\",\"b\"],\"dimensions\":8,\"encoding_format\":\"base64\",\"user\":\"u\"}"));

        JsonNode payload = new EmbeddingsRequestConverter(objectMapper).convert(TestRoutes.embeddings("e"), request);

        assertEquals(2, payload.get("input").size());
        assertEquals(8, payload.get("dimensions").asInt());
        assertEquals("float", payload.get("encoding_format").asText());
        assertEquals("u", payload.get("user").asText());
    }

    @Test
    void shouldForwardImageOptionsWithUpstreamModelName() throws Exception {
        ModelRoute route = TestRoutes.images("image-default").toBuilder().upstreamModel("dall-e-3").build();
        CanonicalRequest request = imagesAdapter.decode(json(
                "{\"model\":\"image-default\",\"prompt\":\"a lighthouse\",\"quality\":\"hd\",\"n\":1}"));

        JsonNode payload = new ImagesRequestConverter(objectMapper).convert(route, request);

        assertEquals("dall-e-3", payload.get("model").asText());
        assertEquals("a lighthouse", payload.get("prompt").asText());
        assertEquals("hd", payload.get("quality").asText());
        assertEquals(1, payload.get("n").asInt());
        assertFalse(payload.has("stream"));
    }
}
