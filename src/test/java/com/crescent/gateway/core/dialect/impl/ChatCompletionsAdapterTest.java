package com.crescent.gateway.core.dialect.impl;

import com.crescent.gateway.core.dialect.StreamEncoder;
import com.crescent.gateway.core.error.GatewayErrorKind;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.CanonicalRequest;
import com.crescent.gateway.core.model.CanonicalResponse;
import com.crescent.gateway.core.model.ContentBlock;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.model.StreamEvent;
import com.crescent.gateway.core.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatCompletionsAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ChatCompletionsAdapter adapter = new ChatCompletionsAdapter(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void shouldDecodeMessagesAndKeepUnknownFieldsAsOptions() throws Exception {
        CanonicalRequest request = adapter.decode(json("""
                {"model":"gpt-4o","temperature":0.2,"max_tokens":64,"user":"u-1",
                 "messages":[{"role":"system","content":"Be brief"},
                             {"role":"user","content":[{"type":"text","text":"Count "},{"type":"text","text":"to 5"}]}]}
                """));

        assertEquals(Dialect.CHAT_COMPLETIONS, request.getDialect());
        assertEquals("gpt-4o", request.getModel());
        assertEquals(0.2, request.getTemperature());
        assertFalse(request.isStream());
        assertEquals(2, request.getMessages().size());
        assertEquals("Count to 5", request.getMessages().get(1).getContent());
        assertEquals(64, request.option("max_tokens").asInt());
        assertTrue(request.hasOption("user"));
        assertFalse(request.hasOption("messages"));
    }

    @Test
    void shouldRejectMissingModel() throws Exception {
        GatewayException e = assertThrows(GatewayException.class,
                () -> adapter.decode(json("{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")));
        assertEquals(GatewayErrorKind.BAD_REQUEST, e.getKind());
        assertEquals("model", e.getParam());
    }

    @Test
    void shouldRejectMalformedMessages() throws Exception {
        assertThrows(GatewayException.class, () -> adapter.decode(json("{\"model\":\"m\",\"messages\":[]}")));
        assertThrows(GatewayException.class, () -> adapter.decode(json("{\"model\":\"m\",\"messages\":\"hi\"}")));
        GatewayException e = assertThrows(GatewayException.class,
                () -> adapter.decode(json("{\"model\":\"m\",\"messages\":[{\"content\":\"hi\"}]}")));
        assertEquals("messages[0].role", e.getParam());
        assertThrows(GatewayException.class, () -> adapter.decode(json(
                "{\"model\":\"m\",\"messages\":[{\"role\":\"user\",\"content\":[{\"type\":\"image_url\"}]}]}")));
    }

    @Test
    void shouldRejectOutOfRangeTemperatureAndNonBooleanStream() throws Exception {
        assertThrows(GatewayException.class, () -> adapter.decode(json(
                "{\"model\":\"m\",\"temperature\":3,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")));
        assertThrows(GatewayException.class, () -> adapter.decode(json(
                "{\"model\":\"m\",\"stream\":\"yes\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")));
    }

    @Test
    void shouldEncodeCompletionWithRequestedModelName() throws Exception {
        CanonicalRequest request = adapter.decode(json(
                "{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"Count to 5\"}]}"));
        CanonicalResponse response = CanonicalResponse.builder()
                .id("chatcmpl-abc")
                .model("gpt-4o")
                .createdAt(1700000000L)
                .block(ContentBlock.text("assistant", "1, 2, 3, 4, 5"))
                .finishReason("stop")
                .usage(TokenUsage.of(10, 5, 15))
                .build();

        JsonNode body = adapter.encode(response, request);

        assertEquals("chatcmpl-abc", body.get("id").asText());
        assertEquals("chat.completion", body.get("object").asText());
        assertEquals("gpt-4o", body.get("model").asText());
        assertEquals("1, 2, 3, 4, 5", body.at("/choices/0/message/content").asText());
        assertEquals("assistant", body.at("/choices/0/message/role").asText());
        assertEquals("stop", body.at("/choices/0/finish_reason").asText());
        assertEquals(15, body.at("/usage/total_tokens").asInt());
    }

    @Test
    void shouldStreamRoleOnceThenDeltasAndFinishExactlyOnce() throws Exception {
        CanonicalRequest request = adapter.decode(json(
                "{\"model\":\"gpt-4o\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}"));
        StreamEncoder encoder = adapter.openStream(request);

        List<ServerSentEvent<String>> frames = new ArrayList<>(encoder.begin());
        frames.addAll(encoder.encode(StreamEvent.messageStart("assistant")));
        frames.addAll(encoder.encode(StreamEvent.messageStart("assistant")));
        frames.addAll(encoder.encode(StreamEvent.textDelta("Hel")));
        frames.addAll(encoder.encode(StreamEvent.textDelta("lo")));
        frames.addAll(encoder.encode(StreamEvent.messageDone("stop")));
        frames.addAll(encoder.encode(StreamEvent.usage(TokenUsage.of(1, 2, 3))));
        frames.addAll(encoder.complete());

        assertEquals(4, frames.size());
        JsonNode first = json(frames.get(0).data());
        assertEquals("chat.completion.chunk", first.get("object").asText());
        assertEquals("assistant", first.at("/choices/0/delta/role").asText());
        assertTrue(first.at("/choices/0/finish_reason").isNull());
        assertEquals("Hel", json(frames.get(1).data()).at("/choices/0/delta/content").asText());
        JsonNode last = json(frames.get(3).data());
        assertEquals("stop", last.at("/choices/0/finish_reason").asText());
        assertEquals(first.get("id").asText(), last.get("id").asText());
        assertNull(frames.get(3).event());
    }

    @Test
    void shouldEmitUsageChunkOnlyWhenRequested() throws Exception {
        CanonicalRequest request = adapter.decode(json("""
                {"model":"gpt-4o","stream":true,"stream_options":{"include_usage":true},
                 "messages":[{"role":"user","content":"hi"}]}
                """));
        StreamEncoder encoder = adapter.openStream(request);

        encoder.encode(StreamEvent.messageDone("stop"));
        List<ServerSentEvent<String>> frames = encoder.encode(StreamEvent.usage(TokenUsage.of(1, 2, 3)));

        assertEquals(1, frames.size());
        JsonNode usage = json(frames.get(0).data());
        assertEquals(0, usage.get("choices").size());
        assertEquals(3, usage.at("/usage/total_tokens").asInt());
    }

    @Test
    void shouldHoldUsageBackUntilFinishChunk() throws Exception {
        CanonicalRequest request = adapter.decode(json("""
                {"model":"gpt-4o","stream":true,"stream_options":{"include_usage":true},
                 "messages":[{"role":"user","content":"hi"}]}
                """));
        StreamEncoder encoder = adapter.openStream(request);

        List<ServerSentEvent<String>> frames = new ArrayList<>(encoder.encode(StreamEvent.textDelta("hi")));
        assertTrue(encoder.encode(StreamEvent.usage(TokenUsage.of(2, 1, 3))).isEmpty());
        frames.addAll(encoder.complete());

        assertEquals(3, frames.size());
        assertEquals("stop", json(frames.get(1).data()).at("/choices/0/finish_reason").asText());
        assertEquals(3, json(frames.get(2).data()).at("/usage/total_tokens").asInt());
    }

    @Test
    void shouldRenderUnknownEventsAndFailures() throws Exception {
        CanonicalRequest request = adapter.decode(json(
                "{\"model\":\"gpt-4o\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}"));
        StreamEncoder encoder = adapter.openStream(request);

        JsonNode unknown = json(encoder.encode(StreamEvent.of("vendor.ping", json("{\"n\":1}"))).get(0).data());
        assertEquals("unknown", unknown.get("type").asText());
        assertEquals("vendor.ping", unknown.get("event").asText());
        assertEquals(1, unknown.at("/data/n").asInt());

        JsonNode error = json(encoder.fail(GatewayException.interrupted("dropped", null)).get(0).data());
        assertEquals("api_error", error.at("/error/type").asText());
        assertEquals("upstream_interrupted", error.at("/error/code").asText());
    }
}
