package com.crescent.gateway.web;

import com.crescent.gateway.config.GatewayProperties;
import com.crescent.gateway.core.auth.StaticCredentialValidator;
import com.crescent.gateway.core.dao.ModelRouteMapper;
import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.Dialect;
import com.crescent.gateway.core.registry.ModelRegistry;
import com.crescent.gateway.service.DispatchContext;
import com.crescent.gateway.service.DispatchResult;
import com.crescent.gateway.service.GatewayService;
import com.crescent.gateway.service.UpstreamWebClientManager;
import com.crescent.gateway.support.TestRoutes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GatewayControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GatewayProperties properties = new GatewayProperties();
    private final GatewayService gatewayService = mock(GatewayService.class);
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        properties.getAuth().getApiKeys().add("sk-client");
        GatewayProperties.Tenant tenant = new GatewayProperties.Tenant();
        tenant.setId("team-a");
        tenant.setApiKeys(Set.of("sk-team-a"));
        properties.getAuth().getTenants().add(tenant);
        properties.setRequestTimeout(Duration.ofSeconds(30));
        ModelRegistry registry = new ModelRegistry(mock(ModelRouteMapper.class), properties,
                mock(UpstreamWebClientManager.class));
        registry.replaceAll(List.of(TestRoutes.embeddings("text-embedding-3-small"), TestRoutes.chat("gpt-4o"),
                TestRoutes.images("dall-e-3")));

        GatewayController controller = new GatewayController(gatewayService, registry,
                new DispatchContextResolver(properties));
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .webFilter(new BearerAuthenticationFilter(new StaticCredentialValidator(properties), objectMapper))
                .build();
    }

    private WebTestClient.RequestBodySpec post(String path) {
        return client.post()
                .uri(path)
                .header("Authorization", "Bearer sk-client")
                .contentType(MediaType.APPLICATION_JSON);
    }

    @Test
    void shouldReturnJsonBodyWithRequestId() throws Exception {
        JsonNode upstream = objectMapper.readTree("{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\"}");
        when(gatewayService.handle(any(JsonNode.class), eq(Dialect.CHAT_COMPLETIONS), any(DispatchContext.class)))
                .thenReturn(Mono.just(DispatchResult.of(upstream)));

        post("/v1/chat/completions")
                .header(DispatchContextResolver.REQUEST_ID_HEADER, "req_abc")
                .header(DispatchContextResolver.TIMEOUT_HEADER, "5000")
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectHeader().valueEquals(DispatchContextResolver.REQUEST_ID_HEADER, "req_abc")
                .expectBody()
                .jsonPath("$.id").isEqualTo("chatcmpl-1");

        ArgumentCaptor<DispatchContext> context = ArgumentCaptor.forClass(DispatchContext.class);
        verify(gatewayService).handle(any(JsonNode.class), eq(Dialect.CHAT_COMPLETIONS), context.capture());
        assertEquals("req_abc", context.getValue().getRequestId());
        assertEquals("sk-client", context.getValue().getCredential());
        assertEquals(Duration.ofMillis(5000), context.getValue().getTimeout());
        assertEquals(StaticCredentialValidator.defaultTenant("sk-client"), context.getValue().getTenantId());
    }

    @Test
    void shouldGenerateImagesForTenantKey() throws Exception {
        JsonNode images = objectMapper.readTree(
                "{\"created\":1700000000,\"data\":[{\"url\":\"https://images.example.com/0.png\"}]}");
        when(gatewayService.handle(any(JsonNode.class), eq(Dialect.IMAGES), any(DispatchContext.class)))
                .thenReturn(Mono.just(DispatchResult.of(images)));

        client.post()
                .uri("/v1/images/generations")
                .header("Authorization", "Bearer sk-team-a")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"prompt\":\"a lighthouse\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[0].url").isEqualTo("https://images.example.com/0.png");

        ArgumentCaptor<DispatchContext> context = ArgumentCaptor.forClass(DispatchContext.class);
        verify(gatewayService).handle(any(JsonNode.class), eq(Dialect.IMAGES), context.capture());
        assertEquals("team-a", context.getValue().getTenantId());
        assertEquals("sk-team-a", context.getValue().getCredential());
    }

    @Test
    void shouldStreamServerSentEvents() {
        Flux<ServerSentEvent<String>> frames = Flux.just(
                ServerSentEvent.<String>builder().event("response.created").data("{\"type\":\"response.created\"}").build(),
                ServerSentEvent.<String>builder().data("[DONE]").build());
        when(gatewayService.handle(any(JsonNode.class), eq(Dialect.RESPONSES), any(DispatchContext.class)))
                .thenReturn(Mono.just(DispatchResult.stream(frames)));

        String body = post("/v1/responses")
                .bodyValue("{\"model\":\"gpt-4o\",\"input\":\"hi\",\"stream\":true}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals("Cache-Control", "no-cache")
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertTrue(body.contains("event:response.created"), body);
        assertTrue(body.trim().endsWith("data:[DONE]"), body);
    }

    @Test
    void shouldRenderGatewayErrorsAsEnvelope() {
        when(gatewayService.handle(any(JsonNode.class), eq(Dialect.EMBEDDINGS), any(DispatchContext.class)))
                .thenReturn(Mono.error(GatewayException.notFound("missing-model")));

        post("/v1/embeddings")
                .bodyValue("{\"model\":\"missing-model\",\"input\":\"hi\"}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error")
                .jsonPath("$.error.code").isEqualTo("model_not_found")
                .jsonPath("$.error.param").isEqualTo("model")
                .jsonPath("$.error.message").isEqualTo("The model 'missing-model' does not exist");
    }

    @Test
    void shouldRejectMalformedJsonAndBadTimeoutHeader() {
        post("/v1/chat/completions")
                .bodyValue("{\"model\": ")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error")
                .jsonPath("$.error.message").isEqualTo("Request body is missing or is not valid JSON");

        post("/v1/chat/completions")
                .header(DispatchContextResolver.TIMEOUT_HEADER, "soon")
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.param").isEqualTo(DispatchContextResolver.TIMEOUT_HEADER);

        verifyNoInteractions(gatewayService);
    }

    @Test
    void shouldRejectMissingOrUnknownCredential() {
        client.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("authentication_error")
                .jsonPath("$.error.message").isEqualTo("Missing bearer credential in Authorization header");

        client.get()
                .uri("/v1/models")
                .header("Authorization", "Bearer sk-other")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("invalid_api_key");

        verifyNoInteractions(gatewayService);
    }

    @Test
    void shouldListModelsSortedByName() {
        client.get()
                .uri("/v1/models")
                .header("Authorization", "Bearer sk-client")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data[0].id").isEqualTo("dall-e-3")
                .jsonPath("$.data[1].id").isEqualTo("gpt-4o")
                .jsonPath("$.data[1].object").isEqualTo("model")
                .jsonPath("$.data[1].owned_by").isEqualTo("example")
                .jsonPath("$.data[2].id").isEqualTo("text-embedding-3-small")
                .jsonPath("$.data.length()").isEqualTo(3);
    }

    @Test
    void shouldSkipModelsRemovedBetweenListingAndLookup() {
        ModelRegistry registry = mock(ModelRegistry.class);
        when(registry.listModels()).thenReturn(List.of("gpt-4o", "retired-model"));
        when(registry.find("gpt-4o")).thenReturn(Optional.of(TestRoutes.chat("gpt-4o")));
        when(registry.find("retired-model")).thenReturn(Optional.empty());
        WebTestClient openClient = WebTestClient.bindToController(new GatewayController(gatewayService, registry,
                        new DispatchContextResolver(new GatewayProperties())))
                .webFilter(new BearerAuthenticationFilter(new StaticCredentialValidator(new GatewayProperties()),
                        objectMapper))
                .build();

        openClient.get()
                .uri("/v1/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(1)
                .jsonPath("$.data[0].id").isEqualTo("gpt-4o");

        verify(registry).listModels();
    }

    @Test
    void shouldAnswerHealthWithoutCredential() {
        client.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok");
    }
}
