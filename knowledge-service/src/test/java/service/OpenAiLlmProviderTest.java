package service;

import org.junit.jupiter.api.Test;
import org.lite.knowledge.config.EmbeddingProperties;
import org.lite.knowledge.config.LlmProviderProperties;
import org.lite.knowledge.exception.ProviderFailureException;
import org.lite.knowledge.exception.ProviderUnavailableException;
import org.lite.knowledge.exception.RateLimitedException;
import org.lite.knowledge.exception.TransientProviderException;
import org.lite.knowledge.provider.OpenAiLlmProvider;
import org.lite.knowledge.provider.ProviderRetrySpec;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiLlmProviderTest {

    private static final String EMBEDDINGS_BODY = """
            {"data": [
              {"index": 1, "embedding": [0.4, 0.5]},
              {"index": 0, "embedding": [0.1, 0.2]}
            ]}
            """;

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void testGenerateEmbeddings_OrderedByIndex() {
        // Given
        OpenAiLlmProvider provider = providerReplaying(ok(EMBEDDINGS_BODY));

        // When / Then
        StepVerifier.create(provider.generateEmbeddings(List.of("first", "second")))
                .assertNext(vectors -> {
                    assertEquals(2, vectors.size());
                    assertEquals(List.of(0.1f, 0.2f), vectors.get(0));
                    assertEquals(List.of(0.4f, 0.5f), vectors.get(1));
                })
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/v1/embeddings", request.url().getPath());
        assertEquals("Bearer sk-test", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testGenerateEmbeddings_RateLimitCarriesRetryAfter() {
        // Given
        OpenAiLlmProvider provider = providerReplaying(status(HttpStatus.TOO_MANY_REQUESTS, "2"));

        // When / Then
        StepVerifier.create(provider.generateEmbeddings(List.of("text")))
                .expectErrorSatisfies(error -> {
                    RateLimitedException rateLimited = assertInstanceOf(RateLimitedException.class, error);
                    assertEquals(Duration.ofSeconds(2), rateLimited.getRetryAfter());
                })
                .verify();
    }

    @Test
    void testGenerateEmbeddings_ServerErrorIsTransient() {
        OpenAiLlmProvider provider = providerReplaying(status(HttpStatus.SERVICE_UNAVAILABLE, null));

        StepVerifier.create(provider.generateEmbeddings(List.of("text")))
                .expectError(TransientProviderException.class)
                .verify();
    }

    @Test
    void testGenerateEmbeddings_UnauthorizedIsFinal() {
        OpenAiLlmProvider provider = providerReplaying(status(HttpStatus.UNAUTHORIZED, null));

        StepVerifier.create(provider.generateEmbeddings(List.of("text")))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(ProviderFailureException.class, error);
                    assertFalse(error instanceof TransientProviderException);
                })
                .verify();
    }

    @Test
    void testGenerateEmbeddings_ConnectionRefusedIsUnavailable() {
        // Given
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.error(
                new WebClientRequestException(new IOException("Connection refused"), request.method(), request.url(),
                        request.headers())));
        OpenAiLlmProvider provider = new OpenAiLlmProvider(builder, config());

        // When / Then
        StepVerifier.create(provider.generateEmbeddings(List.of("text")))
                .expectError(ProviderUnavailableException.class)
                .verify();
    }

    @Test
    void testGenerateEmbeddings_RetriedThroughTwoRateLimits() {
        // Given
        OpenAiLlmProvider provider = providerReplaying(
                status(HttpStatus.TOO_MANY_REQUESTS, null),
                status(HttpStatus.TOO_MANY_REQUESTS, null),
                ok(EMBEDDINGS_BODY));
        EmbeddingProperties retry = new EmbeddingProperties();
        retry.setBaseDelay(Duration.ofMillis(10));
        retry.setMaxDelay(Duration.ofMillis(50));

        // When / Then
        StepVerifier.create(provider.generateEmbeddings(List.of("first", "second"))
                        .retryWhen(ProviderRetrySpec.forProvider("openai", "embed", retry)))
                .assertNext(vectors -> assertEquals(2, vectors.size()))
                .verifyComplete();
        assertEquals(3, requests.size());
    }

    @Test
    void testGenerateText_ReturnsMessageContent() {
        // Given
        OpenAiLlmProvider provider = providerReplaying(ok(
                "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"{\\\"a\\\": 1}\"}}]}"));

        // When / Then
        StepVerifier.create(provider.generateText("prompt", true))
                .expectNext("{\"a\": 1}")
                .verifyComplete();
        assertEquals("/v1/chat/completions", requests.get(0).url().getPath());
    }

    @Test
    void testIsAvailable_FalseOnServerError() {
        OpenAiLlmProvider provider = providerReplaying(status(HttpStatus.INTERNAL_SERVER_ERROR, null));

        StepVerifier.create(provider.isAvailable())
                .expectNext(false)
                .verifyComplete();
    }

    private OpenAiLlmProvider providerReplaying(ClientResponse... responses) {
        Deque<ClientResponse> queue = new LinkedList<>(List.of(responses));
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(queue.size() > 1 ? queue.poll() : queue.peek());
        });
        return new OpenAiLlmProvider(builder, config());
    }

    private static LlmProviderProperties.OpenAi config() {
        LlmProviderProperties.OpenAi config = new LlmProviderProperties.OpenAi();
        config.setBaseUrl("http://openai.test");
        config.setApiKey("sk-test");
        config.setEmbeddingDimensions(2);
        return config;
    }

    private static ClientResponse ok(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private static ClientResponse status(HttpStatus status, String retryAfter) {
        ClientResponse.Builder builder = ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"error\": {\"message\": \"" + status.getReasonPhrase() + "\"}}");
        if (retryAfter != null) {
            builder.header(HttpHeaders.RETRY_AFTER, retryAfter);
        }
        return builder.build();
    }
}
