package org.lite.knowledge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.LlmProviderProperties;
import org.lite.knowledge.enums.LlmProviderType;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini via the Generative Language REST API.
 * Embeddings use {@code batchEmbedContents}, one request entry per text.
 */
@Slf4j
public class GeminiLlmProvider implements LlmProvider {

    private static final String NAME = LlmProviderType.GEMINI.getId();
    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final LlmProviderProperties.Gemini config;

    public GeminiLlmProvider(WebClient.Builder webClientBuilder, LlmProviderProperties.Gemini config) {
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(API_KEY_HEADER, config.getApiKey())
                .build();
        this.config = config;
    }

    @Override
    public LlmProviderType type() {
        return LlmProviderType.GEMINI;
    }

    @Override
    public boolean isRemote() {
        return true;
    }

    @Override
    public int embeddingDimension() {
        return config.getEmbeddingDimension();
    }

    @Override
    public Mono<List<List<Float>>> generateEmbeddings(List<String> texts) {
        String modelPath = "models/" + config.getEmbeddingModel();
        List<Map<String, Object>> requests = new ArrayList<>(texts.size());
        for (String text : texts) {
            requests.add(Map.of(
                    "model", modelPath,
                    "content", Map.of("parts", List.of(Map.of("text", text))),
                    "outputDimensionality", config.getEmbeddingDimension()));
        }
        log.debug("Requesting {} embeddings from Gemini model {}", texts.size(), config.getEmbeddingModel());

        return webClient.post()
                .uri("/v1beta/models/{model}:batchEmbedContents", config.getEmbeddingModel())
                .bodyValue(Map.of("requests", requests))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderHttpErrors.toException(NAME, "embed", response))
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    JsonNode embeddings = root.path("embeddings");
                    if (!embeddings.isArray()) {
                        throw ProviderHttpErrors.malformedResponse(NAME, "embed", "No embedding data received from Gemini embedding service");
                    }
                    List<List<Float>> vectors = new ArrayList<>(embeddings.size());
                    embeddings.forEach(embedding -> vectors.add(ProviderHttpErrors.toVector(embedding.path("values"))));
                    return vectors;
                })
                .onErrorMap(error -> ProviderHttpErrors.mapTransportError(NAME, "embed", error));
    }

    @Override
    public Mono<String> generateText(String prompt, boolean jsonOutput) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
        if (jsonOutput) {
            payload.put("generationConfig", Map.of("responseMimeType", "application/json"));
        }

        return webClient.post()
                .uri("/v1beta/models/{model}:generateContent", config.getChatModel())
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderHttpErrors.toException(NAME, "generate", response))
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
                    if (!text.isTextual()) {
                        throw ProviderHttpErrors.malformedResponse(NAME, "generate", "Gemini returned an empty response");
                    }
                    return text.asText();
                })
                .onErrorMap(error -> ProviderHttpErrors.mapTransportError(NAME, "generate", error));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/v1beta/models").queryParam("pageSize", 1).build())
                .retrieve()
                .toBodilessEntity()
                .map(entity -> entity.getStatusCode().is2xxSuccessful())
                .timeout(HEALTH_TIMEOUT)
                .onErrorResume(error -> {
                    log.warn("Gemini availability check failed: {}", error.getMessage());
                    return Mono.just(false);
                });
    }
}
