package org.lite.knowledge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.LlmProviderProperties;
import org.lite.knowledge.enums.LlmProviderType;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class OpenAiLlmProvider implements LlmProvider {

    private static final String NAME = LlmProviderType.OPENAI.getId();
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final LlmProviderProperties.OpenAi config;

    public OpenAiLlmProvider(WebClient.Builder webClientBuilder, LlmProviderProperties.OpenAi config) {
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .build();
        this.config = config;
    }

    @Override
    public LlmProviderType type() {
        return LlmProviderType.OPENAI;
    }

    @Override
    public boolean isRemote() {
        return true;
    }

    @Override
    public int embeddingDimension() {
        return config.getEmbeddingDimensions();
    }

    @Override
    public Mono<List<List<Float>>> generateEmbeddings(List<String> texts) {
        Map<String, Object> payload = Map.of(
                "model", config.getEmbeddingModel(),
                "input", texts,
                "dimensions", config.getEmbeddingDimensions());
        log.debug("Requesting {} embeddings from OpenAI model {}", texts.size(), config.getEmbeddingModel());

        return webClient.post()
                .uri("/v1/embeddings")
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderHttpErrors.toException(NAME, "embed", response))
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    JsonNode data = root.path("data");
                    if (!data.isArray()) {
                        throw ProviderHttpErrors.malformedResponse(NAME, "embed", "No data received from OpenAI embedding service");
                    }
                    // entries carry an explicit index; do not rely on array order
                    List<JsonNode> entries = new ArrayList<>();
                    data.forEach(entries::add);
                    entries.sort(Comparator.comparingInt(entry -> entry.path("index").asInt()));
                    List<List<Float>> vectors = new ArrayList<>(entries.size());
                    entries.forEach(entry -> vectors.add(ProviderHttpErrors.toVector(entry.path("embedding"))));
                    return vectors;
                })
                .onErrorMap(error -> ProviderHttpErrors.mapTransportError(NAME, "embed", error));
    }

    @Override
    public Mono<String> generateText(String prompt, boolean jsonOutput) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", config.getChatModel());
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        if (jsonOutput) {
            payload.put("response_format", Map.of("type", "json_object"));
        }

        return webClient.post()
                .uri("/v1/chat/completions")
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderHttpErrors.toException(NAME, "generate", response))
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    JsonNode content = root.path("choices").path(0).path("message").path("content");
                    if (!content.isTextual()) {
                        throw ProviderHttpErrors.malformedResponse(NAME, "generate", "No message content in OpenAI response");
                    }
                    return content.asText();
                })
                .onErrorMap(error -> ProviderHttpErrors.mapTransportError(NAME, "generate", error));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return webClient.get()
                .uri("/v1/models")
                .retrieve()
                .toBodilessEntity()
                .map(entity -> entity.getStatusCode().is2xxSuccessful())
                .timeout(HEALTH_TIMEOUT)
                .onErrorResume(error -> {
                    log.warn("OpenAI availability check failed: {}", error.getMessage());
                    return Mono.just(false);
                });
    }
}
