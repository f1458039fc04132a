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
 * Locally reachable Ollama server: {@code /api/embed} for embeddings, {@code /api/generate} for text.
 */
@Slf4j
public class OllamaLlmProvider implements LlmProvider {

    private static final String NAME = LlmProviderType.OLLAMA.getId();
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final LlmProviderProperties.Ollama config;

    public OllamaLlmProvider(WebClient.Builder webClientBuilder, LlmProviderProperties.Ollama config) {
        this.webClient = webClientBuilder.clone().baseUrl(config.getBaseUrl()).build();
        this.config = config;
    }

    @Override
    public LlmProviderType type() {
        return LlmProviderType.OLLAMA;
    }

    @Override
    public boolean isRemote() {
        return false;
    }

    @Override
    public int embeddingDimension() {
        return config.getEmbeddingDimension();
    }

    @Override
    public Mono<List<List<Float>>> generateEmbeddings(List<String> texts) {
        Map<String, Object> payload = Map.of(
                "model", config.getEmbeddingModel(),
                "input", texts);
        log.debug("Requesting {} embeddings from Ollama model {}", texts.size(), config.getEmbeddingModel());

        return webClient.post()
                .uri("/api/embed")
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderHttpErrors.toException(NAME, "embed", response))
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    JsonNode embeddings = root.path("embeddings");
                    if (!embeddings.isArray()) {
                        throw ProviderHttpErrors.malformedResponse(NAME, "embed",
                                "Invalid response from Ollama embed API, 'embeddings' key not found");
                    }
                    List<List<Float>> vectors = new ArrayList<>(embeddings.size());
                    embeddings.forEach(vector -> vectors.add(ProviderHttpErrors.toVector(vector)));
                    return vectors;
                })
                .onErrorMap(error -> ProviderHttpErrors.mapTransportError(NAME, "embed", error));
    }

    @Override
    public Mono<String> generateText(String prompt, boolean jsonOutput) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", config.getLlmModel());
        payload.put("prompt", prompt);
        payload.put("stream", false);
        if (jsonOutput) {
            payload.put("format", "json");
        }

        return webClient.post()
                .uri("/api/generate")
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderHttpErrors.toException(NAME, "generate", response))
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    JsonNode response = root.path("response");
                    if (!response.isTextual()) {
                        throw ProviderHttpErrors.malformedResponse(NAME, "generate", "'response' field missing");
                    }
                    return response.asText();
                })
                .onErrorMap(error -> ProviderHttpErrors.mapTransportError(NAME, "generate", error));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return webClient.get()
                .uri("/")
                .retrieve()
                .toBodilessEntity()
                .flatMap(entity -> hasModel(config.getLlmModel()))
                .timeout(HEALTH_TIMEOUT)
                .onErrorResume(error -> {
                    log.warn("Ollama health check failed: {}", error.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Checks {@code /api/tags} for a pulled model. Tags without an explicit version match {@code :latest}.
     */
    public Mono<Boolean> hasModel(String model) {
        return webClient.get()
                .uri("/api/tags")
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> ProviderHttpErrors.toException(NAME, "tags", response))
                .bodyToMono(JsonNode.class)
                .map(root -> {
                    String wanted = model.contains(":") ? model : model + ":latest";
                    for (JsonNode entry : root.path("models")) {
                        String name = entry.path("name").asText();
                        if (name.equals(model) || name.equals(wanted)) {
                            return true;
                        }
                    }
                    log.warn("Ollama model {} is not pulled", model);
                    return false;
                });
    }
}
