package org.lite.knowledge.service;

import org.lite.knowledge.enums.LlmProviderType;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns text into embedding vectors through one of the configured providers.
 */
public interface EmbeddingGatewayService {

    /**
     * Embed texts with the configured timeout.
     * @param texts texts to embed; an empty list yields an empty result without calling the provider
     * @param provider provider to use, or null for the default one
     * @return one vector per input text, in input order
     */
    Mono<List<List<Float>>> embed(List<String> texts, LlmProviderType provider);

    /**
     * Embed texts, cancelling the in-flight provider call once {@code timeout} elapses.
     */
    Mono<List<List<Float>>> embed(List<String> texts, LlmProviderType provider, Duration timeout);

    Mono<List<Float>> embedQuery(String text, LlmProviderType provider);

    LlmProviderType defaultProvider();

    int dimensionFor(LlmProviderType provider);

    Mono<Boolean> isProviderAvailable(LlmProviderType provider);

    static List<List<Float>> zeroVectors(int count, int dimension) {
        List<Float> zero = Collections.nCopies(dimension, 0.0f);
        List<List<Float>> vectors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(zero);
        }
        return vectors;
    }
}
