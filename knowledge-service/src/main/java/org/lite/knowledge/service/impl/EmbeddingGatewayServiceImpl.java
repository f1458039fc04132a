package org.lite.knowledge.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.EmbeddingProperties;
import org.lite.knowledge.config.LlmProviderProperties;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.exception.EmbeddingCountMismatchException;
import org.lite.knowledge.exception.ProviderUnavailableException;
import org.lite.knowledge.provider.LlmProvider;
import org.lite.knowledge.provider.LlmProviderFactory;
import org.lite.knowledge.provider.ProviderRetrySpec;
import org.lite.knowledge.service.EmbeddingGatewayService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
@RequiredArgsConstructor
public class EmbeddingGatewayServiceImpl implements EmbeddingGatewayService {

    private final LlmProviderFactory providerFactory;
    private final EmbeddingProperties embeddingProperties;
    private final LlmProviderProperties providerProperties;

    @Override
    public Mono<List<List<Float>>> embed(List<String> texts, LlmProviderType provider) {
        return embed(texts, provider, embeddingProperties.getTimeout());
    }

    @Override
    public Mono<List<List<Float>>> embed(List<String> texts, LlmProviderType providerType, Duration timeout) {
        if (texts == null || texts.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.defer(() -> {
            LlmProvider provider = resolve(providerType);
            String name = provider.type().getId();

            Mono<List<List<Float>>> vectors = provider.isRemote()
                    ? embedInBatches(provider, texts)
                    : provider.generateEmbeddings(texts).map(result -> checkCount(name, texts.size(), result));

            vectors = vectors.timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> {
                        log.error("Embedding {} texts with {} timed out after {}", texts.size(), name, timeout);
                        return new ProviderUnavailableException(name, "embed", e);
                    });

            if (!provider.isRemote() && providerProperties.isOfflineMode()) {
                vectors = vectors.onErrorResume(error -> !(error instanceof EmbeddingCountMismatchException), error -> {
                    log.warn("Offline mode: using zero vectors for {} texts after {} failure: {}",
                            texts.size(), name, error.getMessage());
                    return Mono.just(EmbeddingGatewayService.zeroVectors(texts.size(), provider.embeddingDimension()));
                });
            }
            return vectors;
        });
    }

    @Override
    public Mono<List<Float>> embedQuery(String text, LlmProviderType provider) {
        return embed(List.of(text), provider).map(vectors -> vectors.get(0));
    }

    @Override
    public LlmProviderType defaultProvider() {
        return providerFactory.getDefaultType();
    }

    @Override
    public int dimensionFor(LlmProviderType provider) {
        return resolve(provider).embeddingDimension();
    }

    @Override
    public Mono<Boolean> isProviderAvailable(LlmProviderType provider) {
        return Mono.defer(() -> resolve(provider).isAvailable());
    }

    private Mono<List<List<Float>>> embedInBatches(LlmProvider provider, List<String> texts) {
        String name = provider.type().getId();
        List<List<String>> batches = partitionList(texts, embeddingProperties.getBatchSize());
        log.debug("Embedding {} texts with {} in {} batch(es)", texts.size(), name, batches.size());

        return Flux.fromIterable(batches)
                .concatMap(batch -> provider.generateEmbeddings(batch)
                        .retryWhen(ProviderRetrySpec.forProvider(name, "embed", embeddingProperties))
                        .map(result -> checkCount(name, batch.size(), result)))
                .collectList()
                .map(results -> {
                    List<List<Float>> all = new ArrayList<>(texts.size());
                    results.forEach(all::addAll);
                    return checkCount(name, texts.size(), all);
                });
    }

    private LlmProvider resolve(LlmProviderType type) {
        return type != null ? providerFactory.getProvider(type) : providerFactory.getDefaultProvider();
    }

    private static List<List<Float>> checkCount(String provider, int expected, List<List<Float>> vectors) {
        int actual = vectors != null ? vectors.size() : 0;
        if (actual != expected) {
            log.error("Provider {} returned {} embeddings for {} texts", provider, actual, expected);
            throw new EmbeddingCountMismatchException(provider, expected, actual);
        }
        return vectors;
    }

    private static <T> List<List<T>> partitionList(List<T> list, int partitionSize) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += partitionSize) {
            partitions.add(list.subList(i, Math.min(i + partitionSize, list.size())));
        }
        return partitions;
    }
}
