package org.lite.knowledge.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.RetrievalProperties;
import org.lite.knowledge.dto.RetrievalResult;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.enums.RetrievalStrategy;
import org.lite.knowledge.enums.StoreStatus;
import org.lite.knowledge.exception.ConfigurationException;
import org.lite.knowledge.exception.DimensionMismatchException;
import org.lite.knowledge.exception.EmbeddingCountMismatchException;
import org.lite.knowledge.exception.RetrievalException;
import org.lite.knowledge.model.ScoredChunk;
import org.lite.knowledge.model.Source;
import org.lite.knowledge.service.EmbeddingGatewayService;
import org.lite.knowledge.service.RetrieverService;
import org.lite.knowledge.service.VectorStoreService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class RetrieverServiceImpl implements RetrieverService {

    private final EmbeddingGatewayService embeddingGateway;
    private final VectorStoreService vectorStore;
    private final RetrievalProperties properties;

    @Override
    public Mono<List<Source>> retrieve(String question) {
        return retrieve(question, properties.getTopK());
    }

    @Override
    public Mono<List<Source>> retrieve(String question, int k) {
        return retrieve(question, k, properties.isFallbackEnabled());
    }

    @Override
    public Mono<List<Source>> retrieve(String question, int k, boolean fallbackEnabled) {
        return retrieve(question, k, fallbackEnabled, null);
    }

    @Override
    public Mono<List<Source>> retrieve(String question, int k, boolean fallbackEnabled, LlmProviderType provider) {
        return retrieveDetailed(question, k, fallbackEnabled, provider).map(RetrievalResult::getSources);
    }

    @Override
    public Mono<RetrievalResult> retrieveDetailed(String question, int k, boolean fallbackEnabled, LlmProviderType provider) {
        if (k <= 0) {
            return Mono.error(new IllegalArgumentException("k must be positive"));
        }
        if (question == null || question.isBlank()) {
            return Mono.just(result(List.of(), RetrievalStrategy.NONE));
        }
        return vectorStore.currentStatus().flatMap(status -> {
            if (status == StoreStatus.DEGRADED) {
                log.warn("Vector store is degraded, returning no sources");
                return Mono.just(result(List.of(), RetrievalStrategy.NONE));
            }
            return retrieveFromStore(question, k, fallbackEnabled, provider);
        });
    }

    private Mono<RetrievalResult> retrieveFromStore(String question, int k, boolean fallbackEnabled,
                                                    LlmProviderType provider) {
        return embeddingGateway.embedQuery(question, provider)
                .flatMap(vector -> checkDimension(vector, provider))
                .flatMap(vector -> vectorStore.search(vector, k))
                .flatMap(hits -> {
                    if (!hits.isEmpty()) {
                        log.debug("Vector search found {} sources", hits.size());
                        return Mono.just(result(toSources(hits), RetrievalStrategy.VECTOR));
                    }
                    if (!fallbackEnabled) {
                        return Mono.just(result(List.of(), RetrievalStrategy.NONE));
                    }
                    log.info("Vector search found nothing, falling back to text search");
                    return textFallback(question, k, null);
                })
                .onErrorResume(RetrieverServiceImpl::canFallBack, error -> {
                    if (!fallbackEnabled) {
                        log.error("Vector retrieval failed and fallback is disabled: {}", error.getMessage());
                        return Mono.error(new RetrievalException(error.getMessage(), error));
                    }
                    log.warn("Vector retrieval failed, falling back to text search: {}", error.getMessage());
                    return textFallback(question, k, error);
                });
    }

    private Mono<List<Float>> checkDimension(List<Float> vector, LlmProviderType provider) {
        return vectorStore.getStoredEmbeddingDimension()
                .switchIfEmpty(Mono.defer(vectorStore::getIndexDimension))
                .flatMap(stored -> {
                    if (stored != vector.size()) {
                        String name = provider != null ? provider.getId() : embeddingGateway.defaultProvider().getId();
                        return Mono.<List<Float>>error(new DimensionMismatchException(name, "retrieve", stored, vector.size()));
                    }
                    return Mono.just(vector);
                })
                .defaultIfEmpty(vector);
    }

    private Mono<RetrievalResult> textFallback(String question, int k, Throwable cause) {
        return vectorStore.textSearch(question, k)
                .map(sources -> result(sources, sources.isEmpty() ? RetrievalStrategy.NONE : RetrievalStrategy.TEXT_FALLBACK))
                .onErrorMap(error -> {
                    log.error("Text fallback failed: {}", error.getMessage());
                    return new RetrievalException(error.getMessage(), cause != null ? cause : error);
                });
    }

    private RetrievalResult result(List<Source> sources, RetrievalStrategy strategy) {
        return RetrievalResult.builder()
                .sources(sources)
                .strategy(strategy)
                .storeAvailable(vectorStore.isAvailable())
                .build();
    }

    private static List<Source> toSources(List<ScoredChunk> hits) {
        return hits.stream()
                .map(hit -> Source.builder()
                        .text(hit.chunk().getText())
                        .score(hit.score())
                        .metadata(hit.chunk().toMetadata())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Dimension and count mismatches, bad configuration and failures of the fallback itself are final.
     */
    private static boolean canFallBack(Throwable error) {
        return !(error instanceof DimensionMismatchException
                || error instanceof EmbeddingCountMismatchException
                || error instanceof ConfigurationException
                || error instanceof RetrievalException
                || error instanceof IllegalArgumentException);
    }
}
