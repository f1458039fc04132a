package org.lite.knowledge.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.ChunkingProperties;
import org.lite.knowledge.config.GraphExtractionProperties;
import org.lite.knowledge.dto.IngestionResult;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.exception.DimensionMismatchException;
import org.lite.knowledge.exception.EmbeddingCountMismatchException;
import org.lite.knowledge.exception.EmptyDocumentException;
import org.lite.knowledge.model.Chunk;
import org.lite.knowledge.model.GraphSchema;
import org.lite.knowledge.model.KnowledgeDocument;
import org.lite.knowledge.provider.LlmProvider;
import org.lite.knowledge.provider.LlmProviderFactory;
import org.lite.knowledge.service.ChunkingService;
import org.lite.knowledge.service.EmbeddingGatewayService;
import org.lite.knowledge.service.KnowledgeGraphExtractionService;
import org.lite.knowledge.service.KnowledgeIngestionService;
import org.lite.knowledge.service.VectorStoreService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeIngestionServiceImpl implements KnowledgeIngestionService {

    private final ChunkingService chunkingService;
    private final EmbeddingGatewayService embeddingGateway;
    private final VectorStoreService vectorStore;
    private final KnowledgeGraphExtractionService extractionService;
    private final LlmProviderFactory providerFactory;
    private final ChunkingProperties chunkingProperties;
    private final GraphExtractionProperties graphProperties;

    @Override
    public Mono<IngestionResult> ingest(String content, String filename, LlmProviderType provider) {
        return Mono.defer(() -> {
            LlmProviderType providerType = provider != null ? provider : embeddingGateway.defaultProvider();
            String documentId = UUID.randomUUID().toString();
            log.info("Ingesting {} as document {} with {}", filename, documentId, providerType.getId());

            return vectorStore.ensureIndex()
                    .onErrorResume(error -> {
                        log.error("Could not ensure vector index: {}", error.getMessage());
                        return Mono.just(false);
                    })
                    .then(Mono.fromCallable(() -> chunkingService.chunk(content)))
                    .flatMap(chunkResults -> {
                        if (chunkResults.isEmpty()) {
                            return Mono.error(new EmptyDocumentException(filename));
                        }
                        List<String> texts = chunkResults.stream()
                                .map(ChunkingService.ChunkResult::getText)
                                .collect(Collectors.toList());
                        log.info("Split {} into {} chunks", filename, texts.size());
                        return embedChunks(texts, providerType)
                                .flatMap(embedded -> persist(documentId, filename, content, texts, embedded, providerType));
                    });
        });
    }

    @Override
    public Mono<IngestionResult> ingestFile(byte[] bytes, String filename, LlmProviderType provider) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".txt")) {
            return Mono.error(new IllegalArgumentException("Unsupported file type: " + filename + ". Only .txt files can be ingested"));
        }
        return ingest(new String(bytes, StandardCharsets.UTF_8), filename, provider);
    }

    private Mono<EmbeddedChunks> embedChunks(List<String> texts, LlmProviderType providerType) {
        // stored chunks decide; an empty store is held to the dimension of its vector index
        Mono<Optional<Integer>> expectedDimension = vectorStore.getStoredEmbeddingDimension()
                .switchIfEmpty(Mono.defer(vectorStore::getIndexDimension))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(error -> {
                    log.warn("Could not read stored embedding dimension: {}", error.getMessage());
                    return Mono.just(Optional.empty());
                });

        return expectedDimension.flatMap(stored -> embeddingGateway.embed(texts, providerType)
                .flatMap(vectors -> {
                    int generated = vectors.get(0).size();
                    if (stored.isPresent() && stored.get() != generated) {
                        return Mono.<EmbeddedChunks>error(new DimensionMismatchException(
                                providerType.getId(), "ingest", stored.get(), generated));
                    }
                    return Mono.just(new EmbeddedChunks(vectors, false));
                })
                .onErrorResume(error -> !(error instanceof DimensionMismatchException)
                        && !(error instanceof EmbeddingCountMismatchException), error -> {
                    int dimension = stored.orElseGet(() -> embeddingGateway.dimensionFor(providerType));
                    log.warn("Embedding with {} failed, storing {}-dimensional zero vectors: {}",
                            providerType.getId(), dimension, error.getMessage());
                    return Mono.just(new EmbeddedChunks(EmbeddingGatewayService.zeroVectors(texts.size(), dimension), true));
                }));
    }

    private Mono<IngestionResult> persist(String documentId, String filename, String content, List<String> texts,
                                          EmbeddedChunks embedded, LlmProviderType providerType) {
        Instant now = Instant.now();
        KnowledgeDocument document = KnowledgeDocument.builder()
                .id(documentId)
                .filename(filename)
                .filetype(fileExtension(filename))
                .ingestedAt(now)
                .build();

        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            chunks.add(Chunk.builder()
                    .id(Chunk.chunkId(documentId, i))
                    .text(texts.get(i))
                    .embedding(embedded.vectors().get(i))
                    .documentId(documentId)
                    .ordinal(i)
                    .sourceFilename(filename)
                    .createdAt(now)
                    .build());
        }

        return vectorStore.saveDocument(document, chunks)
                .map(id -> !vectorStore.isAvailable())
                .onErrorResume(error -> {
                    log.error("Failed to persist document {}: {}", documentId, error.getMessage());
                    return Mono.just(true);
                })
                .flatMap(storeDegraded -> extractGraph(content, chunks, providerType, storeDegraded)
                        .map(graph -> IngestionResult.builder()
                                .documentId(documentId)
                                .filename(filename)
                                .chunkCount(chunks.size())
                                .provider(providerType)
                                .embeddingsDegraded(embedded.degraded())
                                .storeDegraded(storeDegraded)
                                .graphChunksProcessed(graph.chunksProcessed())
                                .inferredSchema(graph.schema())
                                .build()))
                .doOnNext(result -> log.info("Ingestion of {} finished: {} ({} chunks)",
                        filename, result.getStatus(), result.getChunkCount()));
    }

    private Mono<GraphOutcome> extractGraph(String content, List<Chunk> chunks, LlmProviderType providerType,
                                            boolean storeDegraded) {
        if (!graphProperties.isExtractionEnabled() || storeDegraded) {
            return Mono.just(GraphOutcome.SKIPPED);
        }
        LlmProvider provider = providerFactory.getProvider(providerType);
        if (provider.isRemote()) {
            return Mono.just(GraphOutcome.SKIPPED);
        }

        return provider.isAvailable()
                .flatMap(healthy -> {
                    if (!Boolean.TRUE.equals(healthy)) {
                        log.warn("Skipping graph extraction, {} is not healthy", providerType.getId());
                        return Mono.just(GraphOutcome.SKIPPED);
                    }
                    String sample = content.substring(0, Math.min(content.length(), chunkingProperties.getSchemaSampleLength()));
                    return extractionService.inferSchema(sample, providerType)
                            .flatMap(schema -> Flux.fromIterable(chunks)
                                    .concatMap(chunk -> extractionService.extract(chunk.getText(), schema, providerType)
                                            .flatMap(knowledge -> vectorStore.saveKnowledgeGraph(chunk.getId(), knowledge))
                                            .map(saved -> saved > 0)
                                            .onErrorResume(error -> {
                                                log.warn("Graph extraction failed for chunk {}: {}", chunk.getId(), error.getMessage());
                                                return Mono.just(false);
                                            }))
                                    .filter(Boolean::booleanValue)
                                    .count()
                                    .map(processed -> new GraphOutcome(schema, processed.intValue())));
                })
                .onErrorResume(error -> {
                    log.warn("Graph extraction skipped: {}", error.getMessage());
                    return Mono.just(GraphOutcome.SKIPPED);
                });
    }

    private static String fileExtension(String filename) {
        if (filename == null) {
            return "unknown";
        }
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && dot < filename.length() - 1 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "unknown";
    }

    private record EmbeddedChunks(List<List<Float>> vectors, boolean degraded) {
    }

    private record GraphOutcome(GraphSchema schema, int chunksProcessed) {
        static final GraphOutcome SKIPPED = new GraphOutcome(null, 0);
    }
}
