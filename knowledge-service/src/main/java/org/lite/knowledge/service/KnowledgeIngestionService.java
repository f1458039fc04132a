package org.lite.knowledge.service;

import org.lite.knowledge.dto.IngestionResult;
import org.lite.knowledge.enums.LlmProviderType;
import reactor.core.publisher.Mono;

/**
 * Ingests documents into the vector store: chunk, embed, persist, and optionally extract a knowledge graph.
 */
public interface KnowledgeIngestionService {

    /**
     * Ingest already extracted text.
     * <p>
     * Embedding failures degrade to zero vectors and an unreachable store skips persistence; both are
     * reported as flags on the result. An embedding dimension that differs from the stored one, a wrong
     * number of embeddings, and text that yields no chunks fail the ingestion.
     * @param provider embedding provider, or null for the default one
     */
    Mono<IngestionResult> ingest(String content, String filename, LlmProviderType provider);

    /**
     * Ingest an uploaded file. Only UTF-8 {@code .txt} files are accepted.
     */
    Mono<IngestionResult> ingestFile(byte[] bytes, String filename, LlmProviderType provider);
}
