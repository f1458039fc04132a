package org.lite.knowledge.service;

import org.lite.knowledge.dto.DocumentSummary;
import org.lite.knowledge.enums.StoreStatus;
import org.lite.knowledge.model.Chunk;
import org.lite.knowledge.model.ExtractedKnowledge;
import org.lite.knowledge.model.KnowledgeDocument;
import org.lite.knowledge.model.ScoredChunk;
import org.lite.knowledge.model.Source;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Vector-indexed persistence of documents and their chunks.
 * <p>
 * While the store is {@link StoreStatus#DEGRADED} writes are skipped (returning the id they would have
 * written), reads come back empty, and destructive operations fail with
 * {@link org.lite.knowledge.exception.StoreUnavailableException}.
 */
public interface VectorStoreService {

    StoreStatus getStatus();

    boolean isAvailable();

    /**
     * Probe the store again and update the status.
     */
    Mono<StoreStatus> refreshStatus();

    /**
     * Current status; a degraded store is probed again once the reprobe interval has passed.
     */
    Mono<StoreStatus> currentStatus();

    /**
     * Make sure the configured vector index exists.
     * @return true when the index exists or was created, false when the store is degraded
     */
    Mono<Boolean> ensureIndex();

    Mono<Boolean> ensureIndex(String indexName, int dimension, String similarityFunction);

    /**
     * Persist a document and its chunks in one transaction, linking consecutive chunks with NEXT.
     * @return the document id
     */
    Mono<String> saveDocument(KnowledgeDocument document, List<Chunk> chunks);

    /**
     * Nearest chunks by vector similarity, best first.
     */
    Mono<List<ScoredChunk>> search(List<Float> queryVector, int k);

    /**
     * Chunks whose text contains {@code query}, ignoring case, in document ingestion then chunk order.
     * Every source is scored {@link Source#TEXT_MATCH_SCORE}.
     */
    Mono<List<Source>> textSearch(String query, int limit);

    /**
     * Length of the embeddings already stored; empty when nothing is stored.
     */
    Mono<Integer> getStoredEmbeddingDimension();

    /**
     * {@code vector.dimensions} of the configured vector index; empty when the index does not exist.
     */
    Mono<Integer> getIndexDimension();

    /**
     * Merge extracted entities and relationships, linked to the chunk by MENTIONS.
     * @return number of entities merged
     */
    Mono<Integer> saveKnowledgeGraph(String chunkId, ExtractedKnowledge knowledge);

    Mono<List<DocumentSummary>> listDocuments();

    Mono<List<Chunk>> listChunks(String documentId, int limit);

    /**
     * Delete a document with all of its chunks.
     * @return false when no such document exists
     */
    Mono<Boolean> deleteDocument(String documentId);

    /**
     * Drop the vector index and delete every node.
     */
    Mono<Void> clearDatabase();
}
