package org.lite.knowledge.service;

import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.model.ExtractedKnowledge;
import org.lite.knowledge.model.GraphSchema;
import reactor.core.publisher.Mono;

/**
 * LLM-driven graph schema inference and entity extraction. Never fails on bad model output:
 * both operations fall back to a fixed result instead.
 */
public interface KnowledgeGraphExtractionService {

    /**
     * Propose node labels and relationship types for a text sample.
     * Falls back to {@link GraphSchema#fallback()} when the provider is unhealthy or answers with invalid JSON.
     */
    Mono<GraphSchema> inferSchema(String sample, LlmProviderType provider);

    /**
     * Extract entities and relationships from one chunk, guided by {@code schema}.
     * Falls back to {@link ExtractedKnowledge#empty()} on any provider or parsing failure.
     */
    Mono<ExtractedKnowledge> extract(String chunkText, GraphSchema schema, LlmProviderType provider);
}
