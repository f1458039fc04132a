package org.lite.knowledge.model;

/**
 * Nearest-neighbour hit returned by the vector store.
 */
public record ScoredChunk(Chunk chunk, double score) {
}
