package org.lite.knowledge.exception;

/**
 * A provider returned a different number of vectors than texts it was given.
 */
public class EmbeddingCountMismatchException extends KnowledgePipelineException {

    public EmbeddingCountMismatchException(String provider, int expected, int actual) {
        super(String.format("Mismatch in returned embeddings count from '%s'. Expected %d, got %d",
                provider, expected, actual), provider, "embed", 1, null);
    }
}
