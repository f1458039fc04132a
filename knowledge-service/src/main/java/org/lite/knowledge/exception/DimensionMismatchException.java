package org.lite.knowledge.exception;

import lombok.Getter;

/**
 * A freshly generated embedding does not match the dimension already stored in the vector index.
 */
@Getter
public class DimensionMismatchException extends KnowledgePipelineException {

    private final int storedDimension;
    private final int generatedDimension;

    public DimensionMismatchException(String provider, String operation, int storedDimension, int generatedDimension) {
        super(String.format("Embedding dimension mismatch during %s: store holds %d-dimensional vectors but provider '%s' produced %d",
                operation, storedDimension, provider, generatedDimension), provider, operation, 1, null);
        this.storedDimension = storedDimension;
        this.generatedDimension = generatedDimension;
    }
}
