package org.lite.knowledge.exception;

/**
 * The vector-indexed store cannot be reached.
 */
public class StoreUnavailableException extends KnowledgePipelineException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Vector store is unavailable during " + operation, null, operation, 1, cause);
    }
}
