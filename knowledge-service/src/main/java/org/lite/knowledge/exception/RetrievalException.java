package org.lite.knowledge.exception;

/**
 * Both the vector path and the text fallback failed (or the fallback was disabled).
 */
public class RetrievalException extends KnowledgePipelineException {

    public RetrievalException(String message, Throwable cause) {
        super("Error during retrieval: " + message, null, "retrieve", 1, cause);
    }
}
