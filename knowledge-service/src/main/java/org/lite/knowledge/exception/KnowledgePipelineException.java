package org.lite.knowledge.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the knowledge pipeline.
 * Carries the provider (when one is involved), the operation and the number of attempts
 * made, so the message can be shown to a caller without exposing transport details.
 */
@Getter
public class KnowledgePipelineException extends RuntimeException {

    private final String provider;
    private final String operation;
    private final int attempts;

    public KnowledgePipelineException(String message) {
        this(message, null, null, 0, null);
    }

    public KnowledgePipelineException(String message, Throwable cause) {
        this(message, null, null, 0, cause);
    }

    public KnowledgePipelineException(String message, String provider, String operation, int attempts, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.operation = operation;
        this.attempts = attempts;
    }
}
