package org.lite.knowledge.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Retryable provider failure (HTTP 5xx). The embedding gateway retries these with backoff.
 */
@Getter
public class TransientProviderException extends KnowledgePipelineException {

    private final int statusCode;
    private final Duration retryAfter;

    public TransientProviderException(String provider, String operation, int statusCode, Duration retryAfter) {
        this(String.format("Provider '%s' returned HTTP %d during %s", provider, statusCode, operation),
                provider, operation, statusCode, retryAfter);
    }

    protected TransientProviderException(String message, String provider, String operation, int statusCode, Duration retryAfter) {
        super(message, provider, operation, 1, null);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }
}
