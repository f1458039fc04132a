package org.lite.knowledge.exception;

/**
 * Terminal provider failure: either a non-retryable response (auth, malformed request)
 * or a retryable one that exhausted the retry budget.
 */
public class ProviderFailureException extends KnowledgePipelineException {

    public ProviderFailureException(String provider, String operation, int attempts, Throwable cause) {
        super(String.format("Provider '%s' failed during %s after %d attempt(s): %s", provider, operation, attempts,
                        cause != null ? cause.getMessage() : "unknown error"),
                provider, operation, attempts, cause);
    }

    public ProviderFailureException(String provider, String operation, int statusCode, String detail) {
        super(String.format("Provider '%s' rejected %s with HTTP %d: %s", provider, operation, statusCode, detail),
                provider, operation, 1, null);
    }
}
