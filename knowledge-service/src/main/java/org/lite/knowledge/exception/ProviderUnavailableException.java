package org.lite.knowledge.exception;

/**
 * Exception thrown when a provider cannot be reached at all (connection refused, DNS, health check)
 */
public class ProviderUnavailableException extends KnowledgePipelineException {

    public ProviderUnavailableException(String provider, String operation, Throwable cause) {
        super(String.format("Provider '%s' is unavailable during %s", provider, operation),
                provider, operation, 1, cause);
    }
}
