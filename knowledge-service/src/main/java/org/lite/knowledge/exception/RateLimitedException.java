package org.lite.knowledge.exception;

import java.time.Duration;

/**
 * HTTP 429 from a provider. {@code retryAfter} is the minimum wait the server asked for, or null.
 */
public class RateLimitedException extends TransientProviderException {

    public RateLimitedException(String provider, String operation, Duration retryAfter) {
        super(String.format("Provider '%s' rate limited %s%s", provider, operation,
                        retryAfter != null ? " (retry after " + retryAfter.toMillis() + " ms)" : ""),
                provider, operation, 429, retryAfter);
    }
}
