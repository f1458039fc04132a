package org.lite.knowledge.provider;

import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.EmbeddingProperties;
import org.lite.knowledge.exception.ProviderFailureException;
import org.lite.knowledge.exception.TransientProviderException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Retry policy for remote provider calls. Only {@link TransientProviderException} (429 and 5xx) is retried;
 * the wait grows as {@code baseDelay * 2^(attempt-1)} capped at {@code maxDelay}, and a longer server
 * retry-after always wins. Once {@code maxAttempts} calls have failed the last error is wrapped in a
 * {@link ProviderFailureException} carrying the attempt count.
 */
@Slf4j
public final class ProviderRetrySpec {

    private static final int MAX_SHIFT = 30;

    private ProviderRetrySpec() {
    }

    public static Retry forProvider(String provider, String operation, EmbeddingProperties properties) {
        int maxAttempts = properties.getMaxAttempts();
        Duration baseDelay = properties.getBaseDelay();
        Duration maxDelay = properties.getMaxDelay();

        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            if (!(failure instanceof TransientProviderException)) {
                return Mono.error(failure);
            }
            long attempt = signal.totalRetries() + 1;
            if (attempt >= maxAttempts) {
                log.error("Giving up on {} {} after {} attempts", provider, operation, attempt);
                return Mono.error(new ProviderFailureException(provider, operation, (int) attempt, failure));
            }
            Duration retryAfter = ((TransientProviderException) failure).getRetryAfter();
            Duration delay = backoffDelay(attempt, retryAfter, baseDelay, maxDelay);
            log.warn("Attempt {}/{} of {} {} failed ({}), retrying in {} ms",
                    attempt, maxAttempts, provider, operation, failure.getMessage(), delay.toMillis());
            return Mono.delay(delay).thenReturn(attempt);
        }));
    }

    public static Duration backoffDelay(long attempt, Duration retryAfter, Duration baseDelay, Duration maxDelay) {
        long shift = Math.min(Math.max(attempt - 1, 0), MAX_SHIFT);
        long exponentialMillis;
        try {
            exponentialMillis = Math.multiplyExact(baseDelay.toMillis(), 1L << shift);
        } catch (ArithmeticException e) {
            exponentialMillis = Long.MAX_VALUE;
        }
        Duration delay = Duration.ofMillis(Math.min(exponentialMillis, maxDelay.toMillis()));
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            return retryAfter;
        }
        return delay;
    }
}
