package org.lite.knowledge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.exception.KnowledgePipelineException;
import org.lite.knowledge.exception.ProviderFailureException;
import org.lite.knowledge.exception.ProviderUnavailableException;
import org.lite.knowledge.exception.RateLimitedException;
import org.lite.knowledge.exception.TransientProviderException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps provider HTTP responses and transport failures onto the pipeline exception types,
 * and converts JSON arrays into vectors. Shared by all provider implementations.
 */
@Slf4j
public final class ProviderHttpErrors {

    // Gemini puts the wait in the message body, e.g. "Please retry in 46.912382516s"
    private static final Pattern RETRY_HINT = Pattern.compile("retry in\\s+([0-9]+(?:\\.[0-9]+)?)\\s*s",
            Pattern.CASE_INSENSITIVE);
    private static final int MAX_DETAIL_LENGTH = 300;

    private ProviderHttpErrors() {
    }

    /**
     * For {@code retrieve().onStatus(HttpStatusCode::isError, ...)}.
     */
    public static Mono<? extends Throwable> toException(String provider, String operation, ClientResponse response) {
        int status = response.statusCode().value();
        String retryAfterHeader = response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> classify(provider, operation, status, retryAfterHeader, body));
    }

    public static KnowledgePipelineException classify(String provider, String operation, int status,
                                                      String retryAfterHeader, String body) {
        if (status == 429) {
            Duration retryAfter = parseRetryAfter(retryAfterHeader, body);
            log.warn("Rate limit from {} during {} (retry after: {})", provider, operation, retryAfter);
            return new RateLimitedException(provider, operation, retryAfter);
        }
        if (status >= 500) {
            log.warn("Server error {} from {} during {}", status, provider, operation);
            return new TransientProviderException(provider, operation, status, parseRetryAfter(retryAfterHeader, null));
        }
        log.error("Provider {} rejected {} with HTTP {}: {}", provider, operation, status, abbreviate(body));
        return new ProviderFailureException(provider, operation, status, abbreviate(body));
    }

    /**
     * Retry-After in seconds from the header, else a "retry in Ns" hint in the body, else null.
     */
    public static Duration parseRetryAfter(String header, String body) {
        if (header != null && !header.isBlank()) {
            try {
                return Duration.ofMillis(Math.round(Double.parseDouble(header.trim()) * 1000));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric Retry-After header: {}", header);
            }
        }
        if (body != null) {
            Matcher matcher = RETRY_HINT.matcher(body);
            if (matcher.find()) {
                return Duration.ofMillis((long) Math.ceil(Double.parseDouble(matcher.group(1)) * 1000));
            }
        }
        return null;
    }

    /**
     * For {@code onErrorMap}: connection-level failures become {@link ProviderUnavailableException},
     * pipeline exceptions pass through untouched.
     */
    public static Throwable mapTransportError(String provider, String operation, Throwable error) {
        if (error instanceof KnowledgePipelineException) {
            return error;
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return new ProviderUnavailableException(provider, operation, error);
        }
        return new ProviderFailureException(provider, operation, 1, error);
    }

    public static List<Float> toVector(JsonNode array) {
        List<Float> vector = new ArrayList<>(array.size());
        for (JsonNode value : array) {
            vector.add((float) value.asDouble());
        }
        return vector;
    }

    public static ProviderFailureException malformedResponse(String provider, String operation, String detail) {
        return new ProviderFailureException(provider, operation, 1, new IllegalStateException(detail));
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_DETAIL_LENGTH ? body.substring(0, MAX_DETAIL_LENGTH) + "..." : body;
    }
}
