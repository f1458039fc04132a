package org.lite.knowledge.provider;

import org.lite.knowledge.enums.LlmProviderType;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One embedding + text-generation backend. Each provider is an independent implementation;
 * {@link LlmProviderFactory} picks one from configuration or a per-call override.
 */
public interface LlmProvider {

    LlmProviderType type();

    /**
     * Remote providers sit behind rate limits, so the gateway batches and retries their calls.
     * The local provider gets one call per request.
     */
    boolean isRemote();

    int embeddingDimension();

    /**
     * Embed every text in a single request. Vectors come back in input order.
     * Errors are mapped to the pipeline exception types (rate limit, transient, unavailable, failure);
     * retrying is left to the caller.
     */
    Mono<List<List<Float>>> generateEmbeddings(List<String> texts);

    /**
     * Generate text for a prompt. With {@code jsonOutput} the provider is asked for a JSON document,
     * which callers still have to validate.
     */
    Mono<String> generateText(String prompt, boolean jsonOutput);

    /**
     * Health probe. Emits false instead of failing.
     */
    Mono<Boolean> isAvailable();
}
