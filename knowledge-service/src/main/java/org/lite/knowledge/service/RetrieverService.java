package org.lite.knowledge.service;

import org.lite.knowledge.dto.RetrievalResult;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.model.Source;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Finds the chunks most relevant to a question: vector similarity first, case-insensitive substring
 * matching as the fallback.
 */
public interface RetrieverService {

    Mono<List<Source>> retrieve(String question);

    Mono<List<Source>> retrieve(String question, int k);

    Mono<List<Source>> retrieve(String question, int k, boolean fallbackEnabled);

    Mono<List<Source>> retrieve(String question, int k, boolean fallbackEnabled, LlmProviderType provider);

    /**
     * Same as {@link #retrieve(String, int, boolean, LlmProviderType)} but also reports which strategy
     * produced the sources and whether the store was reachable.
     * @throws org.lite.knowledge.exception.DimensionMismatchException (as an error signal) when the question
     *         embedding does not match the stored embeddings
     * @throws org.lite.knowledge.exception.RetrievalException (as an error signal) when the vector path failed
     *         and the fallback is disabled or failed too
     */
    Mono<RetrievalResult> retrieveDetailed(String question, int k, boolean fallbackEnabled, LlmProviderType provider);
}
