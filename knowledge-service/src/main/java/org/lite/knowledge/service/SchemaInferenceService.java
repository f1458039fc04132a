package org.lite.knowledge.service;

import org.lite.knowledge.dto.SchemaInferenceRequest;
import org.lite.knowledge.dto.SchemaInferenceResult;
import reactor.core.publisher.Mono;

/**
 * Graph schema inference over a sample of a cached document or of direct text.
 */
public interface SchemaInferenceService {

    /**
     * Sample a cached document and infer a schema from the sample.
     * <p>
     * Sample size: {@code maxSampleLength} when given (it wins even if {@code samplePercentage} is also set),
     * else {@code samplePercentage} of the text (at least one character), else the configured default length.
     */
    Mono<SchemaInferenceResult> inferFromCachedDocument(SchemaInferenceRequest request);

    Mono<SchemaInferenceResult> inferFromText(String text, Integer maxSampleLength, String provider);
}
