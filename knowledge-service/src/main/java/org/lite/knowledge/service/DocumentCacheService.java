package org.lite.knowledge.service;

import org.lite.knowledge.dto.CacheStats;
import org.lite.knowledge.model.CachedDocument;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * In-memory staging area for uploaded documents, bounded by capacity and time-to-live.
 * Expired entries are dropped lazily on access and periodically by a background reaper.
 */
public interface DocumentCacheService {

    /**
     * Cache extracted text.
     * @return the generated key
     * @throws org.lite.knowledge.exception.CacheFullException (as an error signal) when the cache is full
     *         even after purging expired entries
     */
    Mono<String> store(String text, String filename, long sizeBytes, double processingTimeMs);

    /**
     * Live entry for {@code key}, empty when absent or expired. Reading refreshes the access time.
     */
    Mono<CachedDocument> get(String key);

    /**
     * Like {@link #get(String)} but fails with
     * {@link org.lite.knowledge.exception.CachedDocumentNotFoundException} instead of completing empty.
     */
    Mono<CachedDocument> require(String key);

    Mono<Boolean> remove(String key);

    /**
     * Live entries, newest first.
     */
    Mono<List<CachedDocument>> list();

    Mono<CacheStats> stats();

    /**
     * @return number of entries removed
     */
    Mono<Integer> purgeExpired();

    Mono<Integer> clear();

    /**
     * Stop the background reaper. Idempotent.
     */
    void shutdown();
}
