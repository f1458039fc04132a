package org.lite.knowledge.exception;

/**
 * Exception thrown when the document cache is at capacity even after expired entries were purged
 */
public class CacheFullException extends KnowledgePipelineException {

    public CacheFullException(int maxDocuments) {
        super(String.format("Cache full: maximum %d documents allowed", maxDocuments), null, "cache-store", 0, null);
    }
}
