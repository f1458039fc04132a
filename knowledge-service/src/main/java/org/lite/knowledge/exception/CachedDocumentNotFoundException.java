package org.lite.knowledge.exception;

/**
 * Exception thrown when a cache key is unknown or its entry has expired
 */
public class CachedDocumentNotFoundException extends KnowledgePipelineException {

    public CachedDocumentNotFoundException(String key) {
        super(String.format("Document '%s' not found or expired", key), null, "cache-get", 0, null);
    }
}
