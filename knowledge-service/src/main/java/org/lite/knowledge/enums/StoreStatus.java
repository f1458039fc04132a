package org.lite.knowledge.enums;

/**
 * Operating state of the vector store adapter.
 * DEGRADED means writes are no-ops and reads return nothing.
 */
public enum StoreStatus {
    AVAILABLE,
    DEGRADED
}
