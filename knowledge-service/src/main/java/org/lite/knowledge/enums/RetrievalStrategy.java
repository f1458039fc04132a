package org.lite.knowledge.enums;

public enum RetrievalStrategy {
    VECTOR,          // nearest-neighbour search over the vector index
    TEXT_FALLBACK,   // case-insensitive substring match over chunk texts
    NONE             // nothing matched, or the store is degraded
}
