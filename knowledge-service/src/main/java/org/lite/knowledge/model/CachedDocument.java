package org.lite.knowledge.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lite.knowledge.enums.CachedFileType;

import java.time.Instant;

/**
 * Raw uploaded text staged in memory for later analysis.
 * Instances are immutable; a read replaces the cached entry with a copy carrying the new access time.
 */
@Getter
@Builder
@ToString(exclude = "rawText")
public class CachedDocument {

    private final String key;
    private final String filename;
    private final String rawText;
    private final CachedFileType fileType;
    private final long sizeBytes;
    private final TextStats textStats;
    private final double processingTimeMs;
    private final Instant createdAt;
    private final Instant expiresAt;
    private final Instant lastAccessedAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public CachedDocument accessedAt(Instant now) {
        return CachedDocument.builder()
                .key(key)
                .filename(filename)
                .rawText(rawText)
                .fileType(fileType)
                .sizeBytes(sizeBytes)
                .textStats(textStats)
                .processingTimeMs(processingTimeMs)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .lastAccessedAt(now)
                .build();
    }
}
