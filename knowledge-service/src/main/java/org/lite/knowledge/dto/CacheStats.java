package org.lite.knowledge.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    int count;
    int maxCount;
    double memoryMB;
    double totalFileSizeMB;
    long ttlMinutes;
    long cleanupIntervalMinutes;
}
