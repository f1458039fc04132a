package org.lite.knowledge.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DocumentSummary {
    String documentId;
    String filename;
    long chunkCount;
    Instant ingestedAt;
}
