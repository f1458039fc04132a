package org.lite.knowledge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.model.GraphSchema;

/**
 * Outcome of one ingestion. A degraded ingestion still succeeds; the flags say what was skipped.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResult {
    String documentId;
    String filename;
    int chunkCount;
    LlmProviderType provider;
    boolean embeddingsDegraded;  // zero vectors were stored instead of real embeddings
    boolean storeDegraded;       // persistence was skipped or failed
    int graphChunksProcessed;
    GraphSchema inferredSchema;

    public String getStatus() {
        return embeddingsDegraded || storeDegraded ? "degraded" : "success";
    }
}
