package org.lite.knowledge.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A bounded slice of a document plus its embedding. Immutable once written.
 */
@Value
@Builder
public class Chunk {

    String id;

    String text;

    @ToString.Exclude
    List<Float> embedding;

    String documentId;

    int ordinal;

    String sourceFilename;

    Instant createdAt;

    public static String chunkId(String documentId, int ordinal) {
        return documentId + "-chunk-" + ordinal;
    }

    /**
     * Metadata exposed on retrieval sources; unknown values are left out.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (documentId != null) {
            metadata.put("documentId", documentId);
        }
        if (id != null) {
            metadata.put("chunkId", id);
        }
        metadata.put("ordinal", ordinal);
        if (sourceFilename != null) {
            metadata.put("sourceFilename", sourceFilename);
        }
        return metadata;
    }
}
