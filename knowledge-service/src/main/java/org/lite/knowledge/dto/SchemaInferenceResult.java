package org.lite.knowledge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.lite.knowledge.model.GraphSchema;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaInferenceResult {
    GraphSchema schema;
    String provider;
    /** null for schema inferred from direct text */
    DocumentInfo documentInfo;

    @Value
    @Builder
    public static class DocumentInfo {
        String key;
        String filename;
        int totalChars;
        int sampleSize;
        double samplePercentage;
    }
}
