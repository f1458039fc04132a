package org.lite.knowledge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schema inference over a cached document.
 * When both are given, {@code maxSampleLength} wins over {@code samplePercentage}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaInferenceRequest {
    private String documentKey;
    private Double samplePercentage;
    private Integer maxSampleLength;
    private String provider;
}
