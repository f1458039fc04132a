package org.lite.knowledge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Retrieval result: the text of a chunk and how well it matched. Never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Source {

    public static final double TEXT_MATCH_SCORE = 1.0;

    private String text;
    private double score;
    private Map<String, Object> metadata;
}
