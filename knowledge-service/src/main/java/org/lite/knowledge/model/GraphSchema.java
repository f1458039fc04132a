package org.lite.knowledge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Node labels and relationship types proposed for a document.
 */
public record GraphSchema(
        @JsonProperty("node_labels") List<String> nodeLabels,
        @JsonProperty("relationship_types") List<String> relationshipTypes) {

    public static GraphSchema fallback() {
        return new GraphSchema(List.of("Entity", "Concept"), List.of("RELATED_TO", "MENTIONS"));
    }
}
