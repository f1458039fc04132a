package org.lite.knowledge.model;

import java.util.List;

/**
 * Entities and relationships pulled out of one chunk.
 */
public record ExtractedKnowledge(List<Entity> entities, List<Relationship> relationships) {

    public static ExtractedKnowledge empty() {
        return new ExtractedKnowledge(List.of(), List.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }

    public record Entity(String label, String name) {
    }

    public record Relationship(String source, String target, String type) {
    }
}
