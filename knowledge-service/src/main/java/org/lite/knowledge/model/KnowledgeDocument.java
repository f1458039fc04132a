package org.lite.knowledge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class KnowledgeDocument {
    String id;
    String filename;
    String filetype;
    Instant ingestedAt;
}
