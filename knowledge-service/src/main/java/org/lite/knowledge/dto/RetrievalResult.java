package org.lite.knowledge.dto;

import lombok.Builder;
import lombok.Value;
import org.lite.knowledge.enums.RetrievalStrategy;
import org.lite.knowledge.model.Source;

import java.util.List;

@Value
@Builder
public class RetrievalResult {
    List<Source> sources;
    RetrievalStrategy strategy;
    /** false when the store was unreachable, so an empty list does not mean "no matches" */
    boolean storeAvailable;
}
