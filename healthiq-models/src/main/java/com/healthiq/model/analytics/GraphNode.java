package com.healthiq.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Concept graph node keyed by (concept, category). Counts and the seen-range only ever grow.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class GraphNode {

    protected String id;
    protected String concept;
    protected ConceptCategory category;
    protected int occurrenceCount;
    protected Instant firstSeen;
    protected Instant lastSeen;

    public static String idOf(String concept, ConceptCategory category) {
        return category.value() + ":" + concept;
    }
}
