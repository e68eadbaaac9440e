package com.healthiq.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * A normalized concept derived from one event. Recomputed on demand and never stored.
 *
 * @param concept       normalized label, e.g. "headache"
 * @param category      category the label belongs to
 * @param sourceEventId id of the event the concept was extracted from
 * @param timestamp     the event's ISO-8601 timestamp
 */
@RegisterForReflection
public record ExtractedConcept(String concept, ConceptCategory category, String sourceEventId, String timestamp) {

    /**
     * Deterministic graph node id for this concept.
     */
    public String nodeId() {
        return GraphNode.idOf(concept, category);
    }
}
