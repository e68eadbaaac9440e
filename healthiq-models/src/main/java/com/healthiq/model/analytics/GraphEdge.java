package com.healthiq.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Directed concept graph edge keyed by (sourceNodeId, targetNodeId, relation).
 * Source and target are always different nodes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class GraphEdge {

    public static final double INITIAL_WEIGHT = 1.0d;
    public static final double REINFORCEMENT = 0.5d;

    protected String id;
    protected String sourceNodeId;
    protected String targetNodeId;
    protected String sourceConcept;
    protected String targetConcept;
    protected GraphRelation relation;
    protected double weight;
    protected List<String> evidenceEventIds;
    protected Instant firstObserved;
    protected Instant lastObserved;

    public static String idOf(String sourceNodeId, String targetNodeId, GraphRelation relation) {
        return sourceNodeId + "|" + targetNodeId + "|" + relation.value();
    }
}
