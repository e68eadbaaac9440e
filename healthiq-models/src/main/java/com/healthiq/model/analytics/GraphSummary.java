package com.healthiq.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * Read model of a concept graph: totals plus the top nodes and strongest edges, both already sorted.
 */
@RegisterForReflection
public record GraphSummary(int nodeCount, int edgeCount, List<GraphNode> topConcepts, List<GraphEdge> strongestEdges) {

    public static GraphSummary empty() {
        return new GraphSummary(0, 0, List.of(), List.of());
    }
}
