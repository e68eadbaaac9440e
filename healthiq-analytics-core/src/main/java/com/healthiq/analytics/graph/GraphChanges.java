package com.healthiq.analytics.graph;

import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.GraphNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Nodes and edges touched while processing one event.
 */
public record GraphChanges(List<GraphNode> upsertedNodes, List<GraphEdge> addedEdges, List<GraphEdge> reinforcedEdges) {

    public static GraphChanges empty() {
        return new GraphChanges(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    public void addAll(GraphChanges other) {
        this.upsertedNodes.addAll(other.upsertedNodes);
        this.addedEdges.addAll(other.addedEdges);
        this.reinforcedEdges.addAll(other.reinforcedEdges);
    }

    public boolean isEmpty() {
        return upsertedNodes.isEmpty() && addedEdges.isEmpty() && reinforcedEdges.isEmpty();
    }
}
