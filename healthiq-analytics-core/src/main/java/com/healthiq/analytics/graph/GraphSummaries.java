package com.healthiq.analytics.graph;

import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.GraphNode;
import com.healthiq.model.analytics.GraphSummary;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Ranking rules for graph summaries.
 */
public final class GraphSummaries {

    // count desc, then earliest first seen, then id
    public static final Comparator<GraphNode> NODE_RANK = Comparator
            .comparingInt(GraphNode::getOccurrenceCount).reversed()
            .thenComparing(GraphNode::getFirstSeen, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GraphNode::getId);

    // weight desc, then earliest first observation, then key
    public static final Comparator<GraphEdge> EDGE_RANK = Comparator
            .comparingDouble(GraphEdge::getWeight).reversed()
            .thenComparing(GraphEdge::getFirstObserved, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GraphEdge::getId);

    private GraphSummaries() {}

    public static GraphSummary summarize(Collection<GraphNode> nodes, Collection<GraphEdge> edges, int topN) {
        List<GraphNode> topNodes = nodes.stream().sorted(NODE_RANK).limit(topN).toList();
        List<GraphEdge> topEdges = edges.stream().sorted(EDGE_RANK).limit(topN).toList();
        return new GraphSummary(nodes.size(), edges.size(), topNodes, topEdges);
    }
}
