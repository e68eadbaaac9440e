package com.healthiq.analytics.graph;

import com.healthiq.model.analytics.ExtractedConcept;
import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.GraphNode;
import com.healthiq.model.analytics.GraphRelation;
import com.healthiq.model.analytics.GraphSummary;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of per-identity concept graphs. Upserts are keyed: nodes by (concept, category),
 * edges by (source, target, relation). Returned objects are copies.
 */
public interface GraphStore {

    /**
     * Creates the node with count 1 or increments its count, widening its seen-range to include {@code at}.
     */
    GraphNode upsertNode(String identity, ExtractedConcept concept, Instant at);

    /**
     * Creates the edge with the initial weight or reinforces it. Self-loops are ignored.
     *
     * @return the stored edge, or empty when source and target are the same node
     */
    Optional<GraphEdge> upsertEdge(String identity,
                                   ExtractedConcept source,
                                   ExtractedConcept target,
                                   GraphRelation relation,
                                   String evidenceEventId,
                                   Instant observedAt);

    List<GraphNode> findNodes(String identity);

    List<GraphEdge> findEdges(String identity);

    void clear(String identity);

    default GraphSummary summarize(String identity, int topN) {
        return GraphSummaries.summarize(findNodes(identity), findEdges(identity), topN);
    }
}
