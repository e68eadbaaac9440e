package com.healthiq.analytics.graph;

import com.healthiq.model.analytics.ExtractedConcept;
import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.GraphNode;
import com.healthiq.model.analytics.GraphRelation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory graph store. Each identity's graph is guarded by its own monitor, so
 * different identities never contend.
 */
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, IdentityGraph> graphs = new ConcurrentHashMap<>();

    private IdentityGraph graph(String identity) {
        return graphs.computeIfAbsent(identity, i -> new IdentityGraph());
    }

    @Override
    public GraphNode upsertNode(String identity, ExtractedConcept concept, Instant at) {
        IdentityGraph graph = graph(identity);
        synchronized (graph) {
            String id = concept.nodeId();
            GraphNode node = graph.nodes.get(id);
            if (node == null) {
                node = GraphNode.builder()
                        .id(id)
                        .concept(concept.concept())
                        .category(concept.category())
                        .occurrenceCount(1)
                        .firstSeen(at)
                        .lastSeen(at)
                        .build();
                graph.nodes.put(id, node);
            } else {
                node.setOccurrenceCount(node.getOccurrenceCount() + 1);
                node.setFirstSeen(min(node.getFirstSeen(), at));
                node.setLastSeen(max(node.getLastSeen(), at));
            }
            return copy(node);
        }
    }

    @Override
    public Optional<GraphEdge> upsertEdge(String identity,
                                          ExtractedConcept source,
                                          ExtractedConcept target,
                                          GraphRelation relation,
                                          String evidenceEventId,
                                          Instant observedAt) {
        String sourceId = source.nodeId();
        String targetId = target.nodeId();
        if (sourceId.equals(targetId)) {
            return Optional.empty();
        }
        IdentityGraph graph = graph(identity);
        synchronized (graph) {
            String id = GraphEdge.idOf(sourceId, targetId, relation);
            GraphEdge edge = graph.edges.get(id);
            if (edge == null) {
                List<String> evidence = new ArrayList<>();
                evidence.add(evidenceEventId);
                edge = GraphEdge.builder()
                        .id(id)
                        .sourceNodeId(sourceId)
                        .targetNodeId(targetId)
                        .sourceConcept(source.concept())
                        .targetConcept(target.concept())
                        .relation(relation)
                        .weight(GraphEdge.INITIAL_WEIGHT)
                        .evidenceEventIds(evidence)
                        .firstObserved(observedAt)
                        .lastObserved(observedAt)
                        .build();
                graph.edges.put(id, edge);
            } else {
                edge.setWeight(edge.getWeight() + GraphEdge.REINFORCEMENT);
                edge.getEvidenceEventIds().add(evidenceEventId);
                edge.setFirstObserved(min(edge.getFirstObserved(), observedAt));
                edge.setLastObserved(max(edge.getLastObserved(), observedAt));
            }
            return Optional.of(copy(edge));
        }
    }

    @Override
    public List<GraphNode> findNodes(String identity) {
        IdentityGraph graph = graphs.get(identity);
        if (graph == null) {
            return new ArrayList<>();
        }
        synchronized (graph) {
            List<GraphNode> out = new ArrayList<>(graph.nodes.size());
            for (GraphNode n : graph.nodes.values()) out.add(copy(n));
            return out;
        }
    }

    @Override
    public List<GraphEdge> findEdges(String identity) {
        IdentityGraph graph = graphs.get(identity);
        if (graph == null) {
            return new ArrayList<>();
        }
        synchronized (graph) {
            List<GraphEdge> out = new ArrayList<>(graph.edges.size());
            for (GraphEdge e : graph.edges.values()) out.add(copy(e));
            return out;
        }
    }

    @Override
    public void clear(String identity) {
        graphs.remove(identity);
    }

    private static GraphNode copy(GraphNode n) {
        return n.toBuilder().build();
    }

    private static GraphEdge copy(GraphEdge e) {
        return e.toBuilder().evidenceEventIds(new ArrayList<>(e.getEvidenceEventIds())).build();
    }

    private static Instant min(Instant a, Instant b) {
        return a == null || b.isBefore(a) ? b : a;
    }

    private static Instant max(Instant a, Instant b) {
        return a == null || b.isAfter(a) ? b : a;
    }

    private static final class IdentityGraph {
        // insertion order keeps iteration deterministic
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Map<String, GraphEdge> edges = new LinkedHashMap<>();
    }
}
