package com.healthiq.analytics.graph;

import com.healthiq.analytics.concept.ConceptExtractor;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimestamps;
import com.healthiq.analytics.event.TimedEvent;
import com.healthiq.model.analytics.ConceptCategory;
import com.healthiq.model.analytics.ExtractedConcept;
import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.GraphNode;
import com.healthiq.model.analytics.GraphRelation;
import com.healthiq.model.analytics.GraphSummary;
import com.healthiq.model.event.HealthEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds per-identity concept graphs from events.
 * <p>
 * Processing an event upserts one node per extracted concept and links each concept to the
 * concepts of every earlier-processed event within the co-occurrence window. Edges point from the
 * earlier event to the later one; on equal timestamps the previously processed event is the source.
 * </p>
 * <p>
 * The batch build replays events through the same incremental step over a scratch store, which is
 * what makes a batch rebuild and a sequence of incremental updates produce the same graph.
 * </p>
 */
@ApplicationScoped
public class HealthGraphBuilder {

    private static final Logger LOG = Logger.getLogger(HealthGraphBuilder.class);
    private static final String BATCH_IDENTITY = "batch";

    private final AnalyticsSettings settings;

    @Inject
    public HealthGraphBuilder(AnalyticsSettings settings) {
        this.settings = settings;
    }

    /**
     * Full rebuild from {@code events}, processed in input order. Does not touch any persistent store.
     */
    public GraphSummary build(List<? extends HealthEvent> events, int topN) {
        int limit = settings.resolveTopN(topN);
        if (events == null || events.isEmpty()) {
            return GraphSummary.empty();
        }
        InMemoryGraphStore scratch = new InMemoryGraphStore();
        List<HealthEvent> processed = new ArrayList<>(events.size());
        for (HealthEvent event : events) {
            process(scratch, BATCH_IDENTITY, event, processed);
            processed.add(event);
        }
        return scratch.summarize(BATCH_IDENTITY, limit);
    }

    public GraphSummary build(List<? extends HealthEvent> events) {
        return build(events, settings.getDefaultTopN());
    }

    /**
     * Incrementally folds {@code newEvent} into the identity's graph.
     *
     * @param history events already processed for this identity. It must contain every such event
     *                whose timestamp lies within the co-occurrence window of {@code newEvent};
     *                passing the full prior history is always correct, events outside the window
     *                are filtered here. Entries with the same id as {@code newEvent} are skipped.
     * @throws com.healthiq.analytics.exceptions.MalformedEventException if any timestamp is malformed; the store is then left unchanged
     */
    public GraphChanges process(GraphStore store,
                                String identity,
                                HealthEvent newEvent,
                                Collection<? extends HealthEvent> history) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(identity, "identity");
        Instant at = EventTimestamps.parse(newEvent);
        // every timestamp is parsed before the store is touched, so a malformed entry changes nothing
        List<TimedEvent<HealthEvent>> windowed = windowed(newEvent, at, history);
        GraphChanges changes = GraphChanges.empty();

        List<ExtractedConcept> concepts = ConceptExtractor.extract(newEvent);
        if (concepts.isEmpty()) {
            return changes;
        }
        for (ExtractedConcept concept : concepts) {
            GraphNode node = store.upsertNode(identity, concept, at);
            changes.upsertedNodes().add(node);
        }

        for (TimedEvent<HealthEvent> earlier : windowed) {
            // later timestamp is the target; ties keep the processed event as the source
            boolean earlierIsSource = !at.isBefore(earlier.at());
            for (ExtractedConcept fresh : concepts) {
                for (ExtractedConcept previous : ConceptExtractor.extract(earlier.event())) {
                    GraphRelation relation = classify(fresh.category(), previous.category());
                    Optional<GraphEdge> edge = earlierIsSource
                            ? store.upsertEdge(identity, previous, fresh, relation, newEvent.getId(), at)
                            : store.upsertEdge(identity, fresh, previous, relation, newEvent.getId(), at);
                    edge.ifPresent(e -> {
                        if (e.getWeight() == GraphEdge.INITIAL_WEIGHT) {
                            changes.addedEdges().add(e);
                        } else {
                            changes.reinforcedEdges().add(e);
                        }
                    });
                }
            }
        }
        LOG.debugf("Graph update for event %s: %d concept(s), %d windowed event(s), %d new edge(s), %d reinforced",
                newEvent.getId(), concepts.size(), windowed.size(), changes.addedEdges().size(), changes.reinforcedEdges().size());
        return changes;
    }

    private List<TimedEvent<HealthEvent>> windowed(HealthEvent newEvent,
                                                   Instant at,
                                                   Collection<? extends HealthEvent> history) {
        List<TimedEvent<HealthEvent>> out = new ArrayList<>();
        if (history == null) {
            return out;
        }
        Duration window = settings.coOccurrenceWindow();
        for (HealthEvent earlier : history) {
            if (Objects.equals(earlier.getId(), newEvent.getId())) {
                continue;
            }
            Instant earlierAt = EventTimestamps.parse(earlier);
            if (Duration.between(earlierAt, at).abs().compareTo(window) <= 0) {
                out.add(new TimedEvent<>(earlier, earlierAt));
            }
        }
        return out;
    }

    public GraphSummary summarize(GraphStore store, String identity, int topN) {
        return store.summarize(identity, settings.resolveTopN(topN));
    }

    /**
     * Relation between the concepts of two events. {@link GraphRelation#REPORTED_TRIGGER} is never
     * derived here.
     */
    static GraphRelation classify(ConceptCategory a, ConceptCategory b) {
        if (pair(a, b, ConceptCategory.MEDICATION, ConceptCategory.SYMPTOM)) {
            return GraphRelation.MEDICATION_RESPONSE;
        }
        if (pair(a, b, ConceptCategory.LIFESTYLE, ConceptCategory.SYMPTOM)) {
            return GraphRelation.TEMPORAL_SEQUENCE;
        }
        return GraphRelation.CO_OCCURRENCE;
    }

    private static boolean pair(ConceptCategory a, ConceptCategory b, ConceptCategory x, ConceptCategory y) {
        return (a == x && b == y) || (a == y && b == x);
    }
}
