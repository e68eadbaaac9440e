package com.healthiq.analytics.graph;

import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.exceptions.AnalyticsConfigurationException;
import com.healthiq.analytics.exceptions.MalformedEventException;
import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.GraphNode;
import com.healthiq.model.analytics.GraphRelation;
import com.healthiq.model.analytics.GraphSummary;
import com.healthiq.model.event.AdherenceOutcome;
import com.healthiq.model.event.EventTimestamp;
import com.healthiq.model.event.HealthEvent;
import com.healthiq.model.event.SymptomEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.healthiq.analytics.TestEvents.clinical;
import static com.healthiq.analytics.TestEvents.insight;
import static com.healthiq.analytics.TestEvents.lifestyle;
import static com.healthiq.analytics.TestEvents.medication;
import static com.healthiq.analytics.TestEvents.symptom;
import static org.junit.jupiter.api.Assertions.*;

public class HealthGraphBuilderTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private final HealthGraphBuilder builder = new HealthGraphBuilder(AnalyticsSettings.defaults());

    private static Instant hours(long h) {
        return T0.plus(Duration.ofHours(h));
    }

    private static Optional<GraphEdge> edge(GraphSummary summary, String source, String target, GraphRelation relation) {
        String id = GraphEdge.idOf(source, target, relation);
        return summary.strongestEdges().stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    private static Optional<GraphNode> node(GraphSummary summary, String id) {
        return summary.topConcepts().stream().filter(n -> n.getId().equals(id)).findFirst();
    }

    @Test
    public void medicationThenSymptomCreatesMedicationResponseEdge() {
        GraphSummary summary = builder.build(List.of(
                medication("m1", T0, "Ibuprofen", AdherenceOutcome.TAKEN),
                symptom("s1", hours(2), "headache", "5/10")), 15);

        assertEquals(2, summary.nodeCount());
        assertEquals(1, summary.edgeCount());
        GraphEdge e = edge(summary, "medication:ibuprofen", "symptom:headache", GraphRelation.MEDICATION_RESPONSE).orElseThrow();
        assertEquals(1.0d, e.getWeight());
        assertEquals("ibuprofen", e.getSourceConcept());
        assertEquals("headache", e.getTargetConcept());
        assertEquals(List.of("s1"), e.getEvidenceEventIds());
        assertEquals(hours(2), e.getFirstObserved());
    }

    @Test
    public void repeatedPairReinforcesByHalf() {
        GraphSummary summary = builder.build(List.of(
                medication("m1", T0, "Ibuprofen", AdherenceOutcome.TAKEN),
                symptom("s1", hours(2), "headache", null),
                symptom("s2", hours(4), "headache", null)), 15);

        GraphEdge e = edge(summary, "medication:ibuprofen", "symptom:headache", GraphRelation.MEDICATION_RESPONSE).orElseThrow();
        assertEquals(1.5d, e.getWeight());
        assertEquals(List.of("s1", "s2"), e.getEvidenceEventIds());
        assertEquals(hours(4), e.getLastObserved());
        // same-concept pair is a self-loop and never stored
        assertEquals(1, summary.edgeCount());
        assertEquals(2, node(summary, "symptom:headache").orElseThrow().getOccurrenceCount());
        assertEquals(hours(2), node(summary, "symptom:headache").orElseThrow().getFirstSeen());
        assertEquals(hours(4), node(summary, "symptom:headache").orElseThrow().getLastSeen());
    }

    @Test
    public void windowBoundaryIsInclusive() {
        GraphSummary inside = builder.build(List.of(
                symptom("s1", T0, "nausea", null),
                symptom("s2", hours(48), "dizzy", null)), 15);
        assertEquals(1, inside.edgeCount());

        GraphSummary outside = builder.build(List.of(
                symptom("s1", T0, "nausea", null),
                symptom("s2", hours(49), "dizzy", null)), 15);
        assertEquals(0, outside.edgeCount());
        assertEquals(2, outside.nodeCount());
    }

    @Test
    public void relationDependsOnCategoryPair() {
        GraphSummary summary = builder.build(List.of(
                lifestyle("l1", T0, "poor sleep", null),
                symptom("s1", hours(1), "fatigue", null),
                clinical("c1", hours(2), null)), 15);

        assertTrue(edge(summary, "lifestyle:poor_sleep", "symptom:fatigue", GraphRelation.TEMPORAL_SEQUENCE).isPresent());
        assertTrue(edge(summary, "symptom:fatigue", "clinical:doctor_visit", GraphRelation.CO_OCCURRENCE).isPresent());
        assertTrue(edge(summary, "lifestyle:poor_sleep", "clinical:doctor_visit", GraphRelation.CO_OCCURRENCE).isPresent());
        assertTrue(summary.strongestEdges().stream().noneMatch(e -> e.getRelation() == GraphRelation.REPORTED_TRIGGER));
    }

    @Test
    public void equalTimestampsUseInputOrderForDirection() {
        GraphSummary summary = builder.build(List.of(
                symptom("s1", T0, "cough", null),
                symptom("s2", T0, "fever", null)), 15);
        assertTrue(edge(summary, "symptom:cough", "symptom:fever", GraphRelation.CO_OCCURRENCE).isPresent());
        assertFalse(edge(summary, "symptom:fever", "symptom:cough", GraphRelation.CO_OCCURRENCE).isPresent());
    }

    @Test
    public void lateArrivingEarlierEventBecomesSource() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        SymptomEvent later = symptom("s2", hours(10), "fever", null);
        SymptomEvent earlier = symptom("s1", hours(1), "cough", null);
        builder.process(store, "u1", later, List.of());
        GraphChanges changes = builder.process(store, "u1", earlier, List.of(later));

        assertEquals(1, changes.addedEdges().size());
        GraphEdge e = changes.addedEdges().get(0);
        assertEquals("symptom:cough", e.getSourceNodeId());
        assertEquals("symptom:fever", e.getTargetNodeId());
    }

    @Test
    public void historyEntryWithSameIdIsSkipped() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        SymptomEvent s = symptom("s1", T0, "cough and fever", null);
        GraphChanges changes = builder.process(store, "u1", s, List.of(s));
        assertEquals(2, changes.upsertedNodes().size());
        assertTrue(changes.addedEdges().isEmpty());
        assertTrue(store.findEdges("u1").isEmpty());
    }

    @Test
    public void incrementalWithWindowedHistoryMatchesBatch() {
        List<HealthEvent> events = new ArrayList<>();
        events.add(medication("m1", T0, "Sumatriptan", AdherenceOutcome.TAKEN));
        events.add(symptom("s1", hours(3), "migraine with nausea", "7/10"));
        events.add(lifestyle("l1", hours(12), "bad sleep", "stressed"));
        events.add(insight("i1", hours(13), "s1"));
        events.add(symptom("s2", hours(30), "headache", "6"));
        events.add(medication("m2", hours(31), "Sumatriptan", AdherenceOutcome.MISSED));
        events.add(symptom("s3", hours(80), "headache", "mild"));
        events.add(clinical("c1", hours(81), "Migraine"));
        events.add(lifestyle("l2", hours(82), "slept well", null));
        events.add(symptom("s4", hours(100), "nausea", null));
        events.add(symptom("s5", hours(100), "headache", null));

        GraphSummary batch = builder.build(events, 50);

        InMemoryGraphStore store = new InMemoryGraphStore();
        List<HealthEvent> processed = new ArrayList<>();
        for (HealthEvent event : events) {
            Instant at = Instant.parse(event.getTimestamp().getAbsolute());
            // only what the caller must supply: prior events within the window
            List<HealthEvent> windowed = processed.stream()
                    .filter(p -> Duration.between(Instant.parse(p.getTimestamp().getAbsolute()), at).abs()
                            .compareTo(Duration.ofHours(48)) <= 0)
                    .toList();
            builder.process(store, "u1", event, windowed);
            processed.add(event);
        }
        GraphSummary incremental = builder.summarize(store, "u1", 50);

        assertEquals(batch.nodeCount(), incremental.nodeCount());
        assertEquals(batch.edgeCount(), incremental.edgeCount());
        assertEquals(batch.topConcepts(), incremental.topConcepts());
        assertEquals(batch.strongestEdges(), incremental.strongestEdges());
    }

    @Test
    public void rebuildIsDeterministic() {
        List<HealthEvent> events = List.of(
                symptom("s1", T0, "headache", null),
                lifestyle("l1", hours(1), "poor sleep", null),
                symptom("s2", hours(2), "headache", null));
        assertEquals(builder.build(events, 15), builder.build(events, 15));
    }

    @Test
    public void summaryRanksByCountThenFirstSeen() {
        GraphSummary summary = builder.build(List.of(
                symptom("s1", T0, "cough", null),
                symptom("s2", hours(100), "fever", null),
                symptom("s3", hours(200), "fever", null),
                symptom("s4", hours(300), "rash", null)), 2);

        assertEquals(3, summary.nodeCount());
        assertEquals(List.of("symptom:fever", "symptom:cough"),
                summary.topConcepts().stream().map(GraphNode::getId).toList());
    }

    @Test
    public void emptyInputGivesEmptySummary() {
        assertEquals(GraphSummary.empty(), builder.build(List.of(), 15));
    }

    @Test
    public void topNOutOfRange() {
        assertThrows(AnalyticsConfigurationException.class, () -> builder.build(List.of(), 0));
        assertDoesNotThrow(() -> builder.build(List.of(symptom("s1", T0, "cough", null)), 500));
    }

    @Test
    public void malformedTimestampFailsFast() {
        SymptomEvent bad = SymptomEvent.builder()
                .id("bad")
                .timestamp(EventTimestamp.of("yesterday-ish"))
                .description("headache")
                .build();
        MalformedEventException ex = assertThrows(MalformedEventException.class,
                () -> builder.build(List.of(symptom("s1", T0, "cough", null), bad), 15));
        assertEquals("bad", ex.getEventId());
    }

    @Test
    public void malformedHistoryLeavesStoreUntouched() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        SymptomEvent badHistory = SymptomEvent.builder()
                .id("old")
                .timestamp(EventTimestamp.of("yesterday"))
                .description("nausea")
                .build();
        HealthEvent s2 = symptom("s2", hours(2), "headache", null);

        MalformedEventException ex = assertThrows(MalformedEventException.class,
                () -> builder.process(store, "u1", s2, List.of(badHistory)));
        assertEquals("old", ex.getEventId());
        assertTrue(store.findNodes("u1").isEmpty());
        assertTrue(store.findEdges("u1").isEmpty());

        builder.process(store, "u1", s2, List.of());
        assertEquals(1, store.findNodes("u1").get(0).getOccurrenceCount());
    }

    @Test
    public void mixedBatchHasNoSelfLoops() {
        GraphSummary summary = builder.build(List.of(
                medication("m1", T0, "Sumatriptan", AdherenceOutcome.TAKEN),
                symptom("s1", hours(1), "migraine with nausea", "7/10"),
                symptom("s2", hours(2), "headache", null),
                lifestyle("l1", hours(3), "bad sleep", "stressed"),
                symptom("s3", hours(4), "headache and nausea", null),
                medication("m2", hours(5), "Sumatriptan", AdherenceOutcome.TAKEN),
                clinical("c1", hours(6), "Migraine"),
                symptom("s4", hours(6), "migraine", null)), 50);

        assertFalse(summary.strongestEdges().isEmpty());
        for (GraphEdge e : summary.strongestEdges()) {
            assertNotEquals(e.getSourceNodeId(), e.getTargetNodeId(), e.getId());
        }
    }
}
