package com.healthiq.analytics.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthiq.analytics.exceptions.MalformedEventException;
import com.healthiq.model.analytics.AnalyticsReport;
import com.healthiq.model.analytics.GraphSummary;
import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.analytics.RiskLevel;
import com.healthiq.model.analytics.RiskStatus;
import com.healthiq.model.event.AdherenceOutcome;
import com.healthiq.model.event.ClinicalEvent;
import com.healthiq.model.event.ConfidenceLevel;
import com.healthiq.model.event.EventSource;
import com.healthiq.model.event.HealthEvent;
import com.healthiq.model.event.HealthEventType;
import com.healthiq.model.event.InsightEvent;
import com.healthiq.model.event.InsightReviewStatus;
import com.healthiq.model.event.MedicationEvent;
import com.healthiq.model.event.SymptomEvent;
import com.healthiq.model.event.VisibilityScope;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HealthEventCodecTest {

    private final ObjectMapper mapper = HealthIqObjectMapperCustomizer.configure(new ObjectMapper());
    private final HealthEventCodec codec = new HealthEventCodec(mapper);

    private List<HealthEvent> fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/timeline.json")) {
            assertNotNull(in, "fixture missing");
            return codec.readEvents(in);
        }
    }

    @Test
    public void readsEveryEventType() throws IOException {
        List<HealthEvent> events = fixture();
        assertEquals(List.of(HealthEventType.MEDICATION, HealthEventType.SYMPTOM, HealthEventType.LIFESTYLE,
                        HealthEventType.CLINICAL, HealthEventType.INSIGHT),
                events.stream().map(HealthEvent::getEventType).toList());

        MedicationEvent med = (MedicationEvent) events.get(0);
        assertEquals(EventSource.PRESCRIPTION, med.getSource());
        assertEquals(ConfidenceLevel.HIGH, med.getConfidence());
        assertEquals(VisibilityScope.DOCTOR_SHAREABLE, med.getVisibilityScope());
        assertEquals(AdherenceOutcome.TAKEN, med.getAdherenceOutcome());

        SymptomEvent symptom = (SymptomEvent) events.get(1);
        assertEquals("6/10", symptom.getIntensity());
        assertEquals("evt-1", symptom.getTimestamp().getRelative().getReference());
        assertEquals(EventSource.USER, symptom.getSource());
        assertEquals(VisibilityScope.USER_ONLY, symptom.getVisibilityScope());

        assertEquals("Tension headache", ((ClinicalEvent) events.get(3)).getDiagnosisLabel());
        InsightEvent insight = (InsightEvent) events.get(4);
        assertEquals(InsightReviewStatus.REVIEWED, insight.getReviewStatus());
        assertEquals(List.of("evt-1", "evt-2"), insight.getEvidenceEventIds());
    }

    @Test
    public void fixtureTimestampsParse() throws IOException {
        List<HealthEvent> events = fixture();
        assertEquals(Instant.parse("2024-03-01T09:30:00Z"), EventTimestamps.parse(events.get(1)));
        assertEquals(Instant.parse("2024-03-01T22:00:00Z"), EventTimestamps.parse(events.get(2)));
        assertEquals(Instant.parse("2024-03-03T00:00:00Z"), EventTimestamps.parse(events.get(3)));
    }

    @Test
    public void writtenEventsReadBackEqual() throws IOException {
        List<HealthEvent> events = fixture();
        String json = codec.writeEvents(events);
        assertTrue(json.contains("\"eventType\":\"Symptom\""));
        assertEquals(events, codec.readEvents(json));
    }

    @Test
    public void unknownEventTypeIsMalformed() {
        String json = "[{\"id\":\"x\",\"eventType\":\"Vitals\",\"timestamp\":{\"absolute\":\"2024-03-01\"}}]";
        assertThrows(MalformedEventException.class, () -> codec.readEvents(json));
    }

    @Test
    public void brokenJsonIsMalformed() {
        assertThrows(MalformedEventException.class, () -> codec.readEvents("[{\"id\":"));
    }

    @Test
    public void reportUsesWireValuesAndIsoInstants() throws IOException {
        HsiScore hsi = new HsiScore(72, 70, 75, 71, 30, ConfidenceLevel.MEDIUM, List.of("evt-1"),
                Instant.parse("2026-03-31T12:00:00Z"));
        RiskStatus risk = new RiskStatus(RiskLevel.GREEN, 72, 0, 0, 0, "stable");
        AnalyticsReport report = new AnalyticsReport("u1", hsi, GraphSummary.empty(), List.of(), risk, List.of(), 1);

        JsonNode tree = mapper.readTree(codec.writeReport(report));
        assertEquals("2026-03-31T12:00:00Z", tree.at("/hsi/computedAt").asText());
        assertEquals("medium", tree.at("/hsi/dataConfidence").asText());
        assertEquals("green", tree.at("/risk/level").asText());
        assertFalse(tree.has("insufficientData"));
    }
}
