package com.healthiq.analytics.concept;

import com.healthiq.analytics.TestEvents;
import com.healthiq.model.analytics.ConceptCategory;
import com.healthiq.model.analytics.ExtractedConcept;
import com.healthiq.model.event.AdherenceOutcome;
import com.healthiq.model.event.LifestyleEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConceptExtractorTest {

    private static final Instant AT = TestEvents.NOW;

    private static List<String> labels(List<ExtractedConcept> concepts) {
        return concepts.stream().map(ExtractedConcept::concept).toList();
    }

    @Test
    public void symptomEmitsEveryMatchingPhrase() {
        List<ExtractedConcept> concepts = ConceptExtractor.extract(
                TestEvents.symptom("s1", AT, "Severe headache and NAUSEA!", "8/10"));
        assertEquals(List.of("headache", "nausea"), labels(concepts));
        for (ExtractedConcept c : concepts) {
            assertEquals(ConceptCategory.SYMPTOM, c.category());
            assertEquals("s1", c.sourceEventId());
            assertEquals(AT.toString(), c.timestamp());
        }
    }

    @Test
    public void overlappingPhrasesAreAccumulated() {
        List<ExtractedConcept> concepts = ConceptExtractor.extract(
                TestEvents.symptom("s1", AT, "head pain and headache", null));
        assertEquals(List.of("headache", "headache"), labels(concepts));
    }

    @Test
    public void unmatchedSymptomFallsBackToLeadingTokens() {
        assertEquals(List.of("weird_tingling_in_left"),
                labels(ConceptExtractor.extract(TestEvents.symptom("s1", AT, "Weird   tingling in left toe", null))));
        assertEquals(List.of("unclassified_symptom"),
                labels(ConceptExtractor.extract(TestEvents.symptom("s2", AT, "!!!", null))));
    }

    @Test
    public void medicationUsesNormalizedName() {
        assertEquals(List.of("vitamin_d3"),
                labels(ConceptExtractor.extract(TestEvents.medication("m1", AT, " Vitamin D3 ", AdherenceOutcome.TAKEN))));
        assertEquals(List.of("unknown_medication"),
                labels(ConceptExtractor.extract(TestEvents.medication("m2", AT, "  ", AdherenceOutcome.TAKEN))));
    }

    @Test
    public void lifestyleMatchesKeywordsOncePerConcept() {
        List<ExtractedConcept> concepts = ConceptExtractor.extract(
                TestEvents.lifestyle("l1", AT, "Slept well", "very stressed at work, stressful day"));
        assertEquals(List.of("good_sleep", "high_stress"), labels(concepts));
        assertTrue(concepts.stream().allMatch(c -> c.category() == ConceptCategory.LIFESTYLE));
    }

    @Test
    public void lifestyleWithoutKeywordIsLogged() {
        assertEquals(List.of("lifestyle_logged"),
                labels(ConceptExtractor.extract(TestEvents.lifestyle("l1", AT, null, "went to a concert"))));
    }

    @Test
    public void emptyLifestyleYieldsNothing() {
        LifestyleEvent empty = TestEvents.lifestyle("l1", AT, null, " ");
        assertTrue(ConceptExtractor.extract(empty).isEmpty());
    }

    @Test
    public void clinicalAlwaysIncludesDoctorVisit() {
        assertEquals(List.of("type_2_diabetes", "doctor_visit"),
                labels(ConceptExtractor.extract(TestEvents.clinical("c1", AT, "Type 2 Diabetes"))));
        assertEquals(List.of("doctor_visit"),
                labels(ConceptExtractor.extract(TestEvents.clinical("c2", AT, null))));
    }

    @Test
    public void insightYieldsNothing() {
        assertTrue(ConceptExtractor.extract(TestEvents.insight("i1", AT, "s1")).isEmpty());
    }

    @Test
    public void extractAllKeepsInputOrder() {
        List<ExtractedConcept> concepts = ConceptExtractor.extractAll(List.of(
                TestEvents.medication("m1", AT, "Ibuprofen", AdherenceOutcome.TAKEN),
                TestEvents.symptom("s1", AT, "dizzy", null)));
        assertEquals(List.of("ibuprofen", "dizziness"), labels(concepts));
        assertEquals("medication:ibuprofen", concepts.get(0).nodeId());
    }
}
