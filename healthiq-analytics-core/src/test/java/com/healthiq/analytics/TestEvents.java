package com.healthiq.analytics;

import com.healthiq.model.event.AdherenceOutcome;
import com.healthiq.model.event.ClinicalEvent;
import com.healthiq.model.event.EventTimestamp;
import com.healthiq.model.event.InsightEvent;
import com.healthiq.model.event.LifestyleEvent;
import com.healthiq.model.event.MedicationEvent;
import com.healthiq.model.event.SymptomEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Event factories shared by the analytics tests.
 */
public final class TestEvents {

    public static final Instant NOW = Instant.parse("2026-03-31T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private TestEvents() {}

    public static Instant daysAgo(double days) {
        return NOW.minus(Duration.ofMinutes(Math.round(days * 24 * 60)));
    }

    public static SymptomEvent symptom(String id, Instant at, String description, String intensity) {
        return SymptomEvent.builder()
                .id(id)
                .timestamp(EventTimestamp.of(at.toString()))
                .description(description)
                .intensity(intensity)
                .build();
    }

    public static MedicationEvent medication(String id, Instant at, String name, AdherenceOutcome outcome) {
        return MedicationEvent.builder()
                .id(id)
                .timestamp(EventTimestamp.of(at.toString()))
                .name(name)
                .dosage("1 tablet")
                .intendedSchedule("once daily")
                .adherenceOutcome(outcome)
                .build();
    }

    public static LifestyleEvent lifestyle(String id, Instant at, String sleep, String stress) {
        return LifestyleEvent.builder()
                .id(id)
                .timestamp(EventTimestamp.of(at.toString()))
                .sleep(sleep)
                .stress(stress)
                .build();
    }

    public static ClinicalEvent clinical(String id, Instant at, String diagnosis) {
        return ClinicalEvent.builder()
                .id(id)
                .timestamp(EventTimestamp.of(at.toString()))
                .doctorVisit("GP visit")
                .diagnosisLabel(diagnosis)
                .build();
    }

    public static InsightEvent insight(String id, Instant at, String... evidence) {
        return InsightEvent.builder()
                .id(id)
                .timestamp(EventTimestamp.of(at.toString()))
                .evidenceEventIds(List.of(evidence))
                .build();
    }
}
