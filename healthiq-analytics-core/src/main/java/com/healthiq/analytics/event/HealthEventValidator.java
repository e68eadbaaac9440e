package com.healthiq.analytics.event;

import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.exceptions.MalformedEventException;
import com.healthiq.model.event.ClinicalEvent;
import com.healthiq.model.event.HealthEvent;
import com.healthiq.model.event.HealthEventVisitor;
import com.healthiq.model.event.InsightEvent;
import com.healthiq.model.event.LifestyleEvent;
import com.healthiq.model.event.MedicationEvent;
import com.healthiq.model.event.SymptomEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Structural checks run before any analytics. Rejects rather than repairs.
 */
@ApplicationScoped
public class HealthEventValidator {

    private final Clock clock;
    private final Duration maxFuture;

    @Inject
    public HealthEventValidator(AnalyticsSettings settings, Clock clock) {
        this.clock = clock;
        this.maxFuture = Duration.ofHours(settings.getMaxFutureHours());
    }

    public void validateAll(Collection<? extends HealthEvent> events) {
        if (events == null) {
            return;
        }
        for (HealthEvent event : events) {
            validate(event);
        }
    }

    /**
     * @return the parsed timestamp of the event
     * @throws MalformedEventException on the first violation found
     */
    public Instant validate(HealthEvent event) {
        if (event == null) {
            throw new MalformedEventException(null, "event is null");
        }
        String id = event.getId();
        if (id == null || id.isBlank()) {
            throw new MalformedEventException(null, "missing id");
        }
        Instant at = EventTimestamps.parse(event);
        if (at.isAfter(clock.instant().plus(maxFuture))) {
            throw new MalformedEventException(id, "timestamp " + at + " is too far in the future");
        }
        event.accept(STRUCTURE);
        return at;
    }

    private static final HealthEventVisitor<Void> STRUCTURE = new HealthEventVisitor<>() {
        @Override
        public Void visitMedication(MedicationEvent event) {
            return null;
        }

        @Override
        public Void visitSymptom(SymptomEvent event) {
            if (event.getDescription() == null || event.getDescription().isBlank()) {
                throw new MalformedEventException(event.getId(), "symptom description is blank");
            }
            return null;
        }

        @Override
        public Void visitLifestyle(LifestyleEvent event) {
            return null;
        }

        @Override
        public Void visitClinical(ClinicalEvent event) {
            return null;
        }

        @Override
        public Void visitInsight(InsightEvent event) {
            if (event.getEvidenceEventIds() == null || event.getEvidenceEventIds().isEmpty()) {
                throw new MalformedEventException(event.getId(), "insight has no evidence events");
            }
            return null;
        }
    };
}
