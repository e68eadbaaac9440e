package com.healthiq.analytics.event;

import com.healthiq.model.event.ClinicalEvent;
import com.healthiq.model.event.HealthEvent;
import com.healthiq.model.event.HealthEventType;
import com.healthiq.model.event.HealthEventVisitor;
import com.healthiq.model.event.InsightEvent;
import com.healthiq.model.event.LifestyleEvent;
import com.healthiq.model.event.MedicationEvent;
import com.healthiq.model.event.SymptomEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Analytics view over a set of events: timestamps parsed once, events split by type, insight
 * events left out. Lists keep input order.
 * <p>
 * Building a timeline parses every timestamp, so a malformed event fails here rather than
 * halfway through a computation.
 * </p>
 */
public final class EventTimeline {

    private final List<TimedEvent<HealthEvent>> all;
    private final List<TimedEvent<SymptomEvent>> symptoms;
    private final List<TimedEvent<MedicationEvent>> medications;
    private final List<TimedEvent<LifestyleEvent>> lifestyle;
    private final List<TimedEvent<ClinicalEvent>> clinical;

    private EventTimeline(List<TimedEvent<HealthEvent>> all) {
        this.all = Collections.unmodifiableList(all);
        List<TimedEvent<SymptomEvent>> s = new ArrayList<>();
        List<TimedEvent<MedicationEvent>> m = new ArrayList<>();
        List<TimedEvent<LifestyleEvent>> l = new ArrayList<>();
        List<TimedEvent<ClinicalEvent>> c = new ArrayList<>();
        for (TimedEvent<HealthEvent> timed : all) {
            Instant at = timed.at();
            timed.event().accept(new HealthEventVisitor<Void>() {
                @Override
                public Void visitMedication(MedicationEvent event) {
                    m.add(new TimedEvent<>(event, at));
                    return null;
                }

                @Override
                public Void visitSymptom(SymptomEvent event) {
                    s.add(new TimedEvent<>(event, at));
                    return null;
                }

                @Override
                public Void visitLifestyle(LifestyleEvent event) {
                    l.add(new TimedEvent<>(event, at));
                    return null;
                }

                @Override
                public Void visitClinical(ClinicalEvent event) {
                    c.add(new TimedEvent<>(event, at));
                    return null;
                }

                @Override
                public Void visitInsight(InsightEvent event) {
                    return null;
                }
            });
        }
        this.symptoms = Collections.unmodifiableList(s);
        this.medications = Collections.unmodifiableList(m);
        this.lifestyle = Collections.unmodifiableList(l);
        this.clinical = Collections.unmodifiableList(c);
    }

    /**
     * @throws com.healthiq.analytics.exceptions.MalformedEventException if any timestamp is missing
     *         or unparseable
     */
    public static EventTimeline of(Collection<? extends HealthEvent> events) {
        List<TimedEvent<HealthEvent>> timed = new ArrayList<>();
        if (events != null) {
            for (HealthEvent event : events) {
                Instant at = EventTimestamps.parse(event);
                if (event.getEventType() != HealthEventType.INSIGHT) {
                    timed.add(new TimedEvent<>(event, at));
                }
            }
        }
        return new EventTimeline(timed);
    }

    /**
     * Events with {@code from <= at <= to}.
     */
    public EventTimeline between(Instant from, Instant to) {
        return filter(t -> !t.at().isBefore(from) && !t.at().isAfter(to));
    }

    public EventTimeline filter(Predicate<TimedEvent<HealthEvent>> predicate) {
        List<TimedEvent<HealthEvent>> kept = new ArrayList<>();
        for (TimedEvent<HealthEvent> t : all) {
            if (predicate.test(t)) {
                kept.add(t);
            }
        }
        return new EventTimeline(kept);
    }

    public List<TimedEvent<HealthEvent>> all() {
        return all;
    }

    public List<TimedEvent<SymptomEvent>> symptoms() {
        return symptoms;
    }

    public List<TimedEvent<MedicationEvent>> medications() {
        return medications;
    }

    public List<TimedEvent<LifestyleEvent>> lifestyle() {
        return lifestyle;
    }

    public List<TimedEvent<ClinicalEvent>> clinical() {
        return clinical;
    }

    public int size() {
        return all.size();
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }

    public Optional<Instant> earliest() {
        return all.stream().map(TimedEvent::at).min(Instant::compareTo);
    }

    public Optional<Instant> latest() {
        return all.stream().map(TimedEvent::at).max(Instant::compareTo);
    }

    public Set<HealthEventType> eventTypes() {
        Set<HealthEventType> types = EnumSet.noneOf(HealthEventType.class);
        for (TimedEvent<HealthEvent> t : all) {
            types.add(t.event().getEventType());
        }
        return types;
    }

    public List<String> ids() {
        List<String> ids = new ArrayList<>(all.size());
        for (TimedEvent<HealthEvent> t : all) {
            ids.add(t.id());
        }
        return ids;
    }
}
