package com.healthiq.analytics.hsi;

import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.analytics.event.TimedEvent;
import com.healthiq.analytics.exceptions.AnalyticsConfigurationException;
import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.event.AdherenceOutcome;
import com.healthiq.model.event.ConfidenceLevel;
import com.healthiq.model.event.HealthEvent;
import com.healthiq.model.event.LifestyleEvent;
import com.healthiq.model.event.MedicationEvent;
import com.healthiq.model.event.SymptomEvent;
import com.healthiq.util.SeriesStatistics;
import com.healthiq.util.TextNormalizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes the Health Stability Index, a weighted composite of three 0-100 sub-scores over a
 * trailing window:
 * <ul>
 *     <li>symptom regularity: how evenly symptoms are spread over days and how stable their intensity is,</li>
 *     <li>behavioral consistency: medication adherence and lifestyle logging coverage,</li>
 *     <li>trajectory direction: whether daily symptom burden is rising or falling.</li>
 * </ul>
 * Sparse data resolves to fixed neutral values, never to NaN. Insight events are ignored; clinical
 * events only count toward data confidence.
 */
@ApplicationScoped
public class HsiScorer {

    private static final Logger LOG = Logger.getLogger(HsiScorer.class);

    static final int NEUTRAL_REGULARITY = 60;
    static final int NEUTRAL_CONSISTENCY = 60;
    static final int NEUTRAL_TRAJECTORY = 55;

    static final int MIN_SYMPTOMS_FOR_REGULARITY = 3;
    static final int MIN_INTENSITIES_FOR_CV = 3;
    static final int NEUTRAL_INTENSITY_SCORE = 70;
    static final int DIVERSITY_FREE_DESCRIPTIONS = 5;
    static final int MIN_MEDICATIONS_FOR_ADHERENCE = 3;
    static final int MIN_SYMPTOMS_FOR_TRAJECTORY = 5;
    static final double UNPARSED_INTENSITY = 5d;

    private final AnalyticsSettings settings;
    private final Clock clock;

    @Inject
    public HsiScorer(AnalyticsSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Score over the configured window ending at the clock's current instant.
     */
    public HsiScore compute(List<? extends HealthEvent> events) {
        return compute(events, clock.instant());
    }

    public HsiScore compute(List<? extends HealthEvent> events, Instant now) {
        return compute(events, settings.getHsiWindowDays(), now);
    }

    /**
     * @param windowDays window length; events in {@code [now - windowDays, now]} are scored
     * @throws com.healthiq.analytics.exceptions.MalformedEventException if a timestamp cannot be parsed
     */
    public HsiScore compute(List<? extends HealthEvent> events, int windowDays, Instant now) {
        if (windowDays <= 0) {
            throw new AnalyticsConfigurationException("windowDays must be positive but was " + windowDays);
        }
        Instant start = now.minus(Duration.ofDays(windowDays));
        EventTimeline window = EventTimeline.of(events).between(start, now);

        int regularity = clampScore(symptomRegularity(window.symptoms(), start, windowDays));
        int consistency = clampScore(behavioralConsistency(window.medications(), window.lifestyle(), start, windowDays));
        int trajectory = clampScore(trajectoryDirection(window.symptoms(), start, windowDays));

        double weighted = settings.getRegularityWeight() * regularity
                + settings.getConsistencyWeight() * consistency
                + settings.getTrajectoryWeight() * trajectory;
        int score = clampScore((int) Math.round(weighted));
        ConfidenceLevel confidence = dataConfidence(window);

        LOG.debugf("HSI %d (regularity %d, consistency %d, trajectory %d) from %d windowed event(s), confidence %s",
                score, regularity, consistency, trajectory, window.size(), confidence.value());
        return new HsiScore(score, regularity, consistency, trajectory, windowDays, confidence, window.ids(), now);
    }

    int symptomRegularity(List<TimedEvent<SymptomEvent>> symptoms, Instant start, int windowDays) {
        if (symptoms.size() < MIN_SYMPTOMS_FOR_REGULARITY) {
            return NEUTRAL_REGULARITY;
        }
        // every day of the window is a bucket, including empty ones
        double[] daily = new double[windowDays];
        double[] parsed = new double[symptoms.size()];
        int parsedCount = 0;
        Set<String> descriptions = new HashSet<>();
        for (TimedEvent<SymptomEvent> s : symptoms) {
            daily[dayIndex(s.at(), start, windowDays)]++;
            OptionalDouble intensity = IntensityParser.parse(s.event().getIntensity());
            if (intensity.isPresent()) {
                parsed[parsedCount++] = intensity.getAsDouble();
            }
            descriptions.add(TextNormalizer.descriptionKey(s.event().getDescription()));
        }
        double countScore = SeriesStatistics.clamp(90d - 50d * SeriesStatistics.coefficientOfVariation(daily), 10d, 95d);
        double intensityScore = NEUTRAL_INTENSITY_SCORE;
        if (parsedCount >= MIN_INTENSITIES_FOR_CV) {
            double cv = SeriesStatistics.coefficientOfVariation(Arrays.copyOf(parsed, parsedCount));
            intensityScore = SeriesStatistics.clamp(85d - 40d * cv, 10d, 95d);
        }
        double penalty = Math.max(0, (descriptions.size() - DIVERSITY_FREE_DESCRIPTIONS) * 3);
        return (int) Math.round(Math.max(5d, 0.5d * countScore + 0.5d * intensityScore - penalty));
    }

    int behavioralConsistency(List<TimedEvent<MedicationEvent>> medications,
                              List<TimedEvent<LifestyleEvent>> lifestyle,
                              Instant start,
                              int windowDays) {
        Double adherence = null;
        if (medications.size() >= MIN_MEDICATIONS_FOR_ADHERENCE) {
            long taken = medications.stream()
                    .filter(m -> m.event().getAdherenceOutcome() == AdherenceOutcome.TAKEN)
                    .count();
            adherence = 100d * taken / medications.size();
        }
        Double coverage = null;
        if (!lifestyle.isEmpty()) {
            Set<Integer> days = new HashSet<>();
            for (TimedEvent<LifestyleEvent> l : lifestyle) {
                days.add(dayIndex(l.at(), start, windowDays));
            }
            coverage = Math.min(1d, (double) days.size() / windowDays) * 100d;
        }
        if (adherence != null && coverage != null) {
            return (int) Math.round(0.6d * adherence + 0.4d * coverage);
        }
        if (adherence != null) {
            return (int) Math.round(adherence);
        }
        if (coverage != null) {
            return (int) Math.round(coverage);
        }
        return NEUTRAL_CONSISTENCY;
    }

    int trajectoryDirection(List<TimedEvent<SymptomEvent>> symptoms, Instant start, int windowDays) {
        if (symptoms.size() < MIN_SYMPTOMS_FOR_TRAJECTORY) {
            return NEUTRAL_TRAJECTORY;
        }
        // day index -> {count, intensity sum}, ordered chronologically
        Map<Integer, double[]> byDay = new TreeMap<>();
        for (TimedEvent<SymptomEvent> s : symptoms) {
            double[] acc = byDay.computeIfAbsent(dayIndex(s.at(), start, windowDays), d -> new double[2]);
            acc[0]++;
            acc[1] += IntensityParser.parse(s.event().getIntensity()).orElse(UNPARSED_INTENSITY);
        }
        double[] burden = new double[byDay.size()];
        int i = 0;
        for (double[] acc : byDay.values()) {
            double meanIntensity = acc[1] / acc[0];
            burden[i++] = acc[0] * meanIntensity;
        }
        double slope = SeriesStatistics.linearRegressionSlope(burden);
        return (int) Math.round(SeriesStatistics.clamp(60d - 60d * slope, 10d, 95d));
    }

    ConfidenceLevel dataConfidence(EventTimeline window) {
        int count = window.size();
        int types = window.eventTypes().size();
        Duration span = Duration.ZERO;
        if (!window.isEmpty()) {
            span = Duration.between(window.earliest().orElseThrow(), window.latest().orElseThrow());
        }
        if (count >= 30 && types >= 3 && span.compareTo(Duration.ofDays(21)) >= 0) {
            return ConfidenceLevel.HIGH;
        }
        if (count >= 15 && types >= 2 && span.compareTo(Duration.ofDays(14)) >= 0) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    /**
     * Whole days elapsed since the window start; the closing instant falls into the last bucket.
     */
    static int dayIndex(Instant at, Instant start, int windowDays) {
        long days = Duration.between(start, at).toDays();
        return (int) Math.max(0, Math.min(windowDays - 1, days));
    }

    private static int clampScore(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
