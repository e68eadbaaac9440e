package com.healthiq.model.analytics;

import com.healthiq.model.event.ConfidenceLevel;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.util.List;

/**
 * Immutable Health Stability Index snapshot. Every score is within [0, 100].
 */
@RegisterForReflection
public record HsiScore(int score,
                       int symptomRegularity,
                       int behavioralConsistency,
                       int trajectoryDirection,
                       int windowDays,
                       ConfidenceLevel dataConfidence,
                       List<String> contributingEventIds,
                       Instant computedAt) {

    public HsiScore {
        contributingEventIds = contributingEventIds == null ? List.of() : List.copyOf(contributingEventIds);
    }
}
