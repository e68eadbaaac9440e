package com.healthiq.analytics.pipeline;

import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.event.HealthEvent;

import java.util.List;
import java.util.Objects;

/**
 * One pipeline run.
 *
 * @param previousHsi prior score for drop detection, may be null
 * @param topN        graph summary size, null for the configured default
 */
public record AnalyticsRequest(String identity, List<? extends HealthEvent> events, HsiScore previousHsi, Integer topN) {

    public AnalyticsRequest {
        Objects.requireNonNull(identity, "identity");
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static AnalyticsRequest of(String identity, List<? extends HealthEvent> events) {
        return new AnalyticsRequest(identity, events, null, null);
    }
}
