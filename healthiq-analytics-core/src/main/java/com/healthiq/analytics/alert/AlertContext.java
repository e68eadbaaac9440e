package com.healthiq.analytics.alert;

import com.healthiq.model.analytics.GraphSummary;
import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.event.HealthEvent;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Inputs to one alert evaluation.
 *
 * @param previousHsi  prior score, null when none exists yet
 * @param graphSummary current graph summary, null when no graph is available
 * @param now          evaluation instant; every time window is anchored here
 */
public record AlertContext(String identity,
                           HsiScore currentHsi,
                           HsiScore previousHsi,
                           List<? extends HealthEvent> events,
                           GraphSummary graphSummary,
                           Instant now) {

    public AlertContext {
        Objects.requireNonNull(currentHsi, "currentHsi");
        Objects.requireNonNull(now, "now");
        events = events == null ? List.of() : List.copyOf(events);
    }

    public Optional<HsiScore> previous() {
        return Optional.ofNullable(previousHsi);
    }

    public Optional<GraphSummary> graph() {
        return Optional.ofNullable(graphSummary);
    }
}
