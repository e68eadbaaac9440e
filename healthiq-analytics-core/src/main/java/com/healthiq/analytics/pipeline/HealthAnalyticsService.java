package com.healthiq.analytics.pipeline;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.alert.AlertEngine;
import com.healthiq.analytics.alert.AlertStore;
import com.healthiq.analytics.event.HealthEventValidator;
import com.healthiq.analytics.exceptions.MalformedEventException;
import com.healthiq.analytics.graph.GraphChanges;
import com.healthiq.analytics.graph.GraphStore;
import com.healthiq.analytics.graph.HealthGraphBuilder;
import com.healthiq.analytics.hsi.HsiScorer;
import com.healthiq.analytics.hsi.ScoreHistoryStore;
import com.healthiq.model.analytics.AnalyticsReport;
import com.healthiq.model.analytics.BehavioralSuggestion;
import com.healthiq.model.analytics.GraphSummary;
import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.analytics.RiskStatus;
import com.healthiq.model.analytics.UserAlert;
import com.healthiq.model.event.HealthEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stateful analytics over the injected stores: keeps each identity's graph current event by
 * event, records score history and persists alerts with deduplication.
 */
@ApplicationScoped
public class HealthAnalyticsService {

    private static final Logger LOG = Logger.getLogger(HealthAnalyticsService.class);

    private final HealthEventValidator validator;
    private final HealthGraphBuilder graphBuilder;
    private final HsiScorer scorer;
    private final AlertEngine alertEngine;
    private final GraphStore graphStore;
    private final AlertStore alertStore;
    private final ScoreHistoryStore scoreHistory;
    private final Clock clock;
    private final IdentityLocks locks = new IdentityLocks();

    @Inject
    public HealthAnalyticsService(HealthEventValidator validator,
                                  HealthGraphBuilder graphBuilder,
                                  HsiScorer scorer,
                                  AlertEngine alertEngine,
                                  GraphStore graphStore,
                                  AlertStore alertStore,
                                  ScoreHistoryStore scoreHistory,
                                  Clock clock) {
        this.validator = validator;
        this.graphBuilder = graphBuilder;
        this.scorer = scorer;
        this.alertEngine = alertEngine;
        this.graphStore = graphStore;
        this.alertStore = alertStore;
        this.scoreHistory = scoreHistory;
        this.clock = clock;
    }

    /**
     * Folds a newly appended event into the identity's graph.
     *
     * @param history previously recorded events; at least those within the co-occurrence window of {@code event}
     */
    public GraphChanges recordEvent(String identity, HealthEvent event, Collection<? extends HealthEvent> history) {
        return locks.withLock(identity, () -> {
            try {
                validator.validate(event);
                return graphBuilder.process(graphStore, identity, event, history);
            } catch (MalformedEventException e) {
                LOG.warnf("Rejected event %s for %s: %s", e.getEventId(), identity, e.getMessage());
                throw e;
            }
        });
    }

    /**
     * Scores {@code events}, appends the score to history, evaluates alerts against the persisted
     * graph, and persists the alerts that survive deduplication.
     *
     * @return report whose alerts are the identity's active alerts after persistence
     */
    public AnalyticsReport refresh(String identity, List<? extends HealthEvent> events, int topN) {
        Objects.requireNonNull(events, "events");
        return locks.withLock(identity, () -> {
            try {
                validator.validateAll(events);
            } catch (MalformedEventException e) {
                LOG.warnf("Rejected refresh for %s, event %s: %s", identity, e.getEventId(), e.getMessage());
                throw e;
            }
            // rejects an out-of-range topN before any store is written
            GraphSummary graph = graphBuilder.summarize(graphStore, identity, topN);

            Instant now = clock.instant();
            Optional<HsiScore> previous = scoreHistory.latest(identity);
            HsiScore hsi = scorer.compute(events, now);
            scoreHistory.append(identity, hsi);

            AlertContext context = new AlertContext(identity, hsi, previous.orElse(null), events, graph, now);
            List<UserAlert> saved = alertStore.saveAll(identity, alertEngine.evaluate(context));
            List<UserAlert> active = alertStore.findActive(identity);

            RiskStatus risk = alertEngine.computeRisk(hsi, active);
            List<BehavioralSuggestion> suggestions = alertEngine.suggest(hsi, active, graph);
            LOG.debugf("Refreshed %s: HSI %d, %d new alert(s), %d active", identity, hsi.score(), saved.size(), active.size());
            return new AnalyticsReport(identity, hsi, graph, active, risk, suggestions, events.size());
        });
    }

    public boolean acknowledge(String identity, String alertId) {
        return locks.withLock(identity, () -> alertStore.acknowledge(identity, alertId, clock.instant()));
    }

    public List<UserAlert> activeAlerts(String identity) {
        return alertStore.findActive(identity);
    }

    public List<HsiScore> scoreHistory(String identity) {
        return scoreHistory.history(identity);
    }

    public GraphSummary graph(String identity, int topN) {
        return graphBuilder.summarize(graphStore, identity, topN);
    }
}
