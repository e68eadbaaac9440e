package com.healthiq.analytics.pipeline;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.alert.AlertEngine;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.HealthEventValidator;
import com.healthiq.analytics.graph.HealthGraphBuilder;
import com.healthiq.analytics.hsi.HsiScorer;
import com.healthiq.model.analytics.AnalyticsReport;
import com.healthiq.model.analytics.BehavioralSuggestion;
import com.healthiq.model.analytics.GraphSummary;
import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.analytics.RiskStatus;
import com.healthiq.model.analytics.UserAlert;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Stateless end-to-end run: validate, score, rebuild the graph, evaluate alerts, then derive risk
 * and suggestions. Every stage runs against the same evaluation instant.
 */
@ApplicationScoped
public class AnalyticsPipeline {

    private static final Logger LOG = Logger.getLogger(AnalyticsPipeline.class);

    private final HealthEventValidator validator;
    private final HsiScorer scorer;
    private final HealthGraphBuilder graphBuilder;
    private final AlertEngine alertEngine;
    private final AnalyticsSettings settings;
    private final Clock clock;

    @Inject
    public AnalyticsPipeline(HealthEventValidator validator,
                             HsiScorer scorer,
                             HealthGraphBuilder graphBuilder,
                             AlertEngine alertEngine,
                             AnalyticsSettings settings,
                             Clock clock) {
        this.validator = validator;
        this.scorer = scorer;
        this.graphBuilder = graphBuilder;
        this.alertEngine = alertEngine;
        this.settings = settings;
        this.clock = clock;
    }

    public AnalyticsReport run(AnalyticsRequest request) {
        Instant now = clock.instant();
        validator.validateAll(request.events());

        HsiScore hsi = scorer.compute(request.events(), now);
        int topN = request.topN() == null ? settings.getDefaultTopN() : request.topN();
        GraphSummary graph = graphBuilder.build(request.events(), topN);

        AlertContext context = new AlertContext(request.identity(), hsi, request.previousHsi(), request.events(), graph, now);
        List<UserAlert> alerts = alertEngine.evaluate(context);
        RiskStatus risk = alertEngine.computeRisk(hsi, alerts);
        List<BehavioralSuggestion> suggestions = alertEngine.suggest(hsi, alerts, graph);

        LOG.debugf("Pipeline run for %s: %d event(s), HSI %d, %d alert(s), risk %s",
                request.identity(), request.events().size(), hsi.score(), alerts.size(), risk.level().value());
        return new AnalyticsReport(request.identity(), hsi, graph, alerts, risk, suggestions, request.events().size());
    }
}
