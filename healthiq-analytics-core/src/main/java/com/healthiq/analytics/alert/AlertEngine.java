package com.healthiq.analytics.alert;

import com.healthiq.analytics.alert.rules.AdherenceDeclineRule;
import com.healthiq.analytics.alert.rules.CoOccurrenceSpikeRule;
import com.healthiq.analytics.alert.rules.HsiDropRule;
import com.healthiq.analytics.alert.rules.LoggingGapRule;
import com.healthiq.analytics.alert.rules.NewSymptomClusterRule;
import com.healthiq.analytics.alert.rules.SymptomEscalationRule;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.BehavioralSuggestion;
import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.GraphRelation;
import com.healthiq.model.analytics.GraphSummary;
import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.analytics.RiskLevel;
import com.healthiq.model.analytics.RiskStatus;
import com.healthiq.model.analytics.UserAlert;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates the fixed alert rules, derives the risk tier and picks template suggestions.
 * Nothing here persists; deduplication happens in the {@link AlertStore}.
 */
@ApplicationScoped
public class AlertEngine {

    private static final Logger LOG = Logger.getLogger(AlertEngine.class);

    static final int ORANGE_SCORE = 40;
    static final int YELLOW_SCORE = 70;
    static final int ORANGE_ACTIVE_ALERTS = 3;
    static final int LOW_CONSISTENCY = 50;

    private final AnalyticsSettings settings;
    private final List<AlertRule> rules;

    @Inject
    public AlertEngine(AnalyticsSettings settings) {
        this.settings = settings;
        // evaluation order is part of the output contract
        this.rules = List.of(
                new HsiDropRule(settings),
                new NewSymptomClusterRule(settings),
                new AdherenceDeclineRule(settings),
                new LoggingGapRule(settings),
                new SymptomEscalationRule(settings),
                new CoOccurrenceSpikeRule(settings));
    }

    public List<AlertRule> rules() {
        return rules;
    }

    /**
     * @return alerts in rule order, empty during cold start
     */
    public List<UserAlert> evaluate(AlertContext context) {
        EventTimeline timeline = EventTimeline.of(context.events());
        if (isColdStart(timeline, context.now())) {
            LOG.debugf("Cold start for %s: %d event(s), no alerts evaluated", context.identity(), timeline.size());
            return List.of();
        }
        List<UserAlert> alerts = new ArrayList<>();
        for (AlertRule rule : rules) {
            Optional<UserAlert> alert = rule.evaluate(context, timeline);
            alert.ifPresent(alerts::add);
        }
        LOG.debugf("Evaluated %d rule(s) for %s, %d fired", (Object) rules.size(), context.identity(), alerts.size());
        return alerts;
    }

    boolean isColdStart(EventTimeline timeline, Instant now) {
        if (timeline.size() < settings.getColdStartMinEvents()) {
            return true;
        }
        Instant earliest = timeline.earliest().orElse(now);
        return Duration.between(earliest, now).compareTo(Duration.ofDays(settings.getColdStartMinDays())) < 0;
    }

    /**
     * Risk tier from the score and the active (un-acknowledged) alerts among {@code alerts}.
     */
    public RiskStatus computeRisk(HsiScore hsi, Collection<UserAlert> alerts) {
        List<UserAlert> active = alerts.stream().filter(UserAlert::isActive).toList();
        int warnings = (int) active.stream().filter(a -> a.getSeverity() == AlertSeverity.WARNING).count();
        int attentions = (int) active.stream().filter(a -> a.getSeverity() == AlertSeverity.ATTENTION).count();

        if (hsi.score() < ORANGE_SCORE || active.size() >= ORANGE_ACTIVE_ALERTS) {
            return new RiskStatus(RiskLevel.ORANGE, hsi.score(), active.size(), warnings, attentions,
                    "Your health trajectory shows patterns that deserve attention. Consider reviewing your recent "
                            + "health data and discussing changes with a healthcare professional.");
        }
        if (hsi.score() < YELLOW_SCORE || warnings > 0 || attentions > 0) {
            return new RiskStatus(RiskLevel.YELLOW, hsi.score(), active.size(), warnings, attentions,
                    "Some health patterns have been flagged. HealthIQ is monitoring your trajectory. "
                            + "Consider reviewing the alert details.");
        }
        return new RiskStatus(RiskLevel.GREEN, hsi.score(), active.size(), warnings, attentions,
                "Your health trajectory appears stable. Continue logging health events for the most accurate tracking.");
    }

    /**
     * Template suggestions driven by the score, the active alerts and the graph. {@code graph} may be null.
     */
    public List<BehavioralSuggestion> suggest(HsiScore hsi, Collection<UserAlert> alerts, GraphSummary graph) {
        List<BehavioralSuggestion> suggestions = new ArrayList<>();
        if (hsi.behavioralConsistency() < LOW_CONSISTENCY && hasActive(alerts, AlertRuleType.ADHERENCE_DECLINE)) {
            suggestions.add(new BehavioralSuggestion("medication",
                    "Your medication consistency has changed recently. Logging medication events can help you and "
                            + "your doctor understand your health trajectory better.",
                    "Medication adherence scoring"));
        }
        if (graph != null) {
            if (hasLifestyleLink(graph, "sleep")) {
                suggestions.add(new BehavioralSuggestion("sleep",
                        "Your recent health patterns suggest sleep consistency may be a factor worth tracking more carefully.",
                        "Health graph analysis: sleep-symptom correlation"));
            }
            if (hasLifestyleLink(graph, "stress")) {
                suggestions.add(new BehavioralSuggestion("stress",
                        "Stress-related patterns have been observed in your health data. Consider tracking stress "
                                + "levels alongside symptoms for better insight.",
                        "Health graph analysis: stress correlation"));
            }
        }
        if (hasActive(alerts, AlertRuleType.LOGGING_GAP)) {
            suggestions.add(new BehavioralSuggestion("engagement",
                    "Regular health logging improves the accuracy of your Health Stability Index. Even brief daily "
                            + "entries make a difference.",
                    "Logging gap detection"));
        }
        if (hasActive(alerts, AlertRuleType.SYMPTOM_ESCALATION)) {
            suggestions.add(new BehavioralSuggestion("monitoring",
                    "A symptom shows an increasing trend. Tracking this symptom with consistent intensity ratings "
                            + "will help identify whether the pattern continues.",
                    "Symptom escalation detection"));
        }
        return suggestions;
    }

    private static boolean hasActive(Collection<UserAlert> alerts, AlertRuleType type) {
        return alerts.stream().anyMatch(a -> a.isActive() && a.getRuleType() == type);
    }

    private static boolean hasLifestyleLink(GraphSummary graph, String fragment) {
        for (GraphEdge edge : graph.strongestEdges()) {
            if (edge.getRelation() == GraphRelation.TEMPORAL_SEQUENCE
                    && (contains(edge.getSourceConcept(), fragment) || contains(edge.getTargetConcept(), fragment))) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(String concept, String fragment) {
        return concept != null && concept.contains(fragment);
    }
}
