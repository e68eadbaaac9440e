package com.healthiq.analytics.alert.rules;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.GraphEdge;
import com.healthiq.model.analytics.UserAlert;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fires on the strongest graph edge once its weight reaches the spike threshold.
 */
public class CoOccurrenceSpikeRule extends AbstractAlertRule {

    public CoOccurrenceSpikeRule(AnalyticsSettings settings) {
        super(settings);
    }

    @Override
    public AlertRuleType ruleType() {
        return AlertRuleType.CO_OCCURRENCE_SPIKE;
    }

    @Override
    public Optional<UserAlert> evaluate(AlertContext context, EventTimeline timeline) {
        if (context.graph().isEmpty()) {
            return Optional.empty();
        }
        GraphEdge strongest = null;
        for (GraphEdge edge : context.graph().get().strongestEdges()) {
            // strict comparison keeps the first edge in summary order on ties
            if (edge.getWeight() >= settings.getEdgeSpikeWeight()
                    && (strongest == null || edge.getWeight() > strongest.getWeight())) {
                strongest = edge;
            }
        }
        if (strongest == null) {
            return Optional.empty();
        }
        List<String> evidence = strongest.getEvidenceEventIds() == null ? List.of() : strongest.getEvidenceEventIds();
        return fire(context, AlertSeverity.INFO,
                "Strong health pattern detected",
                String.format(Locale.ROOT, "A frequent co-occurrence between \"%s\" and \"%s\" has been detected "
                                + "(strength: %.1f). This pattern may be worth exploring.",
                        label(strongest.getSourceConcept(), "factor A"),
                        label(strongest.getTargetConcept(), "factor B"),
                        strongest.getWeight()),
                evidence);
    }

    private static String label(String concept, String fallback) {
        return concept == null || concept.isEmpty() ? fallback : concept;
    }
}
