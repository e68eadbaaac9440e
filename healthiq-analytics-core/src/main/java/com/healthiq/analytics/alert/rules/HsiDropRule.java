package com.healthiq.analytics.alert.rules;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.HsiScore;
import com.healthiq.model.analytics.UserAlert;

import java.util.Optional;

/**
 * Fires when the score fell by at least the configured number of points since the previous score.
 */
public class HsiDropRule extends AbstractAlertRule {

    public HsiDropRule(AnalyticsSettings settings) {
        super(settings);
    }

    @Override
    public AlertRuleType ruleType() {
        return AlertRuleType.HSI_DROP;
    }

    @Override
    public Optional<UserAlert> evaluate(AlertContext context, EventTimeline timeline) {
        if (context.previous().isEmpty()) {
            return Optional.empty();
        }
        HsiScore previous = context.previous().get();
        HsiScore current = context.currentHsi();
        int delta = current.score() - previous.score();
        if (delta > -settings.getHsiDropPoints()) {
            return Optional.empty();
        }
        return fire(context, AlertSeverity.WARNING,
                "Health Stability Index declined significantly",
                String.format("Your Health Stability Index dropped from %d to %d (%d points). "
                                + "This may reflect changes in your symptom patterns, medication adherence, or lifestyle factors.",
                        previous.score(), current.score(), delta),
                current.contributingEventIds());
    }
}
