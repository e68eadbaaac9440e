package com.healthiq.analytics.alert.rules;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.UserAlert;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fires for an engaged user (enough events overall) who has logged nothing recently.
 */
public class LoggingGapRule extends AbstractAlertRule {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public LoggingGapRule(AnalyticsSettings settings) {
        super(settings);
    }

    @Override
    public AlertRuleType ruleType() {
        return AlertRuleType.LOGGING_GAP;
    }

    @Override
    public Optional<UserAlert> evaluate(AlertContext context, EventTimeline timeline) {
        if (timeline.size() < settings.getEngagementMinEvents() || timeline.isEmpty()) {
            return Optional.empty();
        }
        Instant latest = timeline.latest().orElseThrow();
        Instant gapStart = context.now().minus(Duration.ofDays(settings.getGapDays()));
        if (!latest.isBefore(gapStart)) {
            return Optional.empty();
        }
        long days = Math.round(Duration.between(latest, context.now()).toMillis() / MILLIS_PER_DAY);
        return fire(context, AlertSeverity.INFO,
                String.format("No health events logged in %d days", days),
                String.format("It's been %d days since your last health event. Regular logging helps HealthIQ "
                        + "provide better insights and track your health trajectory accurately.", days),
                List.of());
    }
}
