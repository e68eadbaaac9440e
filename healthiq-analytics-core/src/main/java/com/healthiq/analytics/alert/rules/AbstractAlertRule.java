package com.healthiq.analytics.alert.rules;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.alert.AlertRule;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.UserAlert;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

abstract class AbstractAlertRule implements AlertRule {

    static final int MAX_EVIDENCE = 10;
    static final Duration RECENT = Duration.ofDays(14);

    protected final AnalyticsSettings settings;

    protected AbstractAlertRule(AnalyticsSettings settings) {
        this.settings = settings;
    }

    protected Optional<UserAlert> fire(AlertContext context,
                                       AlertSeverity severity,
                                       String title,
                                       String explanation,
                                       List<String> evidence) {
        return Optional.of(UserAlert.builder()
                .ruleType(ruleType())
                .triggeredAt(context.now())
                .severity(severity)
                .title(title)
                .explanation(explanation)
                .evidenceIds(List.copyOf(evidence.subList(0, Math.min(MAX_EVIDENCE, evidence.size()))))
                .build());
    }

    protected static Instant recentStart(AlertContext context) {
        return context.now().minus(RECENT);
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
