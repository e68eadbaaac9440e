package com.healthiq.analytics.alert.rules;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.analytics.event.TimedEvent;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.UserAlert;
import com.healthiq.model.event.SymptomEvent;
import com.healthiq.util.TextNormalizer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fires when several symptom descriptions reported in the last 14 days were absent from the
 * 60-day lookback before that.
 */
public class NewSymptomClusterRule extends AbstractAlertRule {

    static final Duration LOOKBACK = Duration.ofDays(60);
    static final int LISTED = 5;

    public NewSymptomClusterRule(AnalyticsSettings settings) {
        super(settings);
    }

    @Override
    public AlertRuleType ruleType() {
        return AlertRuleType.NEW_SYMPTOM_CLUSTER;
    }

    @Override
    public Optional<UserAlert> evaluate(AlertContext context, EventTimeline timeline) {
        Instant now = context.now();
        Instant recentStart = recentStart(context);
        Instant lookbackStart = now.minus(LOOKBACK);

        Set<String> recent = new LinkedHashSet<>();
        List<String> recentIds = new ArrayList<>();
        Set<String> older = new HashSet<>();
        for (TimedEvent<SymptomEvent> s : timeline.symptoms()) {
            String key = TextNormalizer.descriptionKey(s.event().getDescription());
            if (!s.at().isBefore(recentStart) && !s.at().isAfter(now)) {
                recent.add(key);
                recentIds.add(s.id());
            } else if (!s.at().isBefore(lookbackStart) && s.at().isBefore(recentStart)) {
                older.add(key);
            }
        }
        recent.removeAll(older);
        if (recent.size() < settings.getNewSymptomMin()) {
            return Optional.empty();
        }
        List<String> names = new ArrayList<>(recent);
        return fire(context, AlertSeverity.ATTENTION,
                String.format("%d new symptom types in the past 2 weeks", names.size()),
                String.format("You've reported %d symptom types in the last 14 days that weren't present in the 60 days "
                                + "before that. New symptoms: %s. Consider reviewing your health patterns.",
                        names.size(), String.join(", ", names.subList(0, Math.min(LISTED, names.size())))),
                recentIds);
    }
}
