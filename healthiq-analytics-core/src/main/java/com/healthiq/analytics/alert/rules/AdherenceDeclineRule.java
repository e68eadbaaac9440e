package com.healthiq.analytics.alert.rules;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.analytics.event.TimedEvent;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.UserAlert;
import com.healthiq.model.event.AdherenceOutcome;
import com.healthiq.model.event.MedicationEvent;

import java.util.List;
import java.util.Optional;

/**
 * Fires when the share of taken doses over the last 14 days is below the adherence floor.
 * Missed and delayed doses both count as not taken.
 */
public class AdherenceDeclineRule extends AbstractAlertRule {

    public AdherenceDeclineRule(AnalyticsSettings settings) {
        super(settings);
    }

    @Override
    public AlertRuleType ruleType() {
        return AlertRuleType.ADHERENCE_DECLINE;
    }

    @Override
    public Optional<UserAlert> evaluate(AlertContext context, EventTimeline timeline) {
        List<TimedEvent<MedicationEvent>> recent = timeline.between(recentStart(context), context.now()).medications();
        if (recent.size() < settings.getAdherenceMinEvents()) {
            return Optional.empty();
        }
        long taken = recent.stream()
                .filter(m -> m.event().getAdherenceOutcome() == AdherenceOutcome.TAKEN)
                .count();
        double rate = 100d * taken / recent.size();
        if (rate >= settings.getAdherenceFloorPercent()) {
            return Optional.empty();
        }
        return fire(context, AlertSeverity.WARNING,
                "Medication adherence has decreased",
                String.format("Your medication adherence rate over the past 14 days is %d%% (%d of %d doses taken). "
                                + "Consistent medication use can be important for managing health conditions.",
                        Math.round(rate), taken, recent.size()),
                recent.stream().map(TimedEvent::id).toList());
    }
}
