package com.healthiq.analytics.alert.rules;

import com.healthiq.analytics.alert.AlertContext;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.analytics.event.TimedEvent;
import com.healthiq.analytics.hsi.IntensityParser;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.AlertSeverity;
import com.healthiq.model.analytics.UserAlert;
import com.healthiq.model.event.SymptomEvent;
import com.healthiq.util.TextNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Fires for the first symptom (in first-reported order) whose last few parseable intensities
 * strictly increase.
 */
public class SymptomEscalationRule extends AbstractAlertRule {

    public SymptomEscalationRule(AnalyticsSettings settings) {
        super(settings);
    }

    @Override
    public AlertRuleType ruleType() {
        return AlertRuleType.SYMPTOM_ESCALATION;
    }

    @Override
    public Optional<UserAlert> evaluate(AlertContext context, EventTimeline timeline) {
        int run = settings.getEscalationRun();
        Map<String, List<TimedEvent<SymptomEvent>>> groups = new LinkedHashMap<>();
        for (TimedEvent<SymptomEvent> s : timeline.symptoms()) {
            groups.computeIfAbsent(TextNormalizer.descriptionKey(s.event().getDescription()), k -> new ArrayList<>()).add(s);
        }
        for (Map.Entry<String, List<TimedEvent<SymptomEvent>>> group : groups.entrySet()) {
            List<TimedEvent<SymptomEvent>> sorted = new ArrayList<>(group.getValue());
            // List.sort is stable: same-instant reports keep input order
            sorted.sort(Comparator.comparing(TimedEvent::at));
            List<Reading> readings = new ArrayList<>();
            for (TimedEvent<SymptomEvent> s : sorted) {
                OptionalDouble value = IntensityParser.parse(s.event().getIntensity());
                if (value.isPresent()) {
                    readings.add(new Reading(s.id(), value.getAsDouble()));
                }
            }
            if (readings.size() < run) {
                continue;
            }
            List<Reading> last = readings.subList(readings.size() - run, readings.size());
            if (strictlyIncreasing(last)) {
                String description = group.getKey();
                return fire(context, AlertSeverity.WARNING,
                        String.format("\"%s\" intensity increasing", description),
                        String.format("The intensity of \"%s\" has increased across the last %d occurrences (%s). "
                                        + "If this trend continues, consider discussing it with a healthcare professional.",
                                description, run,
                                last.stream().map(r -> formatNumber(r.value())).collect(Collectors.joining(" -> "))),
                        last.stream().map(Reading::eventId).toList());
            }
        }
        return Optional.empty();
    }

    private static boolean strictlyIncreasing(List<Reading> readings) {
        for (int i = 1; i < readings.size(); i++) {
            if (readings.get(i).value() <= readings.get(i - 1).value()) {
                return false;
            }
        }
        return true;
    }

    private record Reading(String eventId, double value) {
    }
}
