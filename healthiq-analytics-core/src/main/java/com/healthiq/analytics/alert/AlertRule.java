package com.healthiq.analytics.alert;

import com.healthiq.analytics.event.EventTimeline;
import com.healthiq.model.analytics.AlertRuleType;
import com.healthiq.model.analytics.UserAlert;

import java.util.Optional;

/**
 * One fixed alert template. Rules are independent of each other and produce at most one alert.
 */
public interface AlertRule {

    AlertRuleType ruleType();

    /**
     * @param timeline the context's events, parsed and without insights
     * @return the alert, without id or identity, or empty when the rule does not fire
     */
    Optional<UserAlert> evaluate(AlertContext context, EventTimeline timeline);
}
