package com.healthiq.model.analytics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.healthiq.model.event.ConfidenceLevel;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * Everything one pipeline run produces for an identity.
 */
@RegisterForReflection
public record AnalyticsReport(String identity,
                              HsiScore hsi,
                              GraphSummary graph,
                              List<UserAlert> alerts,
                              RiskStatus risk,
                              List<BehavioralSuggestion> suggestions,
                              int eventCount) {

    /**
     * True when there is not enough data yet for the score to be trusted. This is a normal state,
     * distinct from a failed computation.
     */
    @JsonIgnore
    public boolean insufficientData() {
        return hsi.dataConfidence() == ConfidenceLevel.LOW;
    }
}
