package com.healthiq.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
public record RiskStatus(RiskLevel level,
                         int hsiScore,
                         int activeAlertCount,
                         int warningCount,
                         int attentionCount,
                         String description) {
}
