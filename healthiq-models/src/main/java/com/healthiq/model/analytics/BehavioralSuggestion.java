package com.healthiq.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * A fixed, template-bound suggestion. No free text is generated.
 */
@RegisterForReflection
public record BehavioralSuggestion(String category, String suggestion, String basedOn) {
}
