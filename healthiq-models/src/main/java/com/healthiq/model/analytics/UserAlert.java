package com.healthiq.model.analytics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A triggered alert. {@code id} and {@code identity} are assigned when the alert is persisted.
 * Instances are immutable; acknowledgement produces an acknowledged copy and cannot be undone.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserAlert {

    String id;
    String identity;
    AlertRuleType ruleType;
    Instant triggeredAt;
    AlertSeverity severity;
    String title;
    String explanation;
    @Builder.Default
    List<String> evidenceIds = List.of();
    boolean acknowledged;
    Instant acknowledgedAt;

    @JsonIgnore
    public boolean isActive() {
        return !acknowledged;
    }

    public UserAlert acknowledge(Instant at) {
        if (acknowledged) {
            throw new IllegalStateException("Alert " + id + " is already acknowledged");
        }
        return toBuilder().acknowledged(true).acknowledgedAt(at).build();
    }
}
