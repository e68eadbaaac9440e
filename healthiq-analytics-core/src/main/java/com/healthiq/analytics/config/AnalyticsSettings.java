package com.healthiq.analytics.config;

import com.healthiq.analytics.exceptions.AnalyticsConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable analytics tuning. Defaults reproduce the documented behavior; the runtime producer
 * binds overrides from {@code healthiq.analytics.*} configuration keys.
 */
@Value
@Builder(toBuilder = true)
public class AnalyticsSettings {

    @Builder.Default
    long coOccurrenceWindowHours = 48;

    @Builder.Default
    int hsiWindowDays = 30;
    @Builder.Default
    double regularityWeight = 0.4d;
    @Builder.Default
    double consistencyWeight = 0.3d;
    @Builder.Default
    double trajectoryWeight = 0.3d;

    @Builder.Default
    int hsiDropPoints = 10;
    @Builder.Default
    int newSymptomMin = 3;
    @Builder.Default
    double adherenceFloorPercent = 70d;
    @Builder.Default
    int adherenceMinEvents = 5;
    @Builder.Default
    int engagementMinEvents = 20;
    @Builder.Default
    int gapDays = 7;
    @Builder.Default
    int escalationRun = 3;
    @Builder.Default
    double edgeSpikeWeight = 4.0d;
    @Builder.Default
    int coldStartMinEvents = 10;
    @Builder.Default
    int coldStartMinDays = 14;
    @Builder.Default
    long dedupHours = 24;

    @Builder.Default
    int defaultTopN = 15;
    @Builder.Default
    int maxTopN = 50;

    @Builder.Default
    long maxFutureHours = 48;

    public static AnalyticsSettings defaults() {
        return AnalyticsSettings.builder().build();
    }

    public Duration coOccurrenceWindow() {
        return Duration.ofHours(coOccurrenceWindowHours);
    }

    public Duration dedupWindow() {
        return Duration.ofHours(dedupHours);
    }

    /**
     * Resolve a requested top-N: values above the maximum are capped, non-positive values rejected.
     */
    public int resolveTopN(int requested) {
        require(requested >= 1, "topN must be at least 1 but was " + requested);
        return Math.min(requested, maxTopN);
    }

    /**
     * @return this instance, for chaining
     * @throws AnalyticsConfigurationException if any value is out of range
     */
    public AnalyticsSettings validate() {
        require(coOccurrenceWindowHours > 0, "co-occurrence window must be positive");
        require(hsiWindowDays > 0, "HSI window must be positive");
        require(regularityWeight >= 0 && consistencyWeight >= 0 && trajectoryWeight >= 0,
                "HSI weights cannot be negative");
        require(Math.abs(regularityWeight + consistencyWeight + trajectoryWeight - 1d) < 1e-9,
                "HSI weights must sum to 1");
        require(hsiDropPoints > 0, "HSI drop threshold must be positive");
        require(newSymptomMin > 0, "new symptom minimum must be positive");
        require(adherenceFloorPercent >= 0 && adherenceFloorPercent <= 100, "adherence floor must be within [0,100]");
        require(adherenceMinEvents > 0, "adherence sample minimum must be positive");
        require(engagementMinEvents >= 0, "engagement minimum cannot be negative");
        require(gapDays > 0, "logging gap must be positive");
        require(escalationRun >= 2, "escalation run needs at least two occurrences");
        require(edgeSpikeWeight > 0, "edge spike weight must be positive");
        require(coldStartMinEvents >= 0 && coldStartMinDays >= 0, "cold start guard cannot be negative");
        require(dedupHours >= 0, "alert dedup window cannot be negative");
        require(maxTopN >= 1, "maximum top-N must be at least 1");
        require(defaultTopN >= 1 && defaultTopN <= maxTopN, "default top-N must be within [1, maxTopN]");
        require(maxFutureHours >= 0, "future tolerance cannot be negative");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new AnalyticsConfigurationException(message);
        }
    }
}
