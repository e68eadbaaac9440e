package com.healthiq.analytics.runtime;

import com.healthiq.analytics.alert.AlertStore;
import com.healthiq.analytics.alert.InMemoryAlertStore;
import com.healthiq.analytics.config.AnalyticsSettings;
import com.healthiq.analytics.graph.GraphStore;
import com.healthiq.analytics.graph.InMemoryGraphStore;
import com.healthiq.analytics.hsi.InMemoryScoreHistoryStore;
import com.healthiq.analytics.hsi.ScoreHistoryStore;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Binds {@code healthiq.analytics.*} configuration and provides the default stores and clock.
 * Applications replace any store by declaring their own bean of the same type.
 */
@ApplicationScoped
public class AnalyticsProducers {

    private static final Logger LOG = Logger.getLogger(AnalyticsProducers.class);

    @ConfigProperty(name = "healthiq.analytics.co-occurrence-window-hours", defaultValue = "48")
    long coOccurrenceWindowHours;

    @ConfigProperty(name = "healthiq.analytics.hsi.window-days", defaultValue = "30")
    int hsiWindowDays;

    @ConfigProperty(name = "healthiq.analytics.hsi.weight.regularity", defaultValue = "0.4")
    double regularityWeight;

    @ConfigProperty(name = "healthiq.analytics.hsi.weight.consistency", defaultValue = "0.3")
    double consistencyWeight;

    @ConfigProperty(name = "healthiq.analytics.hsi.weight.trajectory", defaultValue = "0.3")
    double trajectoryWeight;

    @ConfigProperty(name = "healthiq.analytics.alert.hsi-drop-points", defaultValue = "10")
    int hsiDropPoints;

    @ConfigProperty(name = "healthiq.analytics.alert.new-symptom-min", defaultValue = "3")
    int newSymptomMin;

    @ConfigProperty(name = "healthiq.analytics.alert.adherence-floor-percent", defaultValue = "70")
    double adherenceFloorPercent;

    @ConfigProperty(name = "healthiq.analytics.alert.adherence-min-events", defaultValue = "5")
    int adherenceMinEvents;

    @ConfigProperty(name = "healthiq.analytics.alert.engagement-min-events", defaultValue = "20")
    int engagementMinEvents;

    @ConfigProperty(name = "healthiq.analytics.alert.gap-days", defaultValue = "7")
    int gapDays;

    @ConfigProperty(name = "healthiq.analytics.alert.escalation-run", defaultValue = "3")
    int escalationRun;

    @ConfigProperty(name = "healthiq.analytics.alert.edge-spike-weight", defaultValue = "4.0")
    double edgeSpikeWeight;

    @ConfigProperty(name = "healthiq.analytics.alert.cold-start-min-events", defaultValue = "10")
    int coldStartMinEvents;

    @ConfigProperty(name = "healthiq.analytics.alert.cold-start-min-days", defaultValue = "14")
    int coldStartMinDays;

    @ConfigProperty(name = "healthiq.analytics.alert.dedup-hours", defaultValue = "24")
    long dedupHours;

    @ConfigProperty(name = "healthiq.analytics.graph.top-n", defaultValue = "15")
    int defaultTopN;

    @ConfigProperty(name = "healthiq.analytics.graph.max-top-n", defaultValue = "50")
    int maxTopN;

    @ConfigProperty(name = "healthiq.analytics.validation.max-future-hours", defaultValue = "48")
    long maxFutureHours;

    @Produces
    @Singleton
    public AnalyticsSettings analyticsSettings() {
        AnalyticsSettings settings = AnalyticsSettings.builder()
                .coOccurrenceWindowHours(coOccurrenceWindowHours)
                .hsiWindowDays(hsiWindowDays)
                .regularityWeight(regularityWeight)
                .consistencyWeight(consistencyWeight)
                .trajectoryWeight(trajectoryWeight)
                .hsiDropPoints(hsiDropPoints)
                .newSymptomMin(newSymptomMin)
                .adherenceFloorPercent(adherenceFloorPercent)
                .adherenceMinEvents(adherenceMinEvents)
                .engagementMinEvents(engagementMinEvents)
                .gapDays(gapDays)
                .escalationRun(escalationRun)
                .edgeSpikeWeight(edgeSpikeWeight)
                .coldStartMinEvents(coldStartMinEvents)
                .coldStartMinDays(coldStartMinDays)
                .dedupHours(dedupHours)
                .defaultTopN(defaultTopN)
                .maxTopN(maxTopN)
                .maxFutureHours(maxFutureHours)
                .build()
                .validate();
        LOG.infof("Analytics settings: window %d day(s), co-occurrence %d hour(s), top-n %d",
                settings.getHsiWindowDays(), settings.getCoOccurrenceWindowHours(), settings.getDefaultTopN());
        return settings;
    }

    @Produces
    @DefaultBean
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @DefaultBean
    @Singleton
    public GraphStore graphStore() {
        return new InMemoryGraphStore();
    }

    @Produces
    @DefaultBean
    @Singleton
    public AlertStore alertStore(AnalyticsSettings settings) {
        return new InMemoryAlertStore(settings.dedupWindow());
    }

    @Produces
    @DefaultBean
    @Singleton
    public ScoreHistoryStore scoreHistoryStore() {
        return new InMemoryScoreHistoryStore();
    }
}
