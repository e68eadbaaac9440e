package com.healthiq.analytics.config;

import com.healthiq.analytics.exceptions.AnalyticsConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyticsSettingsTest {

    @Test
    public void defaultsAreValid() {
        AnalyticsSettings settings = AnalyticsSettings.defaults().validate();
        assertEquals(Duration.ofHours(48), settings.coOccurrenceWindow());
        assertEquals(30, settings.getHsiWindowDays());
        assertEquals(15, settings.getDefaultTopN());
    }

    @Test
    public void weightsMustSumToOne() {
        AnalyticsSettings skewed = AnalyticsSettings.defaults().toBuilder().trajectoryWeight(0.5).build();
        assertThrows(AnalyticsConfigurationException.class, skewed::validate);
    }

    @Test
    public void rejectsNonPositiveWindows() {
        assertThrows(AnalyticsConfigurationException.class,
                () -> AnalyticsSettings.builder().hsiWindowDays(0).build().validate());
        assertThrows(AnalyticsConfigurationException.class,
                () -> AnalyticsSettings.builder().coOccurrenceWindowHours(-1).build().validate());
    }

    @Test
    public void topNIsCappedButMustBePositive() {
        AnalyticsSettings settings = AnalyticsSettings.defaults();
        assertEquals(50, settings.resolveTopN(80));
        assertEquals(7, settings.resolveTopN(7));
        assertThrows(AnalyticsConfigurationException.class, () -> settings.resolveTopN(0));
    }
}
