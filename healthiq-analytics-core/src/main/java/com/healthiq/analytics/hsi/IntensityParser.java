package com.healthiq.analytics.hsi;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads free-text symptom intensities on a 0-10 scale: "7/10" and "3 / 5" are scaled fractions,
 * "6" or "6.5 today" use the leading number, and words such as "mild" or "severe" map through a
 * fixed table.
 */
public final class IntensityParser {

    private static final Pattern FRACTION = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^(\\d+(?:\\.\\d+)?)");

    // first contained keyword wins
    private static final Map<String, Double> KEYWORDS = ImmutableMap.<String, Double>builder()
            .put("mild", 3d)
            .put("slight", 2d)
            .put("moderate", 5d)
            .put("severe", 8d)
            .put("extreme", 10d)
            .put("low", 2d)
            .put("medium", 5d)
            .put("high", 8d)
            .put("very", 7d)
            .put("terrible", 9d)
            .put("awful", 9d)
            .build();

    private IntensityParser() {}

    public static OptionalDouble parse(String intensity) {
        if (intensity == null || intensity.isBlank()) {
            return OptionalDouble.empty();
        }
        Matcher fraction = FRACTION.matcher(intensity);
        if (fraction.find()) {
            double denominator = Double.parseDouble(fraction.group(2));
            if (denominator == 0d) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Double.parseDouble(fraction.group(1)) / denominator * 10d);
        }
        Matcher number = LEADING_NUMBER.matcher(intensity);
        if (number.find()) {
            return OptionalDouble.of(Double.parseDouble(number.group(1)));
        }
        String lower = intensity.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> keyword : KEYWORDS.entrySet()) {
            if (lower.contains(keyword.getKey())) {
                return OptionalDouble.of(keyword.getValue());
            }
        }
        return OptionalDouble.empty();
    }
}
