package com.healthiq.analytics.exceptions;

/**
 * Thrown when analytics settings are invalid. Raised before any computation starts.
 */
public class AnalyticsConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public AnalyticsConfigurationException(String message) {
        super(message);
    }
}
