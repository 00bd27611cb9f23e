package com.costtelemetry.domain.model;

/**
 * Kinds of budget alert.
 *
 * THRESHOLD and FORECAST alerts move through the trigger state machine.
 * ANOMALY and VARIANCE alerts only have their amounts refreshed each cycle.
 */
public enum AlertType {
    THRESHOLD(AlertSeverity.WARNING, true),
    FORECAST(AlertSeverity.INFO, true),
    ANOMALY(AlertSeverity.CRITICAL, false),
    VARIANCE(AlertSeverity.WARNING, false);

    private final AlertSeverity defaultSeverity;
    private final boolean transitioning;

    AlertType(AlertSeverity defaultSeverity, boolean transitioning) {
        this.defaultSeverity = defaultSeverity;
        this.transitioning = transitioning;
    }

    public AlertSeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    public boolean isTransitioning() {
        return transitioning;
    }
}
