package com.costtelemetry.domain.model;

/**
 * Investigation workflow states for a cost anomaly.
 */
public enum AnomalyStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isClosed() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }
}
