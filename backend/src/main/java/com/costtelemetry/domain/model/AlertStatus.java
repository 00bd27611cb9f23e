package com.costtelemetry.domain.model;

/**
 * Lifecycle states for budget alerts.
 */
public enum AlertStatus {
    /**
     * Armed, spend below threshold.
     */
    ACTIVE,

    /**
     * Spend reached the threshold.
     */
    TRIGGERED,

    /**
     * Spend dropped back below the threshold after a trigger.
     */
    RESOLVED,

    /**
     * Muted by a user; never advanced by the evaluator.
     */
    SNOOZED
}
