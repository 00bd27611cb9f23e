package com.costtelemetry.domain.model;

/**
 * Horizon class of a cost prediction.
 */
public enum ForecastHorizon {
    SHORT_TERM,
    MEDIUM_TERM,
    LONG_TERM
}
