package com.costtelemetry.domain.model;

/**
 * Fit quality of a forecast against its own history.
 */
public record ModelAccuracy(double mape, double rmse, double rSquared) {
}
