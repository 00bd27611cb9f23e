package com.costtelemetry.domain.model;

/**
 * Fixed-width band around a predicted cost.
 */
public record PredictionInterval(double lowerBound, double upperBound, int confidenceLevel) {
}
