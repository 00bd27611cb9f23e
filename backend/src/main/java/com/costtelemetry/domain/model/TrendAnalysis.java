package com.costtelemetry.domain.model;

public record TrendAnalysis(CostTrend overallTrend, double trendStrength, boolean seasonalityDetected) {
}
