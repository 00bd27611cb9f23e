package com.costtelemetry.metrics;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Point-in-time view of spend, rebuilt wholesale on every refresh.
 *
 * Breakdown maps are unmodifiable and ordered by descending cost.
 * Never persisted.
 */
public record RealTimeCostMetrics(
        double currentSpendRate,
        double projectedDailyCost,
        double projectedMonthlyCost,
        double costVelocity,
        long activeResources,
        Map<String, Double> costByService,
        Map<String, Double> costByRegion,
        Map<String, Double> costByTeam,
        long anomaliesDetected,
        Map<String, Double> budgetUtilization,
        LocalDateTime lastUpdated
) {}
