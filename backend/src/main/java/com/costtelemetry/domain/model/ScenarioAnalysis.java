package com.costtelemetry.domain.model;

import java.util.List;

/**
 * Best, worst and most likely outcomes plus the weighted scenario set.
 */
public record ScenarioAnalysis(
        double bestCase,
        double worstCase,
        double mostLikely,
        List<ForecastScenario> scenarios
) {
}
