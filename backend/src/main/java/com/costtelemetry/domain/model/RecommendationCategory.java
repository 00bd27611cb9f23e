package com.costtelemetry.domain.model;

public enum RecommendationCategory {
    COST_REDUCTION,
    EFFICIENCY,
    PERFORMANCE
}
