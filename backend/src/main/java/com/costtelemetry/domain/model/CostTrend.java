package com.costtelemetry.domain.model;

public enum CostTrend {
    INCREASING,
    DECREASING,
    STABLE
}
