package com.costtelemetry.domain.model;

public enum AnomalyType {
    SPIKE,
    UNUSUAL_PATTERN,
    UNEXPECTED_COST
}
