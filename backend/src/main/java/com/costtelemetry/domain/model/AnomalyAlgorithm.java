package com.costtelemetry.domain.model;

public enum AnomalyAlgorithm {
    STATISTICAL,
    ML_BASED,
    RULE_BASED
}
