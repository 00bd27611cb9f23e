package com.costtelemetry.domain.model;

/**
 * Three-step scale used for recommendation priority, impact and effort.
 */
public enum ImpactLevel {
    LOW,
    MEDIUM,
    HIGH
}
