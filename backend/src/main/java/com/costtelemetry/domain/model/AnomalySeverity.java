package com.costtelemetry.domain.model;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
