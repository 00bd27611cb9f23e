package com.costtelemetry.domain.model;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
