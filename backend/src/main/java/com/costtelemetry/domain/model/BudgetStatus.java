package com.costtelemetry.domain.model;

public enum BudgetStatus {
    ACTIVE,
    PAUSED,
    EXPIRED,
    DELETED
}
