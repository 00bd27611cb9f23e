package com.costtelemetry.domain.model;

/**
 * Dimension a budget's spend is filtered by.
 */
public enum BudgetScope {
    GLOBAL,
    WORKSPACE,
    TEAM,
    USER,
    RESOURCE_TYPE;

    public boolean requiresScopeId() {
        return this != GLOBAL;
    }
}
