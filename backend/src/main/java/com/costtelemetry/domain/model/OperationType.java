package com.costtelemetry.domain.model;

public enum OperationType {
    API_CALL,
    DATA_PROCESSING,
    STORAGE_OPERATION,
    COMPUTE_JOB
}
