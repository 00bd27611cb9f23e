package com.costtelemetry.domain.model;

/**
 * Approval workflow states for optimization recommendations.
 */
public enum RecommendationStatus {
    /**
     * Generated and awaiting review.
     */
    PENDING,

    /**
     * Accepted by a reviewer, not yet applied.
     */
    APPROVED,

    /**
     * Change has been applied.
     */
    IMPLEMENTED,

    /**
     * Dismissed by a reviewer.
     */
    REJECTED
}
