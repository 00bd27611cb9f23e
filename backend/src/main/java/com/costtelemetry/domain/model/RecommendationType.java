package com.costtelemetry.domain.model;

/**
 * Optimization recommendation kinds produced by the advisor.
 *
 * Each type corresponds to one analysis over the cost ledgers.
 */
public enum RecommendationType {
    /**
     * Reduce resource size.
     * Applicable when average usage stays under the utilization threshold for a week.
     */
    RESOURCE_RIGHTSIZING("Resource rightsizing", "Resize underutilized resources to match actual usage",
            RecommendationCategory.COST_REDUCTION),

    /**
     * Scale down during recurring low-usage hours.
     */
    SCHEDULE_OPTIMIZATION("Scheduled scaling", "Scale resources down during predictable off-peak hours",
            RecommendationCategory.COST_REDUCTION),

    /**
     * Move traffic from an expensive model to a cheaper, equally reliable one.
     */
    MODEL_SUGGESTION("Model optimization", "Migrate workloads to a more cost-efficient model",
            RecommendationCategory.EFFICIENCY);

    private final String displayName;
    private final String description;
    private final RecommendationCategory category;

    RecommendationType(String displayName, String description, RecommendationCategory category) {
        this.displayName = displayName;
        this.description = description;
        this.category = category;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public RecommendationCategory getCategory() {
        return category;
    }
}
