package com.costtelemetry.domain.model;

/**
 * Normalized resource types for infrastructure cost records.
 *
 * Anomaly groups and utilization analysis are keyed by this taxonomy.
 * Compute-backed types receive CPU/memory oriented suggestions when a cost
 * anomaly is raised against them.
 */
public enum ResourceType {
    COMPUTE("Compute instances", true),
    CONTAINER("Containers and managed Kubernetes", true),
    SERVERLESS("Serverless functions", true),
    AI_INFERENCE("Model inference endpoints", true),
    DATABASE("Managed databases", false),
    STORAGE("Object and file storage", false),
    NETWORK("Networking resources", false),
    CACHING("Caching services", false),
    MESSAGING("Message queues and event streams", false),
    UNKNOWN("Unclassified resources", false);

    private final String description;
    private final boolean computeBacked;

    ResourceType(String description, boolean computeBacked) {
        this.description = description;
        this.computeBacked = computeBacked;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Indicates if cost on this resource type is driven by CPU/memory consumption.
     */
    public boolean isComputeBacked() {
        return computeBacked;
    }

    /**
     * Lower-case key used in resource group identifiers and report breakdowns.
     */
    public String key() {
        return name().toLowerCase();
    }
}
