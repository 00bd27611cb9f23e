package com.costtelemetry.domain.model;

import com.costtelemetry.domain.model.json.StringMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Infrastructure cost record - one billed resource over one billing period.
 *
 * DESIGN RATIONALE:
 * Provider billing data is ingested into this schema by an external pipeline.
 * The monitoring engine only reads it:
 *
 * 1. Real-time breakdowns by service, region and team
 * 2. Anomaly detection over daily cost per (resource type, region)
 * 3. Utilization-driven rightsizing analysis
 *
 * IMMUTABILITY NOTE:
 * Cost records are append-only. The billing period is half-open: [start, end).
 */
@Entity
@Table(name = "infrastructure_costs", indexes = {
    @Index(name = "idx_infra_cost_resource", columnList = "resourceId"),
    @Index(name = "idx_infra_cost_provider", columnList = "provider"),
    @Index(name = "idx_infra_cost_workspace", columnList = "workspaceId"),
    @Index(name = "idx_infra_cost_team", columnList = "teamId"),
    @Index(name = "idx_infra_cost_period", columnList = "billingPeriodStart, billingPeriodEnd"),
    @Index(name = "idx_infra_cost_type_region", columnList = "resourceType, region")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Provider-native resource identifier.
     */
    @Column(nullable = false, length = 512)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ResourceType resourceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloudProvider provider;

    @Column(length = 256)
    private String resourceName;

    @Column(nullable = false, length = 64)
    private String region;

    /**
     * Cost for the billing period, normalized to USD during ingestion.
     */
    @Column(nullable = false, precision = 14, scale = 6)
    private BigDecimal costUsd;

    /**
     * Average usage over the billing period as a 0.0-1.0 ratio of provisioned capacity.
     */
    private Double usageAmount;

    @Column(length = 32)
    private String usageUnit;

    @Column(nullable = false)
    private LocalDateTime billingPeriodStart;

    @Column(nullable = false)
    private LocalDateTime billingPeriodEnd;

    @Column(length = 64)
    private String workspaceId;

    @Column(length = 64)
    private String teamId;

    @Convert(converter = StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> tags;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CostRecord that = (CostRecord) o;
        return provider == that.provider &&
               Objects.equals(resourceId, that.resourceId) &&
               Objects.equals(billingPeriodStart, that.billingPeriodStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, resourceId, billingPeriodStart);
    }
}
