package com.costtelemetry.domain.model;

import com.costtelemetry.domain.model.json.MetadataConverter;
import com.costtelemetry.domain.model.json.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cost optimization recommendation synthesized from the cost ledgers.
 *
 * LIFECYCLE:
 * Ids are deterministic per finding, so regeneration replaces the analysis
 * fields of an existing row. The workflow status (PENDING, APPROVED,
 * IMPLEMENTED, REJECTED) is owned by reviewers and survives regeneration.
 */
@Entity
@Table(name = "cost_optimization_recommendations", indexes = {
    @Index(name = "idx_recommendation_priority", columnList = "priority"),
    @Index(name = "idx_recommendation_status", columnList = "status"),
    @Index(name = "idx_recommendation_workspace", columnList = "workspaceId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizationRecommendation {

    @Id
    @Column(length = 256)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RecommendationType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RecommendationCategory category;

    @Column(nullable = false, length = 256)
    private String title;

    @Column(length = 1024)
    private String description;

    @Column(columnDefinition = "TEXT")
    private String detailedAnalysis;

    private double estimatedSavings;

    private double estimatedSavingsPercentage;

    private double confidenceScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private ImpactLevel priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private ImpactLevel impact;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private ImpactLevel effort;

    @Column(length = 512)
    private String actionRequired;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> implementationSteps;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> affectedResources;

    @Column(length = 512)
    private String riskAssessment;

    @Column(length = 512)
    private String businessImpact;

    private int timelineDays;

    private boolean autoImplementable;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> metadata;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private RecommendationStatus status = RecommendationStatus.PENDING;

    @Column(length = 64)
    private String workspaceId;

    @Column(length = 64)
    private String teamId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((OptimizationRecommendation) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
