package com.costtelemetry.domain.model;

import com.costtelemetry.domain.model.json.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Statistically unusual cost movement in one (resource type, region) group.
 *
 * Baseline is the historical daily average, actual is the recent daily
 * average. The deviation percentage is signed: negative for cost drops.
 */
@Entity
@Table(name = "cost_anomalies", indexes = {
    @Index(name = "idx_anomaly_severity", columnList = "severity"),
    @Index(name = "idx_anomaly_detected", columnList = "detectedAt"),
    @Index(name = "idx_anomaly_status", columnList = "status"),
    @Index(name = "idx_anomaly_group", columnList = "resourceType, resourceId, status"),
    @Index(name = "idx_anomaly_workspace", columnList = "workspaceId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostAnomaly {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnomalyAlgorithm detectionAlgorithm;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private AnomalyType anomalyType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnomalySeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ResourceType resourceType;

    /**
     * Group key in the form {type}-{region}.
     */
    @Column(nullable = false, length = 160)
    private String resourceId;

    @Column(length = 64)
    private String region;

    private double baselineCost;

    private double actualCost;

    private double deviationPercentage;

    private double zScore;

    private double confidenceScore;

    @Column(columnDefinition = "TEXT")
    private String rootCauseAnalysis;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> suggestedActions;

    @Column(length = 512)
    private String businessImpact;

    @Column(nullable = false)
    private LocalDateTime detectedAt;

    private LocalDateTime resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private AnomalyStatus status = AnomalyStatus.OPEN;

    @Column(length = 64)
    private String workspaceId;

    @Column(length = 64)
    private String teamId;
}
