package com.costtelemetry.domain.model;

import com.costtelemetry.domain.model.json.*;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Forecast snapshot for one (algorithm, period) pair.
 *
 * The id is derived from the pair, so regenerating a forecast replaces the
 * previous row. A prediction is stale once {@code validUntil} has passed.
 *
 * KNOWN SIMPLIFICATION:
 * The prediction interval is a fixed +/-20% band at a nominal 80% level,
 * not a statistically derived interval.
 */
@Entity
@Table(name = "cost_predictions", indexes = {
    @Index(name = "idx_prediction_period", columnList = "period"),
    @Index(name = "idx_prediction_valid", columnList = "validUntil")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostPrediction {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ForecastHorizon forecastType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CostPeriod period;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private ForecastAlgorithm algorithm;

    /**
     * Computation actually applied, independent of the requested label.
     */
    @Column(nullable = false, length = 32)
    private String computationMethod;

    private double predictedCost;

    @Convert(converter = PredictionIntervalConverter.class)
    @Column(columnDefinition = "TEXT")
    private PredictionInterval predictionInterval;

    private double confidenceScore;

    @Convert(converter = ModelAccuracyConverter.class)
    @Column(columnDefinition = "TEXT")
    private ModelAccuracy modelAccuracy;

    private int basedOnDays;

    @Convert(converter = TrendAnalysisConverter.class)
    @Column(columnDefinition = "TEXT")
    private TrendAnalysis trendAnalysis;

    @Convert(converter = ContributingFactorListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<ContributingFactor> contributingFactors;

    @Convert(converter = ScenarioAnalysisConverter.class)
    @Column(columnDefinition = "TEXT")
    private ScenarioAnalysis scenarioAnalysis;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> recommendations;

    @Column(nullable = false)
    private LocalDateTime forecastGeneratedAt;

    @Column(nullable = false)
    private LocalDateTime validUntil;

    @Column(length = 64)
    private String workspaceId;

    @Column(length = 64)
    private String teamId;

    public static String idFor(ForecastAlgorithm algorithm, CostPeriod period) {
        return algorithm.key() + "-" + period.key();
    }
}
