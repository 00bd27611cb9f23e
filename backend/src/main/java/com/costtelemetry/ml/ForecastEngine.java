package com.costtelemetry.ml;

import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.*;
import com.costtelemetry.store.CostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Spend forecasting over the daily usage ledger.
 *
 * MODEL:
 * Trend extrapolation of the window average. The point forecast is
 * avgDailyCost * days-in-period; the trend compares the latest 7 days with
 * the earliest 7 days (+/-10% band for STABLE).
 *
 * ALGORITHM LABELS:
 * Every requested algorithm is served by this same computation, an
 * intentional ensemble fallback. The prediction records the requested
 * label and, separately, {@code computationMethod = trend_extrapolation}.
 *
 * KNOWN SIMPLIFICATIONS:
 * - Prediction interval is a fixed [0.8p, 1.2p] band at nominal 80%
 * - Confidence = clamp(0, 100, (1 - variance/avg) * 100), which is scale dependent
 * - Scenario weights and contributing factors are fixed
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForecastEngine {

    static final String COMPUTATION_METHOD = "trend_extrapolation";

    private static final double TREND_BAND = 0.10;
    private static final int INTERVAL_CONFIDENCE_LEVEL = 80;

    private final CostStore costStore;
    private final CostTelemetryProperties properties;
    private final Clock clock;

    /**
     * Forecast spend for one period and store it under (algorithm, period).
     *
     * An empty history yields a zero-confidence prediction that is returned but not stored.
     * A failed write is logged and the unsaved prediction is returned.
     */
    public CostPrediction forecast(CostPeriod period, ForecastAlgorithm algorithm) {
        var settings = properties.getForecast();
        ForecastAlgorithm requested = algorithm != null ? algorithm : settings.getDefaultAlgorithm();
        LocalDateTime now = LocalDateTime.now(clock);

        double[] costs;
        try {
            costs = costStore.dailySpend(now.minusDays(settings.getLookbackDays()), now).stream()
                    .mapToDouble(CostStore.DailyCost::cost)
                    .toArray();
        } catch (Exception e) {
            log.error("Failed to load daily spend for {} forecast: {}", period.key(), e.getMessage());
            costs = new double[0];
        }

        log.debug("Forecasting {} cost ({}) from {} daily points", period.key(), requested.key(), costs.length);

        if (costs.length == 0) {
            log.info("No spend history for {} forecast, returning empty prediction", period.key());
            return emptyPrediction(period, requested, now);
        }

        var prediction = buildPrediction(costs, period, requested, now);
        CostPrediction saved;
        try {
            saved = costStore.savePrediction(prediction);
        } catch (DataAccessException e) {
            log.warn("Failed to store {} forecast {}, returning it unsaved: {}",
                    period.key(), prediction.getId(), e.getMessage());
            saved = prediction;
        }

        log.info("Forecast {}: predicted ${} ({} trend, {}% confidence)",
                saved.getId(),
                String.format("%.2f", saved.getPredictedCost()),
                saved.getTrendAnalysis().overallTrend(),
                String.format("%.0f", saved.getConfidenceScore()));
        return saved;
    }

    CostPrediction buildPrediction(double[] costs, CostPeriod period, ForecastAlgorithm algorithm,
                                   LocalDateTime now) {
        int trendWindow = properties.getForecast().getTrendWindowDays();

        double avgCost = CostStatistics.mean(costs);
        double recentAvg = CostStatistics.tailMean(costs, trendWindow);
        double earlierAvg = CostStatistics.headMean(costs, trendWindow);
        CostTrend trend = classifyTrend(recentAvg, earlierAvg);

        double predicted = avgCost * period.getDays();
        double variance = CostStatistics.variance(costs);
        double confidence = avgCost > 0
                ? CostStatistics.clamp((1 - variance / avgCost) * 100, 0, 100)
                : 0.0;
        double trendStrength = earlierAvg > 0 ? Math.abs((recentAvg - earlierAvg) / earlierAvg) : 0.0;

        return CostPrediction.builder()
                .id(CostPrediction.idFor(algorithm, period))
                .forecastType(period.getHorizon())
                .period(period)
                .algorithm(algorithm)
                .computationMethod(COMPUTATION_METHOD)
                .predictedCost(predicted)
                .predictionInterval(new PredictionInterval(predicted * 0.8, predicted * 1.2, INTERVAL_CONFIDENCE_LEVEL))
                .confidenceScore(confidence)
                .modelAccuracy(new ModelAccuracy(meanAbsolutePercentageError(costs, avgCost),
                        Math.sqrt(variance), confidence / 100))
                .basedOnDays(costs.length)
                .trendAnalysis(new TrendAnalysis(trend, trendStrength, false))
                .contributingFactors(List.of(
                        new ContributingFactor("Historical usage pattern", 0.6, "Based on past usage trends"),
                        new ContributingFactor("Seasonal variations", 0.2, "Monthly and weekly patterns"),
                        new ContributingFactor("External factors", 0.2, "Market and business changes")))
                .scenarioAnalysis(scenarioAnalysis(predicted))
                .recommendations(recommendationsFor(trend))
                .forecastGeneratedAt(now)
                .validUntil(now.plus(properties.getForecast().getValidity()))
                .build();
    }

    private static ScenarioAnalysis scenarioAnalysis(double predicted) {
        return new ScenarioAnalysis(
                predicted * 0.8,
                predicted * 1.3,
                predicted,
                List.of(
                        new ForecastScenario("Conservative growth", 0.4, predicted * 0.9),
                        new ForecastScenario("Expected growth", 0.4, predicted),
                        new ForecastScenario("Aggressive growth", 0.2, predicted * 1.2)));
    }

    CostTrend classifyTrend(double recentAvg, double earlierAvg) {
        if (recentAvg > earlierAvg * (1 + TREND_BAND)) {
            return CostTrend.INCREASING;
        }
        if (recentAvg < earlierAvg * (1 - TREND_BAND)) {
            return CostTrend.DECREASING;
        }
        return CostTrend.STABLE;
    }

    /**
     * MAPE of the flat window-average model against each non-zero day.
     */
    private double meanAbsolutePercentageError(double[] costs, double avgCost) {
        double sum = 0;
        int n = 0;
        for (double cost : costs) {
            if (cost != 0) {
                sum += Math.abs((cost - avgCost) / cost);
                n++;
            }
        }
        return n > 0 ? sum / n * 100 : 0.0;
    }

    private List<String> recommendationsFor(CostTrend trend) {
        List<String> recommendations = new ArrayList<>(List.of(
                "Monitor cost trends closely",
                "Consider implementing cost controls",
                "Review resource utilization"
        ));
        if (trend == CostTrend.INCREASING) {
            recommendations.add("Spend is rising: review budget thresholds for the coming period");
        }
        return recommendations;
    }

    private CostPrediction emptyPrediction(CostPeriod period, ForecastAlgorithm algorithm, LocalDateTime now) {
        return CostPrediction.builder()
                .id(CostPrediction.idFor(algorithm, period))
                .forecastType(period.getHorizon())
                .period(period)
                .algorithm(algorithm)
                .computationMethod(COMPUTATION_METHOD)
                .predictedCost(0.0)
                .predictionInterval(new PredictionInterval(0.0, 0.0, INTERVAL_CONFIDENCE_LEVEL))
                .confidenceScore(0.0)
                .modelAccuracy(new ModelAccuracy(0.0, 0.0, 0.0))
                .basedOnDays(0)
                .trendAnalysis(new TrendAnalysis(CostTrend.STABLE, 0.0, false))
                .contributingFactors(List.of())
                .scenarioAnalysis(scenarioAnalysis(0.0))
                .recommendations(List.of("Insufficient cost history to forecast"))
                .forecastGeneratedAt(now)
                .validUntil(now)
                .build();
    }
}
