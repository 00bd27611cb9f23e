package com.costtelemetry.ml;

import com.costtelemetry.MutableClock;
import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.*;
import com.costtelemetry.store.CostStore;
import com.costtelemetry.store.CostStore.DailyCost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 30, 12, 0);

    @Mock
    private CostStore costStore;

    private ForecastEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ForecastEngine(costStore, new CostTelemetryProperties(), MutableClock.at(NOW));
    }

    @Nested
    @DisplayName("Point forecast")
    class PointForecastTests {

        @BeforeEach
        void saveEchoesInput() {
            lenient().when(costStore.savePrediction(any())).thenAnswer(inv -> inv.getArgument(0));
        }

        @Test
        @DisplayName("Should predict 3000 for a monthly forecast with average daily cost 100")
        void shouldScaleAverageToMonth() {
            givenDailySpend(90, 110, 100, 100, 95, 105, 100, 100, 90, 110);

            var prediction = engine.forecast(CostPeriod.MONTHLY, ForecastAlgorithm.ARIMA);

            assertThat(prediction.getPredictedCost()).isCloseTo(3000.0, within(1e-9));
            assertThat(prediction.getForecastType()).isEqualTo(ForecastHorizon.MEDIUM_TERM);
            assertThat(prediction.getBasedOnDays()).isEqualTo(10);
        }

        @ParameterizedTest
        @EnumSource(CostPeriod.class)
        @DisplayName("Should apply the period day multiplier")
        void shouldApplyMultiplier(CostPeriod period) {
            givenDailySpend(100, 100, 100);

            var prediction = engine.forecast(period, ForecastAlgorithm.LINEAR_REGRESSION);

            assertThat(prediction.getPredictedCost()).isEqualTo(100.0 * period.getDays());
        }

        @Test
        @DisplayName("Should serve every algorithm label with trend extrapolation and record it")
        void shouldRecordComputationMethod() {
            givenDailySpend(100, 100, 100);

            var prediction = engine.forecast(CostPeriod.WEEKLY, ForecastAlgorithm.LSTM);

            assertThat(prediction.getAlgorithm()).isEqualTo(ForecastAlgorithm.LSTM);
            assertThat(prediction.getComputationMethod()).isEqualTo("trend_extrapolation");
            assertThat(prediction.getId()).isEqualTo("lstm-weekly");
        }

        @Test
        @DisplayName("Should fall back to the configured default algorithm")
        void shouldUseDefaultAlgorithm() {
            givenDailySpend(100, 100, 100);

            var prediction = engine.forecast(CostPeriod.DAILY, null);

            assertThat(prediction.getAlgorithm()).isEqualTo(ForecastAlgorithm.ENSEMBLE);
            assertThat(prediction.getId()).isEqualTo("ensemble-daily");
        }

        @Test
        @DisplayName("Should derive interval, scenarios and validity from the point forecast")
        void shouldBuildSupportingAnalysis() {
            givenDailySpend(100, 100, 100);

            var prediction = engine.forecast(CostPeriod.MONTHLY, ForecastAlgorithm.ENSEMBLE);

            assertThat(prediction.getPredictionInterval().lowerBound()).isCloseTo(2400.0, within(1e-9));
            assertThat(prediction.getPredictionInterval().upperBound()).isCloseTo(3600.0, within(1e-9));
            assertThat(prediction.getScenarioAnalysis().bestCase()).isCloseTo(2400.0, within(1e-9));
            assertThat(prediction.getScenarioAnalysis().worstCase()).isCloseTo(3900.0, within(1e-9));
            assertThat(prediction.getScenarioAnalysis().mostLikely()).isEqualTo(3000.0);
            assertThat(prediction.getScenarioAnalysis().scenarios()).hasSize(3);
            assertThat(prediction.getContributingFactors()).extracting(ContributingFactor::impact)
                    .containsExactly(0.6, 0.2, 0.2);
            assertThat(prediction.getConfidenceScore()).isEqualTo(100.0);
            assertThat(prediction.getValidUntil()).isEqualTo(NOW.plusHours(24));
            verify(costStore).savePrediction(prediction);
        }

        @Test
        @DisplayName("Should clamp confidence at zero for very volatile spend")
        void shouldClampConfidence() {
            givenDailySpend(1, 50, 1, 50, 1, 50);

            var prediction = engine.forecast(CostPeriod.DAILY, ForecastAlgorithm.ENSEMBLE);

            assertThat(prediction.getConfidenceScore()).isZero();
            assertThat(prediction.getModelAccuracy().rSquared()).isZero();
        }
    }

    @Nested
    @DisplayName("Trend analysis")
    class TrendTests {

        @Test
        @DisplayName("Should classify within +/-10% as stable and outside as increasing or decreasing")
        void shouldClassifyTrendBand() {
            assertThat(engine.classifyTrend(110, 100)).isEqualTo(CostTrend.STABLE);
            assertThat(engine.classifyTrend(110.5, 100)).isEqualTo(CostTrend.INCREASING);
            assertThat(engine.classifyTrend(90, 100)).isEqualTo(CostTrend.STABLE);
            assertThat(engine.classifyTrend(89.5, 100)).isEqualTo(CostTrend.DECREASING);
        }

        @Test
        @DisplayName("Should compare the latest 7 days with the earliest 7 days")
        void shouldDetectIncreasingTrend() {
            double[] costs = new double[14];
            for (int i = 0; i < 14; i++) {
                costs[i] = i < 7 ? 100 : 150;
            }

            var prediction = engine.buildPrediction(costs, CostPeriod.MONTHLY, ForecastAlgorithm.ENSEMBLE, NOW);

            assertThat(prediction.getTrendAnalysis().overallTrend()).isEqualTo(CostTrend.INCREASING);
            assertThat(prediction.getTrendAnalysis().trendStrength()).isCloseTo(0.5, within(1e-9));
            assertThat(prediction.getRecommendations()).hasSize(4);
        }

        @Test
        @DisplayName("Should keep the three standing recommendations for a stable trend")
        void shouldNotAddTrendRecommendation() {
            var prediction = engine.buildPrediction(new double[]{100, 100, 100}, CostPeriod.MONTHLY,
                    ForecastAlgorithm.ENSEMBLE, NOW);

            assertThat(prediction.getTrendAnalysis().overallTrend()).isEqualTo(CostTrend.STABLE);
            assertThat(prediction.getRecommendations()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Empty or failing history")
    class EmptyHistoryTests {

        @Test
        @DisplayName("Should return an unsaved zero prediction when there is no history")
        void shouldReturnZeroPrediction() {
            when(costStore.dailySpend(any(), any())).thenReturn(List.of());

            var prediction = engine.forecast(CostPeriod.MONTHLY, ForecastAlgorithm.PROPHET);

            assertThat(prediction.getPredictedCost()).isZero();
            assertThat(prediction.getConfidenceScore()).isZero();
            assertThat(prediction.getBasedOnDays()).isZero();
            assertThat(prediction.getScenarioAnalysis().scenarios())
                    .extracting(ForecastScenario::probability, ForecastScenario::predictedCost)
                    .containsExactly(tuple(0.4, 0.0), tuple(0.4, 0.0), tuple(0.2, 0.0));
            verify(costStore, never()).savePrediction(any());
        }

        @Test
        @DisplayName("Should treat a store failure as an empty history")
        void shouldSurviveStoreFailure() {
            when(costStore.dailySpend(any(), any())).thenThrow(new IllegalStateException("connection reset"));

            var prediction = engine.forecast(CostPeriod.WEEKLY, ForecastAlgorithm.ENSEMBLE);

            assertThat(prediction.getPredictedCost()).isZero();
            verify(costStore, never()).savePrediction(any());
        }

        @Test
        @DisplayName("Should return the computed forecast unsaved when storing it fails")
        void shouldReturnUnsavedOnWriteFailure() {
            // Given
            givenDailySpend(100, 100, 100, 100, 100, 100, 100, 100, 100, 100);
            when(costStore.savePrediction(any())).thenThrow(new DataAccessResourceFailureException("db down"));

            // When
            var prediction = engine.forecast(CostPeriod.MONTHLY, ForecastAlgorithm.LINEAR_REGRESSION);

            // Then
            assertThat(prediction.getPredictedCost()).isCloseTo(3000.0, within(1e-9));
            assertThat(prediction.getId()).isEqualTo(CostPrediction.idFor(ForecastAlgorithm.LINEAR_REGRESSION, CostPeriod.MONTHLY));
            verify(costStore).savePrediction(prediction);
        }
    }

    private void givenDailySpend(double... costs) {
        LocalDate first = NOW.toLocalDate().minusDays(costs.length);
        List<DailyCost> rows = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            rows.add(new DailyCost(first.plusDays(i), costs[i]));
        }
        when(costStore.dailySpend(any(), any())).thenReturn(rows);
    }
}
