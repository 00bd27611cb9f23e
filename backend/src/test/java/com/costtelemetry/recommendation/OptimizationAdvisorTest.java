package com.costtelemetry.recommendation;

import com.costtelemetry.MutableClock;
import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.*;
import com.costtelemetry.store.CostStore;
import com.costtelemetry.store.CostStore.HourlyCost;
import com.costtelemetry.store.CostStore.ModelUsageStats;
import com.costtelemetry.store.CostStore.ResourceUtilization;
import com.costtelemetry.store.CostStore.ScopeFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OptimizationAdvisor.
 *
 * Test strategy:
 * 1. Each analysis against its thresholds
 * 2. Ranking and persistence of the combined output
 * 3. A failing analysis does not hide the others
 */
@ExtendWith(MockitoExtension.class)
class OptimizationAdvisorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 15, 10, 0);
    private static final ScopeFilter GLOBAL = ScopeFilter.none();

    @Mock
    private CostStore costStore;

    private OptimizationAdvisor advisor;

    @BeforeEach
    void setUp() {
        advisor = new OptimizationAdvisor(costStore, new CostTelemetryProperties(), MutableClock.at(NOW));
    }

    @Nested
    @DisplayName("Utilization analysis")
    class UtilizationTests {

        @Test
        @DisplayName("Should recommend rightsizing with 80 savings and HIGH priority for usage 0.3 and cost 200")
        void shouldRecommendRightsizing() {
            // Given
            when(costStore.resourceUtilization(NOW.minusDays(7), GLOBAL)).thenReturn(List.of(
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-01", 0.3, 200.0, 7)));

            // When
            var result = advisor.analyzeUtilization(GLOBAL, NOW);

            // Then
            assertThat(result).hasSize(1);
            var rec = result.get(0);
            assertThat(rec.getId()).isEqualTo("rightsizing-vm-01-global");
            assertThat(rec.getType()).isEqualTo(RecommendationType.RESOURCE_RIGHTSIZING);
            assertThat(rec.getEstimatedSavings()).isCloseTo(80.0, within(1e-9));
            assertThat(rec.getEstimatedSavingsPercentage()).isCloseTo(40.0, within(1e-9));
            assertThat(rec.getPriority()).isEqualTo(ImpactLevel.HIGH);
            assertThat(rec.getEffort()).isEqualTo(ImpactLevel.LOW);
            assertThat(rec.getConfidenceScore()).isEqualTo(85.0);
            assertThat(rec.getImplementationSteps()).hasSize(5);
            assertThat(rec.getTimelineDays()).isEqualTo(3);
            assertThat(rec.getAffectedResources()).containsExactly("vm-01");
        }

        @Test
        @DisplayName("Should use MEDIUM priority at or below 100 total cost")
        void shouldUseMediumPriorityForSmallCost() {
            when(costStore.resourceUtilization(any(), any())).thenReturn(List.of(
                    new ResourceUtilization(ResourceType.DATABASE, "db-01", 0.1, 100.0, 7)));

            var rec = advisor.analyzeUtilization(GLOBAL, NOW).get(0);

            assertThat(rec.getPriority()).isEqualTo(ImpactLevel.MEDIUM);
            assertThat(rec.getEstimatedSavings()).isCloseTo(40.0, within(1e-9));
        }

        @Test
        @DisplayName("Should keep scoped and global rightsizing for the same resource apart")
        void shouldKeyRightsizingByScope() {
            var scope = new ScopeFilter("ws-1", null);
            when(costStore.resourceUtilization(any(), any())).thenReturn(List.of(
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-01", 0.3, 200.0, 7)));

            var scoped = advisor.analyzeUtilization(scope, NOW).get(0);
            var global = advisor.analyzeUtilization(GLOBAL, NOW).get(0);

            assertThat(scoped.getId()).isEqualTo("rightsizing-vm-01-ws-ws-1");
            assertThat(scoped.getWorkspaceId()).isEqualTo("ws-1");
            assertThat(global.getId()).isEqualTo("rightsizing-vm-01-global");
            assertThat(global.getWorkspaceId()).isNull();
        }

        @Test
        @DisplayName("Should ignore resources at or above 50% usage")
        void shouldIgnoreWellUsedResources() {
            when(costStore.resourceUtilization(any(), any())).thenReturn(List.of(
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-02", 0.5, 500.0, 7),
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-03", 0.9, 500.0, 7)));

            assertThat(advisor.analyzeUtilization(GLOBAL, NOW)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Scheduling analysis")
    class SchedulingTests {

        @Test
        @DisplayName("Should recommend scheduled scaling with 8 or more low-usage hours")
        void shouldRecommendScheduling() {
            // 8 hours at 0.1 and 16 hours at 2.0: mean 1.3667, cutoff 0.41
            when(costStore.hourlyOperationalCost(NOW.minusDays(30), GLOBAL)).thenReturn(hourly(8, 0.1, 2.0));

            var result = advisor.analyzeScheduling(GLOBAL, NOW);

            assertThat(result).hasSize(1);
            var rec = result.get(0);
            double mean = (8 * 0.1 + 16 * 2.0) / 24;
            assertThat(rec.getId()).isEqualTo("schedule-optimization-global");
            assertThat(rec.getEstimatedSavings()).isCloseTo(mean * 24 * 30 * 0.25, within(1e-9));
            assertThat(rec.isAutoImplementable()).isTrue();
            assertThat(rec.getConfidenceScore()).isEqualTo(75.0);
            assertThat(rec.getTimelineDays()).isEqualTo(14);
        }

        @Test
        @DisplayName("Should not recommend with only 7 low-usage hours")
        void shouldRequireEightLowHours() {
            when(costStore.hourlyOperationalCost(any(), any())).thenReturn(hourly(7, 0.1, 2.0));

            assertThat(advisor.analyzeScheduling(GLOBAL, NOW)).isEmpty();
        }

        @Test
        @DisplayName("Should not recommend without operational history")
        void shouldHandleEmptyHistory() {
            when(costStore.hourlyOperationalCost(any(), any())).thenReturn(List.of());

            assertThat(advisor.analyzeScheduling(GLOBAL, NOW)).isEmpty();
        }

        @Test
        @DisplayName("Should key the recommendation id by scope")
        void shouldScopeId() {
            var scope = new ScopeFilter("ws-1", "team-a");
            when(costStore.hourlyOperationalCost(any(), any())).thenReturn(hourly(10, 0.1, 2.0));

            var rec = advisor.analyzeScheduling(scope, NOW).get(0);

            assertThat(rec.getId()).isEqualTo("schedule-optimization-ws-ws-1-team-team-a");
            assertThat(rec.getWorkspaceId()).isEqualTo("ws-1");
            assertThat(rec.getTeamId()).isEqualTo("team-a");
        }
    }

    @Nested
    @DisplayName("Model efficiency analysis")
    class ModelEfficiencyTests {

        @Test
        @DisplayName("Should suggest migrating from the expensive, less reliable model")
        void shouldSuggestModelSwitch() {
            when(costStore.modelUsageStats(NOW.minusDays(30), NOW, GLOBAL)).thenReturn(List.of(
                    new ModelUsageStats("large", 100, 0.50, 50.0, 0.80),
                    new ModelUsageStats("small", 200, 0.05, 10.0, 0.98)));

            var result = advisor.analyzeModelEfficiency(GLOBAL, NOW);

            assertThat(result).hasSize(1);
            var rec = result.get(0);
            assertThat(rec.getId()).isEqualTo("model-optimization-large-to-small-global");
            assertThat(rec.getEstimatedSavings()).isCloseTo(45.0, within(1e-9));
            assertThat(rec.getEstimatedSavingsPercentage()).isCloseTo(90.0, within(1e-9));
            assertThat(rec.getPriority()).isEqualTo(ImpactLevel.MEDIUM);
            assertThat(rec.getMetadata()).containsEntry("suggestedModel", "small");
        }

        @Test
        @DisplayName("Should use HIGH priority above 1000 savings")
        void shouldRaisePriorityForLargeSavings() {
            when(costStore.modelUsageStats(any(), any(), any())).thenReturn(List.of(
                    new ModelUsageStats("large", 5000, 0.50, 2500.0, 0.70),
                    new ModelUsageStats("small", 200, 0.05, 10.0, 0.98)));

            var rec = advisor.analyzeModelEfficiency(GLOBAL, NOW).get(0);

            assertThat(rec.getEstimatedSavings()).isCloseTo(2250.0, within(1e-9));
            assertThat(rec.getPriority()).isEqualTo(ImpactLevel.HIGH);
        }

        @Test
        @DisplayName("Should stay quiet when the expensive model is reliable enough")
        void shouldRespectSuccessTolerance() {
            // 0.90 >= 0.98 * 0.9
            when(costStore.modelUsageStats(any(), any(), any())).thenReturn(List.of(
                    new ModelUsageStats("large", 100, 0.50, 50.0, 0.90),
                    new ModelUsageStats("small", 200, 0.05, 10.0, 0.98)));

            assertThat(advisor.analyzeModelEfficiency(GLOBAL, NOW)).isEmpty();
        }

        @Test
        @DisplayName("Should ignore models with 10 or fewer executions or zero cost")
        void shouldFilterSparseModels() {
            when(costStore.modelUsageStats(any(), any(), any())).thenReturn(List.of(
                    new ModelUsageStats("large", 10, 0.50, 5.0, 0.10),
                    new ModelUsageStats("free", 500, 0.0, 0.0, 1.0),
                    new ModelUsageStats("small", 200, 0.05, 10.0, 0.98)));

            assertThat(advisor.analyzeModelEfficiency(GLOBAL, NOW)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Combined generation")
    class GenerationTests {

        @BeforeEach
        void saveEchoesInput() {
            lenient().when(costStore.saveRecommendation(any())).thenAnswer(inv -> inv.getArgument(0));
            lenient().when(costStore.findRecommendation(any())).thenReturn(Optional.empty());
        }

        @Test
        @DisplayName("Should rank recommendations by estimated savings, largest first")
        void shouldRankBySavings() {
            when(costStore.resourceUtilization(any(), any())).thenReturn(List.of(
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-small", 0.2, 50.0, 7),
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-big", 0.2, 1000.0, 7)));
            when(costStore.hourlyOperationalCost(any(), any())).thenReturn(hourly(8, 0.1, 2.0));
            when(costStore.modelUsageStats(any(), any(), any())).thenReturn(List.of());

            var result = advisor.generateRecommendations(null);

            assertThat(result).extracting(OptimizationRecommendation::getId)
                    .containsExactly("rightsizing-vm-big-global", "schedule-optimization-global", "rightsizing-vm-small-global");
            verify(costStore, times(3)).saveRecommendation(any());
        }

        @Test
        @DisplayName("Should keep the reviewer status and creation time when regenerating")
        void shouldPreserveWorkflowStatus() {
            var existing = OptimizationRecommendation.builder()
                    .id("rightsizing-vm-01-global")
                    .status(RecommendationStatus.APPROVED)
                    .createdAt(NOW.minusDays(3))
                    .build();
            when(costStore.findRecommendation("rightsizing-vm-01-global")).thenReturn(Optional.of(existing));
            when(costStore.resourceUtilization(any(), any())).thenReturn(List.of(
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-01", 0.3, 200.0, 7)));
            when(costStore.hourlyOperationalCost(any(), any())).thenReturn(List.of());
            when(costStore.modelUsageStats(any(), any(), any())).thenReturn(List.of());

            var rec = advisor.generateRecommendations(GLOBAL).get(0);

            assertThat(rec.getStatus()).isEqualTo(RecommendationStatus.APPROVED);
            assertThat(rec.getCreatedAt()).isEqualTo(NOW.minusDays(3));
            assertThat(rec.getUpdatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should return the other analyses when one fails")
        void shouldIsolateAnalysisFailure() {
            when(costStore.resourceUtilization(any(), any())).thenThrow(new IllegalStateException("timeout"));
            when(costStore.hourlyOperationalCost(any(), any())).thenReturn(hourly(8, 0.1, 2.0));
            when(costStore.modelUsageStats(any(), any(), any())).thenReturn(List.of());

            var result = advisor.generateRecommendations(GLOBAL);

            assertThat(result).extracting(OptimizationRecommendation::getType)
                    .containsExactly(RecommendationType.SCHEDULE_OPTIMIZATION);
        }

        @Test
        @DisplayName("Should still return a recommendation whose save failed")
        void shouldReturnUnsavedOnPersistFailure() {
            when(costStore.resourceUtilization(any(), any())).thenReturn(List.of(
                    new ResourceUtilization(ResourceType.COMPUTE, "vm-01", 0.3, 200.0, 7)));
            when(costStore.hourlyOperationalCost(any(), any())).thenReturn(List.of());
            when(costStore.modelUsageStats(any(), any(), any())).thenReturn(List.of());
            when(costStore.saveRecommendation(any())).thenThrow(new IllegalStateException("disk full"));

            var result = advisor.generateRecommendations(GLOBAL);

            assertThat(result).extracting(OptimizationRecommendation::getId).containsExactly("rightsizing-vm-01-global");
        }
    }

    private static List<HourlyCost> hourly(int lowHours, double lowCost, double normalCost) {
        List<HourlyCost> hours = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            hours.add(new HourlyCost(hour, hour < lowHours ? lowCost : normalCost, 30));
        }
        return hours;
    }
}
