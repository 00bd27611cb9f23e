package com.costtelemetry.store;

import com.costtelemetry.domain.model.*;
import com.costtelemetry.domain.repository.*;
import com.costtelemetry.store.CostStore.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

/**
 * Repository-level tests for JpaCostStore against an embedded H2 database.
 *
 * Test strategy:
 * 1. Spend sums honour the half-open window and each scope filter
 * 2. In-memory groupings (daily, hourly, per resource, per model)
 * 3. Budget and alert selection by status and window
 * 4. JSON columns survive a save and reload
 */
@DataJpaTest
@Import(JpaCostStore.class)
class JpaCostStoreTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2024, 6, 1, 0, 0);

    @Autowired
    private JpaCostStore store;

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ModelUsageRecordRepository usageRepository;

    @Autowired
    private CostRecordRepository costRecordRepository;

    @Autowired
    private OperationalCostRecordRepository operationalRepository;

    @Autowired
    private BudgetRepository budgetRepository;

    @Autowired
    private BudgetAlertRepository alertRepository;

    @Nested
    @DisplayName("Spend and usage")
    class SpendTests {

        @BeforeEach
        void seedUsage() {
            usageRepository.saveAll(List.of(
                    usage("gpt-4o", "10", BASE.plusHours(1), true, "user-1", "ws-a", "team-x"),
                    usage("gpt-4o", "20", BASE.plusDays(1).plusHours(2), false, "user-2", "ws-b", "team-y"),
                    usage("gpt-4o-mini", "1", BASE.plusDays(1).plusHours(3), true, "user-1", "ws-a", "team-x"),
                    usage("gpt-4o", "100", BASE.plusDays(2), true, "user-1", "ws-a", "team-x")
            ));
            entityManager.flush();
        }

        @Test
        @DisplayName("Should sum usage spend inside the half-open window")
        void shouldSumGlobalSpend() {
            assertThat(store.sumSpend(SpendQuery.global(BASE, BASE.plusDays(2)))).isCloseTo(31.0, within(1e-9));
            assertThat(store.sumSpend(SpendQuery.global(BASE.plusDays(5), BASE.plusDays(6)))).isZero();
        }

        @Test
        @DisplayName("Should filter spend by workspace, team and user")
        void shouldFilterSpendByScope() {
            var from = BASE;
            var to = BASE.plusDays(2);

            assertThat(store.sumSpend(SpendQuery.forScope(BudgetScope.WORKSPACE, "ws-a", from, to)))
                    .isCloseTo(11.0, within(1e-9));
            assertThat(store.sumSpend(SpendQuery.forScope(BudgetScope.TEAM, "team-y", from, to)))
                    .isCloseTo(20.0, within(1e-9));
            assertThat(store.sumSpend(SpendQuery.forScope(BudgetScope.USER, "user-2", from, to)))
                    .isCloseTo(20.0, within(1e-9));
        }

        @Test
        @DisplayName("Should bucket usage spend by calendar day, oldest first")
        void shouldGroupDailySpend() {
            var daily = store.dailySpend(BASE, BASE.plusDays(2));

            assertThat(daily).extracting(DailyCost::date)
                    .containsExactly(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 2));
            assertThat(daily.get(1).cost()).isCloseTo(21.0, within(1e-9));
        }

        @Test
        @DisplayName("Should aggregate per-model statistics, most expensive first")
        void shouldComputeModelStats() {
            var stats = store.modelUsageStats(BASE, BASE.plusDays(2), ScopeFilter.none());

            assertThat(stats).extracting(ModelUsageStats::model).containsExactly("gpt-4o", "gpt-4o-mini");
            assertThat(stats.get(0).usageCount()).isEqualTo(2);
            assertThat(stats.get(0).averageCost()).isCloseTo(15.0, within(1e-9));
            assertThat(stats.get(0).successRate()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("Should decode usage rows into typed charges for a scope")
        void shouldReturnScopedCharges() {
            var charges = store.usageCharges(BASE, BASE.plusDays(2), new ScopeFilter("ws-a", null));

            assertThat(charges).hasSize(2)
                    .allSatisfy(c -> assertThat(c.workspaceId()).isEqualTo("ws-a"));
            assertThat(charges.get(0).tokens()).isEqualTo(1000L);
        }
    }

    @Nested
    @DisplayName("Infrastructure costs")
    class InfrastructureTests {

        @BeforeEach
        void seedInfrastructure() {
            costRecordRepository.saveAll(List.of(
                    infra("vm-1", ResourceType.COMPUTE, "eastus", "5", 0.2, BASE, "team-x"),
                    infra("vm-1", ResourceType.COMPUTE, "eastus", "7", 0.4, BASE.plusDays(1), "team-x"),
                    infra("db-1", ResourceType.DATABASE, "westus", "3", null, BASE, null)
            ));
            entityManager.flush();
        }

        @Test
        @DisplayName("Should use the infrastructure ledger for resource type spend")
        void shouldSumByResourceType() {
            var query = SpendQuery.forScope(BudgetScope.RESOURCE_TYPE, "compute", BASE, BASE.plusDays(2));

            assertThat(store.sumSpend(query)).isCloseTo(12.0, within(1e-9));
        }

        @Test
        @DisplayName("Should count resources whose billing period has not ended")
        void shouldCountActiveResources() {
            assertThat(store.countActiveResources(BASE.plusHours(12))).isEqualTo(2);
            assertThat(store.countActiveResources(BASE.plusDays(1).plusHours(12))).isEqualTo(1);
        }

        @Test
        @DisplayName("Should break cost down by service and team, skipping records without a team")
        void shouldBreakDownCost() {
            var byService = store.costBreakdown(BreakdownDimension.SERVICE, BASE, BASE.plusDays(2));
            var byTeam = store.costBreakdown(BreakdownDimension.TEAM, BASE, BASE.plusDays(2));

            assertThat(byService).extracting(CostBreakdownEntry::key).containsExactly("compute", "database");
            assertThat(byService.get(0).cost()).isCloseTo(12.0, within(1e-9));
            assertThat(byTeam).extracting(CostBreakdownEntry::key).containsExactly("team-x");
        }

        @Test
        @DisplayName("Should group daily cost by resource type and region")
        void shouldGroupByResourceGroup() {
            var groups = store.dailyCostByResourceGroup(BASE, BASE.plusDays(2));

            assertThat(groups).extracting(GroupDailyCost::resourceType, GroupDailyCost::date)
                    .containsExactly(
                            tuple(ResourceType.COMPUTE, LocalDate.of(2024, 6, 1)),
                            tuple(ResourceType.COMPUTE, LocalDate.of(2024, 6, 2)),
                            tuple(ResourceType.DATABASE, LocalDate.of(2024, 6, 1)));
        }

        @Test
        @DisplayName("Should average usage per resource and skip resources without measurements")
        void shouldComputeUtilization() {
            var utilization = store.resourceUtilization(BASE, ScopeFilter.none());

            assertThat(utilization).hasSize(1);
            assertThat(utilization.get(0).resourceId()).isEqualTo("vm-1");
            assertThat(utilization.get(0).averageUsage()).isCloseTo(0.3, within(1e-9));
            assertThat(utilization.get(0).totalCost()).isCloseTo(12.0, within(1e-9));
            assertThat(utilization.get(0).recordCount()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Should average operational cost per hour of day")
    void shouldGroupOperationalCostByHour() {
        operationalRepository.saveAll(List.of(
                operation("2", BASE.plusHours(1)),
                operation("4", BASE.plusDays(1).plusHours(1)),
                operation("1", BASE.plusHours(3))
        ));
        entityManager.flush();

        var hourly = store.hourlyOperationalCost(BASE, ScopeFilter.none());

        assertThat(hourly).extracting(HourlyCost::hour).containsExactly(1, 3);
        assertThat(hourly.get(0).averageCost()).isCloseTo(3.0, within(1e-9));
        assertThat(hourly.get(0).samples()).isEqualTo(2);
    }

    @Nested
    @DisplayName("Budgets and alerts")
    class BudgetTests {

        @Test
        @DisplayName("Should select only active budgets whose window covers the instant")
        void shouldFindActiveBudgets() {
            budgetRepository.saveAll(List.of(
                    budget("Current", BudgetStatus.ACTIVE, BASE, BASE.plusMonths(1)),
                    budget("Paused", BudgetStatus.PAUSED, BASE, BASE.plusMonths(1)),
                    budget("Ended", BudgetStatus.ACTIVE, BASE.minusMonths(1), BASE)
            ));
            entityManager.flush();

            assertThat(store.findActiveBudgets(BASE.plusDays(3)))
                    .extracting(Budget::getName).containsExactly("Current");
        }

        @Test
        @DisplayName("Should evaluate active and triggered alerts of active budgets only")
        void shouldFindEvaluableAlerts() {
            var active = budgetRepository.save(budget("Current", BudgetStatus.ACTIVE, BASE, BASE.plusMonths(1)));
            var paused = budgetRepository.save(budget("Paused", BudgetStatus.PAUSED, BASE, BASE.plusMonths(1)));
            alertRepository.saveAll(List.of(
                    alert(active, "armed", AlertStatus.ACTIVE),
                    alert(active, "fired", AlertStatus.TRIGGERED),
                    alert(active, "quiet", AlertStatus.SNOOZED),
                    alert(paused, "paused", AlertStatus.ACTIVE)
            ));
            entityManager.flush();
            entityManager.clear();

            var alerts = store.findEvaluableAlerts();

            assertThat(alerts).extracting(BudgetAlert::getName).containsExactly("armed", "fired");
            assertThat(alerts.get(0).getBudget().getName()).isEqualTo("Current");
        }
    }

    @Nested
    @DisplayName("Findings")
    class FindingTests {

        @Test
        @DisplayName("Should find the open anomaly for a resource group and count recent ones")
        void shouldFindOpenAnomaly() {
            store.saveAnomaly(anomaly(AnomalyStatus.RESOLVED, BASE));
            var open = store.saveAnomaly(anomaly(AnomalyStatus.OPEN, BASE.plusDays(1)));
            entityManager.flush();

            assertThat(store.findOpenAnomaly(ResourceType.COMPUTE, "compute-eastus"))
                    .get().extracting(CostAnomaly::getId).isEqualTo(open.getId());
            assertThat(store.countOpenAnomaliesSince(BASE)).isEqualTo(1);
            assertThat(store.countOpenAnomaliesSince(BASE.plusDays(2))).isZero();
        }

        @Test
        @DisplayName("Should persist recommendation metadata and list columns as JSON")
        void shouldRoundTripJsonColumns() {
            store.saveRecommendation(OptimizationRecommendation.builder()
                    .id("rightsizing-vm-1")
                    .type(RecommendationType.RESOURCE_RIGHTSIZING)
                    .category(RecommendationCategory.COST_REDUCTION)
                    .title("Rightsize vm-1")
                    .priority(ImpactLevel.HIGH)
                    .impact(ImpactLevel.MEDIUM)
                    .effort(ImpactLevel.LOW)
                    .estimatedSavings(80.0)
                    .affectedResources(List.of("vm-1"))
                    .metadata(Map.of("averageUsage", 0.3, "resourceType", "compute"))
                    .createdAt(BASE)
                    .build());
            entityManager.flush();
            entityManager.clear();

            var reloaded = store.findRecommendation("rightsizing-vm-1").orElseThrow();

            assertThat(reloaded.getAffectedResources()).containsExactly("vm-1");
            assertThat(reloaded.getMetadata()).containsEntry("averageUsage", 0.3)
                    .containsEntry("resourceType", "compute");
            assertThat(reloaded.getStatus()).isEqualTo(RecommendationStatus.PENDING);
        }
    }

    private static ModelUsageRecord usage(String model, String cost, LocalDateTime at, boolean success,
                                          String userId, String workspaceId, String teamId) {
        return ModelUsageRecord.builder()
                .model(model)
                .costUsd(new BigDecimal(cost))
                .totalTokens(1000L)
                .executionTimeMs(800L)
                .success(success)
                .userId(userId)
                .workspaceId(workspaceId)
                .teamId(teamId)
                .createdAt(at)
                .build();
    }

    private static CostRecord infra(String resourceId, ResourceType type, String region, String cost,
                                    Double usage, LocalDateTime start, String teamId) {
        return CostRecord.builder()
                .resourceId(resourceId)
                .resourceType(type)
                .provider(CloudProvider.AZURE)
                .region(region)
                .costUsd(new BigDecimal(cost))
                .usageAmount(usage)
                .billingPeriodStart(start)
                .billingPeriodEnd(start.plusDays(1))
                .workspaceId("ws-a")
                .teamId(teamId)
                .build();
    }

    private static OperationalCostRecord operation(String cost, LocalDateTime at) {
        return OperationalCostRecord.builder()
                .operationType(OperationType.API_CALL)
                .operationName("export")
                .costUsd(new BigDecimal(cost))
                .success(true)
                .createdAt(at)
                .build();
    }

    private static Budget budget(String name, BudgetStatus status, LocalDateTime start, LocalDateTime end) {
        return Budget.builder()
                .name(name)
                .period(CostPeriod.MONTHLY)
                .amount(new BigDecimal("1000"))
                .scope(BudgetScope.GLOBAL)
                .startDate(start)
                .endDate(end)
                .status(status)
                .build();
    }

    private static BudgetAlert alert(Budget budget, String name, AlertStatus status) {
        return BudgetAlert.builder()
                .budget(budget)
                .name(name)
                .alertType(AlertType.THRESHOLD)
                .thresholdPercentage(80.0)
                .status(status)
                .severity(AlertSeverity.WARNING)
                .build();
    }

    private static CostAnomaly anomaly(AnomalyStatus status, LocalDateTime detectedAt) {
        return CostAnomaly.builder()
                .detectionAlgorithm(AnomalyAlgorithm.STATISTICAL)
                .anomalyType(AnomalyType.SPIKE)
                .severity(AnomalySeverity.HIGH)
                .resourceType(ResourceType.COMPUTE)
                .resourceId("compute-eastus")
                .region("eastus")
                .baselineCost(10.0)
                .actualCost(30.0)
                .detectedAt(detectedAt)
                .status(status)
                .build();
    }
}
