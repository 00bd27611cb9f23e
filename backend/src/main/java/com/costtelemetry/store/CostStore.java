package com.costtelemetry.store;

import com.costtelemetry.domain.model.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Port interface for the durable cost store.
 *
 * BOUNDARY CONTRACT:
 * Every aggregate read returns one of the typed records declared here,
 * decoded inside the implementation. Downstream math never sees raw rows
 * or untyped maps.
 *
 * WINDOWS:
 * All [from, to) windows are half-open. Costs are USD.
 *
 * Writes are insert-or-replace for predictions and recommendations
 * (deterministic ids) and plain saves for anomalies, alerts and budgets.
 */
public interface CostStore {

    /**
     * Sum spend on the usage ledger (or the infrastructure ledger for
     * resource-type scopes) over the query window and filters.
     */
    double sumSpend(SpendQuery query);

    /**
     * Count distinct resources still billing at {@code at}.
     */
    long countActiveResources(LocalDateTime at);

    /**
     * Infrastructure cost grouped by one dimension, highest cost first.
     * The TEAM breakdown omits records without a team.
     */
    List<CostBreakdownEntry> costBreakdown(BreakdownDimension dimension, LocalDateTime from, LocalDateTime to);

    long countOpenAnomaliesSince(LocalDateTime since);

    /**
     * ACTIVE budgets whose window contains {@code at}.
     */
    List<Budget> findActiveBudgets(LocalDateTime at);

    /**
     * Daily infrastructure cost per (resource type, region), ordered by group then date.
     */
    List<GroupDailyCost> dailyCostByResourceGroup(LocalDateTime from, LocalDateTime to);

    Optional<CostAnomaly> findOpenAnomaly(ResourceType resourceType, String resourceId);

    CostAnomaly saveAnomaly(CostAnomaly anomaly);

    /**
     * ACTIVE or TRIGGERED alerts whose budget is ACTIVE, budgets loaded.
     */
    List<BudgetAlert> findEvaluableAlerts();

    BudgetAlert saveAlert(BudgetAlert alert);

    Budget saveBudget(Budget budget);

    /**
     * Daily usage spend, oldest day first. Days without charges are absent.
     */
    List<DailyCost> dailySpend(LocalDateTime from, LocalDateTime to);

    CostPrediction savePrediction(CostPrediction prediction);

    /**
     * Per-resource average usage and total cost for records billing since {@code since}.
     */
    List<ResourceUtilization> resourceUtilization(LocalDateTime since, ScopeFilter scope);

    /**
     * Average operational cost per hour-of-day bucket. Hours without operations are absent.
     */
    List<HourlyCost> hourlyOperationalCost(LocalDateTime since, ScopeFilter scope);

    /**
     * Per-model execution statistics over [from, to), highest average cost first.
     */
    List<ModelUsageStats> modelUsageStats(LocalDateTime from, LocalDateTime to, ScopeFilter scope);

    Optional<OptimizationRecommendation> findRecommendation(String id);

    OptimizationRecommendation saveRecommendation(OptimizationRecommendation recommendation);

    List<UsageCharge> usageCharges(LocalDateTime from, LocalDateTime to, ScopeFilter scope);

    List<InfrastructureCharge> infrastructureCharges(LocalDateTime from, LocalDateTime to, ScopeFilter scope);

    enum BreakdownDimension {
        SERVICE,
        REGION,
        TEAM
    }

    /**
     * Optional workspace/team restriction. Null members match everything.
     */
    record ScopeFilter(String workspaceId, String teamId) {

        public static ScopeFilter none() {
            return new ScopeFilter(null, null);
        }

        /**
         * Stable key used in recommendation ids.
         */
        public String key() {
            if (workspaceId == null && teamId == null) {
                return "global";
            }
            StringBuilder key = new StringBuilder();
            if (workspaceId != null) {
                key.append("ws-").append(workspaceId);
            }
            if (teamId != null) {
                if (!key.isEmpty()) {
                    key.append('-');
                }
                key.append("team-").append(teamId);
            }
            return key.toString();
        }
    }

    /**
     * Spend query over [from, to). At most one of the filters is normally set.
     */
    record SpendQuery(
            LocalDateTime from,
            LocalDateTime to,
            String workspaceId,
            String teamId,
            String userId,
            ResourceType resourceType
    ) {

        public static SpendQuery global(LocalDateTime from, LocalDateTime to) {
            return new SpendQuery(from, to, null, null, null, null);
        }

        /**
         * Spend inside the budget's window and scope.
         */
        public static SpendQuery forBudget(Budget budget) {
            return forScope(budget.getScope(), budget.getScopeId(), budget.getStartDate(), budget.getEndDate());
        }

        public static SpendQuery forScope(BudgetScope scope, String scopeId, LocalDateTime from, LocalDateTime to) {
            return switch (scope) {
                case GLOBAL -> global(from, to);
                case WORKSPACE -> new SpendQuery(from, to, scopeId, null, null, null);
                case TEAM -> new SpendQuery(from, to, null, scopeId, null, null);
                case USER -> new SpendQuery(from, to, null, null, scopeId, null);
                case RESOURCE_TYPE -> new SpendQuery(from, to, null, null, null,
                        ResourceType.valueOf(scopeId.trim().toUpperCase()));
            };
        }
    }

    record CostBreakdownEntry(String key, double cost) {}

    record GroupDailyCost(ResourceType resourceType, String region, LocalDate date, double cost) {}

    record DailyCost(LocalDate date, double cost) {}

    record ResourceUtilization(
            ResourceType resourceType,
            String resourceId,
            double averageUsage,
            double totalCost,
            int recordCount
    ) {}

    record HourlyCost(int hour, double averageCost, long samples) {}

    record ModelUsageStats(
            String model,
            long usageCount,
            double averageCost,
            double totalCost,
            double successRate
    ) {}

    record UsageCharge(
            LocalDateTime createdAt,
            String model,
            double cost,
            long tokens,
            long executionTimeMs,
            boolean success,
            String userId,
            String workspaceId,
            String teamId
    ) {}

    record InfrastructureCharge(
            LocalDateTime periodStart,
            String resourceId,
            ResourceType resourceType,
            String region,
            double cost,
            Double usage,
            String workspaceId,
            String teamId
    ) {}
}
