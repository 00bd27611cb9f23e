package com.costtelemetry.analytics;

import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.OptimizationRecommendation;
import com.costtelemetry.ml.CostStatistics;
import com.costtelemetry.recommendation.OptimizationAdvisor;
import com.costtelemetry.store.CostStore;
import com.costtelemetry.store.CostStore.InfrastructureCharge;
import com.costtelemetry.store.CostStore.ScopeFilter;
import com.costtelemetry.store.CostStore.UsageCharge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Usage analytics over an arbitrary window.
 *
 * Usage charges give totals, daily metrics, trends and the model/workspace/team
 * breakdowns; infrastructure charges give the resource type and region
 * breakdowns plus utilization. Optimization recommendations for the same
 * scope are generated and embedded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageAnalyticsService {

    private final CostStore costStore;
    private final OptimizationAdvisor optimizationAdvisor;
    private final CostTelemetryProperties properties;

    public UsageAnalyticsReport getUsageAnalytics(LocalDateTime startDate, LocalDateTime endDate,
                                                  String workspaceId, String teamId) {
        if (startDate == null || endDate == null || !startDate.isBefore(endDate)) {
            throw new IllegalArgumentException("Analytics window start must be before its end");
        }
        var scope = new ScopeFilter(workspaceId, teamId);
        log.info("Building usage analytics for {} to {} (scope {})", startDate, endDate, scope.key());

        List<UsageCharge> usage = costStore.usageCharges(startDate, endDate, scope);
        List<InfrastructureCharge> infrastructure = costStore.infrastructureCharges(startDate, endDate, scope);

        double totalCost = usage.stream().mapToDouble(UsageCharge::cost).sum();
        List<DailyUsagePoint> daily = dailyPoints(usage, infrastructure);

        List<OptimizationRecommendation> recommendations;
        try {
            recommendations = optimizationAdvisor.generateRecommendations(scope);
        } catch (Exception e) {
            log.error("Failed to embed optimization recommendations: {}", e.getMessage());
            recommendations = List.of();
        }

        return new UsageAnalyticsReport(
                new ReportPeriod(startDate, endDate),
                summary(usage, infrastructure, totalCost),
                dailyMetrics(daily),
                new Trends(daily, growthRates(daily)),
                new Breakdowns(
                        breakdown(usage, UsageCharge::model, UsageCharge::cost, totalCost),
                        breakdown(usage, UsageCharge::workspaceId, UsageCharge::cost, totalCost),
                        breakdown(usage, UsageCharge::teamId, UsageCharge::cost, totalCost),
                        breakdown(infrastructure, c -> c.resourceType().key(), InfrastructureCharge::cost,
                                infrastructure.stream().mapToDouble(InfrastructureCharge::cost).sum()),
                        breakdown(infrastructure, InfrastructureCharge::region, InfrastructureCharge::cost,
                                infrastructure.stream().mapToDouble(InfrastructureCharge::cost).sum())),
                efficiency(usage, infrastructure, totalCost, recommendations.size()),
                recommendations
        );
    }

    private UsageSummary summary(List<UsageCharge> usage, List<InfrastructureCharge> infrastructure, double totalCost) {
        return new UsageSummary(
                totalCost,
                usage.stream().mapToLong(UsageCharge::tokens).sum(),
                usage.size(),
                distinct(usage, UsageCharge::workspaceId),
                distinct(usage, UsageCharge::userId),
                infrastructure.stream().map(InfrastructureCharge::resourceId).distinct().count()
        );
    }

    private List<DailyUsagePoint> dailyPoints(List<UsageCharge> usage, List<InfrastructureCharge> infrastructure) {
        Map<LocalDate, List<UsageCharge>> byDay = usage.stream()
                .collect(Collectors.groupingBy(c -> c.createdAt().toLocalDate(), TreeMap::new, Collectors.toList()));
        Map<LocalDate, Double> utilizationByDay = infrastructure.stream()
                .filter(c -> c.usage() != null)
                .collect(Collectors.groupingBy(c -> c.periodStart().toLocalDate(),
                        Collectors.averagingDouble(InfrastructureCharge::usage)));

        List<DailyUsagePoint> points = new ArrayList<>();
        byDay.forEach((date, charges) -> points.add(new DailyUsagePoint(
                date,
                charges.stream().mapToDouble(UsageCharge::cost).sum(),
                charges.size(),
                charges.stream().mapToLong(UsageCharge::tokens).sum(),
                distinct(charges, UsageCharge::userId),
                utilizationByDay.get(date))));
        return points;
    }

    private DailyMetrics dailyMetrics(List<DailyUsagePoint> daily) {
        if (daily.isEmpty()) {
            return new DailyMetrics(0.0, 0.0, 0.0, null, null, 0.0);
        }
        double[] costs = daily.stream().mapToDouble(DailyUsagePoint::cost).toArray();
        double avgCost = CostStatistics.mean(costs);
        var peak = daily.stream().max(Comparator.comparingDouble(DailyUsagePoint::cost)).orElseThrow();
        var lowest = daily.stream().min(Comparator.comparingDouble(DailyUsagePoint::cost)).orElseThrow();
        return new DailyMetrics(
                avgCost,
                daily.stream().mapToLong(DailyUsagePoint::executions).average().orElse(0.0),
                daily.stream().mapToLong(DailyUsagePoint::tokens).average().orElse(0.0),
                peak.date(),
                lowest.date(),
                avgCost > 0 ? CostStatistics.standardDeviation(costs) / avgCost : 0.0
        );
    }

    /**
     * Compares the first half of the daily points with the second half.
     */
    private GrowthRates growthRates(List<DailyUsagePoint> daily) {
        if (daily.size() < 2) {
            return new GrowthRates(0.0, 0.0, 0.0);
        }
        int mid = daily.size() / 2;
        var firstHalf = daily.subList(0, mid);
        var secondHalf = daily.subList(mid, daily.size());
        return new GrowthRates(
                CostStatistics.growthRate(sum(firstHalf, DailyUsagePoint::cost), sum(secondHalf, DailyUsagePoint::cost)),
                CostStatistics.growthRate(sum(firstHalf, DailyUsagePoint::executions),
                        sum(secondHalf, DailyUsagePoint::executions)),
                CostStatistics.growthRate(sum(firstHalf, DailyUsagePoint::uniqueUsers),
                        sum(secondHalf, DailyUsagePoint::uniqueUsers))
        );
    }

    private EfficiencyMetrics efficiency(List<UsageCharge> usage, List<InfrastructureCharge> infrastructure,
                                         double totalCost, int opportunities) {
        long successes = usage.stream().filter(UsageCharge::success).count();
        double threshold = properties.getOptimization().getUnderutilizationThreshold();
        var measured = infrastructure.stream().filter(c -> c.usage() != null).toList();

        return new EfficiencyMetrics(
                successes > 0 ? totalCost / successes : 0.0,
                measured.stream().mapToDouble(InfrastructureCharge::usage).average().orElse(0.0),
                measured.stream().filter(c -> c.usage() < threshold).mapToDouble(InfrastructureCharge::cost).sum(),
                opportunities
        );
    }

    private static <T> List<BreakdownEntry> breakdown(List<T> items, Function<T, String> key,
                                                      ToDoubleFunction<T> cost, double total) {
        Map<String, double[]> groups = new HashMap<>();
        for (T item : items) {
            String k = key.apply(item);
            if (k == null) {
                continue;
            }
            double[] acc = groups.computeIfAbsent(k, x -> new double[2]);
            acc[0] += cost.applyAsDouble(item);
            acc[1]++;
        }
        return groups.entrySet().stream()
                .map(e -> new BreakdownEntry(e.getKey(), e.getValue()[0], (long) e.getValue()[1],
                        total > 0 ? e.getValue()[0] / total * 100 : 0.0))
                .sorted(Comparator.comparingDouble(BreakdownEntry::cost).reversed())
                .toList();
    }

    private static <T> long distinct(List<T> items, Function<T, String> key) {
        return items.stream().map(key).filter(Objects::nonNull).distinct().count();
    }

    private static double sum(List<DailyUsagePoint> points, ToDoubleFunction<DailyUsagePoint> value) {
        return points.stream().mapToDouble(value).sum();
    }

    public record UsageAnalyticsReport(
            ReportPeriod period,
            UsageSummary summary,
            DailyMetrics dailyMetrics,
            Trends trends,
            Breakdowns breakdowns,
            EfficiencyMetrics efficiency,
            List<OptimizationRecommendation> recommendations
    ) {}

    public record ReportPeriod(LocalDateTime startDate, LocalDateTime endDate) {}

    public record UsageSummary(
            double totalCost,
            long totalTokens,
            long totalExecutions,
            long uniqueWorkspaces,
            long uniqueUsers,
            long uniqueResources
    ) {}

    public record DailyMetrics(
            double averageDailyCost,
            double averageDailyExecutions,
            double averageDailyTokens,
            LocalDate peakDay,
            LocalDate lowestDay,
            double costVolatility
    ) {}

    public record DailyUsagePoint(
            LocalDate date,
            double cost,
            long executions,
            long tokens,
            long uniqueUsers,
            Double resourceUtilization
    ) {}

    public record GrowthRates(double costGrowthRate, double usageGrowthRate, double userGrowthRate) {}

    public record Trends(List<DailyUsagePoint> costTrend, GrowthRates growthRates) {}

    public record BreakdownEntry(String key, double cost, long count, double percentage) {}

    public record Breakdowns(
            List<BreakdownEntry> byModel,
            List<BreakdownEntry> byWorkspace,
            List<BreakdownEntry> byTeam,
            List<BreakdownEntry> byResourceType,
            List<BreakdownEntry> byRegion
    ) {}

    public record EfficiencyMetrics(
            double costPerSuccessfulExecution,
            double resourceUtilizationRate,
            double idleResourceCost,
            int optimizationOpportunities
    ) {}
}
