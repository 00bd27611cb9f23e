package com.costtelemetry.recommendation;

import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.*;
import com.costtelemetry.ml.CostStatistics;
import com.costtelemetry.store.CostStore;
import com.costtelemetry.store.CostStore.HourlyCost;
import com.costtelemetry.store.CostStore.ModelUsageStats;
import com.costtelemetry.store.CostStore.ResourceUtilization;
import com.costtelemetry.store.CostStore.ScopeFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Supplier;

/**
 * Synthesizes cost optimization recommendations from the cost ledgers.
 *
 * ANALYSES (independent, each fault-isolated):
 * 1. Utilization: resources averaging under 50% usage for 7 days -> rightsizing,
 *    savings = 40% of their cost, HIGH priority above $100
 * 2. Scheduling: 8+ hours-of-day whose average operational cost is under 30%
 *    of the hourly mean -> scheduled scaling, savings = 25% of a month at the mean
 * 3. Model efficiency: most expensive model vs most efficient model
 *    (success rate / avg cost) -> migration when the expensive one is less reliable
 *
 * RANKING:
 * The combined list is ordered by estimated savings, largest first.
 *
 * PERSISTENCE:
 * Ids are deterministic per finding and scope. Regeneration replaces the
 * analysis fields and keeps the reviewer-owned status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimizationAdvisor {

    private static final double RIGHTSIZING_CONFIDENCE = 85.0;
    private static final double SCHEDULING_CONFIDENCE = 75.0;
    private static final double MODEL_CONFIDENCE = 80.0;
    private static final int HOURS_PER_DAY = 24;
    private static final int DAYS_PER_MONTH = 30;

    private final CostStore costStore;
    private final CostTelemetryProperties properties;
    private final Clock clock;

    /**
     * Run all analyses for an optional workspace/team scope and persist the results.
     */
    public List<OptimizationRecommendation> generateRecommendations(ScopeFilter scope) {
        ScopeFilter effectiveScope = scope != null ? scope : ScopeFilter.none();
        LocalDateTime now = LocalDateTime.now(clock);
        log.info("Generating optimization recommendations for scope {}", effectiveScope.key());

        List<OptimizationRecommendation> recommendations = new ArrayList<>();
        recommendations.addAll(runAnalysis("utilization", () -> analyzeUtilization(effectiveScope, now)));
        recommendations.addAll(runAnalysis("scheduling", () -> analyzeScheduling(effectiveScope, now)));
        recommendations.addAll(runAnalysis("model efficiency", () -> analyzeModelEfficiency(effectiveScope, now)));

        recommendations.sort(Comparator.comparingDouble(OptimizationRecommendation::getEstimatedSavings).reversed());

        List<OptimizationRecommendation> persisted = new ArrayList<>(recommendations.size());
        for (var recommendation : recommendations) {
            persisted.add(persist(recommendation, now));
        }

        log.info("Generated {} recommendations with ${} total estimated savings",
                persisted.size(),
                String.format("%.2f", persisted.stream().mapToDouble(OptimizationRecommendation::getEstimatedSavings).sum()));
        return persisted;
    }

    List<OptimizationRecommendation> analyzeUtilization(ScopeFilter scope, LocalDateTime now) {
        var settings = properties.getOptimization();
        var resources = costStore.resourceUtilization(now.minusDays(settings.getUtilizationLookbackDays()), scope);

        List<OptimizationRecommendation> result = new ArrayList<>();
        for (ResourceUtilization resource : resources) {
            if (resource.averageUsage() >= settings.getUnderutilizationThreshold()) {
                continue;
            }
            double savings = resource.totalCost() * settings.getRightsizingSavingsRatio();
            ImpactLevel level = resource.totalCost() > settings.getHighPriorityCostThreshold()
                    ? ImpactLevel.HIGH
                    : ImpactLevel.MEDIUM;
            String usagePct = String.format("%.1f", resource.averageUsage() * 100);

            result.add(base(RecommendationType.RESOURCE_RIGHTSIZING, "rightsizing-" + resource.resourceId() + "-" + scope.key(), scope, now)
                    .title("Rightsize underutilized " + resource.resourceType().key() + " resource")
                    .description("Resource " + resource.resourceId() + " averaged " + usagePct
                            + "% utilization over the last " + settings.getUtilizationLookbackDays() + " days")
                    .detailedAnalysis("Average usage " + usagePct + "% across " + resource.recordCount()
                            + " billing records with $" + String.format("%.2f", resource.totalCost())
                            + " total cost. A smaller size covers the observed demand.")
                    .estimatedSavings(savings)
                    .estimatedSavingsPercentage(settings.getRightsizingSavingsRatio() * 100)
                    .confidenceScore(RIGHTSIZING_CONFIDENCE)
                    .priority(level)
                    .impact(level)
                    .effort(ImpactLevel.LOW)
                    .actionRequired("Resize resource to a smaller instance type")
                    .implementationSteps(List.of(
                            "Analyze usage patterns over the past 30 days",
                            "Identify peak usage requirements",
                            "Select appropriate smaller instance size",
                            "Schedule downtime for resizing",
                            "Monitor performance after changes"))
                    .affectedResources(List.of(resource.resourceId()))
                    .riskAssessment("Low risk: usage stays well below current capacity")
                    .businessImpact("Reduces " + resource.resourceType().key() + " spend without affecting demand")
                    .timelineDays(3)
                    .autoImplementable(false)
                    .metadata(Map.of(
                            "resourceType", resource.resourceType().key(),
                            "averageUsage", resource.averageUsage(),
                            "totalCost", resource.totalCost()))
                    .build());
        }
        log.debug("Utilization analysis: {} of {} resources underutilized", result.size(), resources.size());
        return result;
    }

    List<OptimizationRecommendation> analyzeScheduling(ScopeFilter scope, LocalDateTime now) {
        var settings = properties.getOptimization();
        List<HourlyCost> hourly = costStore.hourlyOperationalCost(
                now.minusDays(settings.getSchedulingLookbackDays()), scope);
        if (hourly.isEmpty()) {
            return List.of();
        }

        double avgHourlyCost = CostStatistics.mean(hourly.stream().mapToDouble(HourlyCost::averageCost).toArray());
        if (avgHourlyCost <= 0) {
            return List.of();
        }

        double lowCutoff = avgHourlyCost * settings.getLowUsageRatio();
        List<Integer> lowHours = hourly.stream()
                .filter(h -> h.averageCost() < lowCutoff)
                .map(HourlyCost::hour)
                .toList();
        log.debug("Scheduling analysis: {} low-usage hours (cutoff ${}/h)", lowHours.size(),
                String.format("%.4f", lowCutoff));

        if (lowHours.size() < settings.getMinimumLowUsageHours()) {
            return List.of();
        }

        double savings = avgHourlyCost * HOURS_PER_DAY * DAYS_PER_MONTH * settings.getSchedulingSavingsRatio();
        return List.of(base(RecommendationType.SCHEDULE_OPTIMIZATION, "schedule-optimization-" + scope.key(), scope, now)
                .title("Implement scheduled scaling")
                .description(lowHours.size() + " hours per day show consistently low usage")
                .detailedAnalysis("Low-usage hours (UTC): " + lowHours + ". Average hourly cost $"
                        + String.format("%.2f", avgHourlyCost) + ".")
                .estimatedSavings(savings)
                .estimatedSavingsPercentage(settings.getSchedulingSavingsRatio() * 100)
                .confidenceScore(SCHEDULING_CONFIDENCE)
                .priority(ImpactLevel.MEDIUM)
                .impact(ImpactLevel.MEDIUM)
                .effort(ImpactLevel.MEDIUM)
                .actionRequired("Scale down resources during low-usage hours")
                .implementationSteps(List.of(
                        "Identify resources that can be scaled down",
                        "Configure scaling schedules for low-usage hours",
                        "Test the scaling policies in a non-production environment",
                        "Roll out schedules and monitor latency during transitions"))
                .affectedResources(List.of("all-compute-resources"))
                .riskAssessment("Medium risk: demand outside the usual pattern may see cold starts")
                .businessImpact("Cuts idle capacity cost during predictable off-peak hours")
                .timelineDays(14)
                .autoImplementable(true)
                .metadata(Map.of(
                        "lowUsageHours", lowHours,
                        "averageHourlyCost", avgHourlyCost))
                .build());
    }

    List<OptimizationRecommendation> analyzeModelEfficiency(ScopeFilter scope, LocalDateTime now) {
        var settings = properties.getOptimization();
        List<ModelUsageStats> models = costStore.modelUsageStats(
                        now.minusDays(settings.getModelLookbackDays()), now, scope).stream()
                .filter(m -> m.usageCount() > settings.getMinimumModelExecutions())
                .filter(m -> m.averageCost() > 0)
                .sorted(Comparator.comparingDouble(ModelUsageStats::averageCost).reversed())
                .toList();
        if (models.size() < 2) {
            return List.of();
        }

        ModelUsageStats mostExpensive = models.get(0);
        ModelUsageStats mostEfficient = models.stream()
                .max(Comparator.comparingDouble(m -> m.successRate() / m.averageCost()))
                .orElseThrow();

        if (mostExpensive.model().equals(mostEfficient.model())
                || mostExpensive.successRate() >= mostEfficient.successRate() * settings.getSuccessRateTolerance()) {
            return List.of();
        }

        double costDiff = mostExpensive.averageCost() - mostEfficient.averageCost();
        double savings = costDiff * mostExpensive.usageCount();
        if (savings <= 0) {
            return List.of();
        }

        String id = "model-optimization-" + mostExpensive.model() + "-to-" + mostEfficient.model() + "-" + scope.key();
        return List.of(base(RecommendationType.MODEL_SUGGESTION, id, scope, now)
                .title("Optimize model selection")
                .description("Consider switching from " + mostExpensive.model() + " to " + mostEfficient.model()
                        + " for better cost efficiency")
                .detailedAnalysis(mostExpensive.model() + ": $" + String.format("%.4f", mostExpensive.averageCost())
                        + " per execution at " + String.format("%.1f", mostExpensive.successRate() * 100)
                        + "% success. " + mostEfficient.model() + ": $"
                        + String.format("%.4f", mostEfficient.averageCost()) + " per execution at "
                        + String.format("%.1f", mostEfficient.successRate() * 100) + "% success.")
                .estimatedSavings(savings)
                .estimatedSavingsPercentage(costDiff / mostExpensive.averageCost() * 100)
                .confidenceScore(MODEL_CONFIDENCE)
                .priority(savings > settings.getHighPriorityModelSavings() ? ImpactLevel.HIGH : ImpactLevel.MEDIUM)
                .impact(ImpactLevel.HIGH)
                .effort(ImpactLevel.LOW)
                .actionRequired("Migrate workloads to the more efficient model")
                .implementationSteps(List.of(
                        "Compare output quality of both models on representative prompts",
                        "Route a small share of traffic to " + mostEfficient.model(),
                        "Monitor success rate and cost for one week",
                        "Complete the migration once quality is confirmed"))
                .affectedResources(List.of("model-" + mostExpensive.model()))
                .riskAssessment("Low risk: the target model has the higher success rate")
                .businessImpact("Lower cost per successful execution")
                .timelineDays(7)
                .autoImplementable(false)
                .metadata(Map.of(
                        "currentModel", mostExpensive.model(),
                        "suggestedModel", mostEfficient.model(),
                        "currentUsageCount", mostExpensive.usageCount()))
                .build());
    }

    private OptimizationRecommendation.OptimizationRecommendationBuilder base(
            RecommendationType type, String id, ScopeFilter scope, LocalDateTime now) {
        return OptimizationRecommendation.builder()
                .id(id)
                .type(type)
                .category(type.getCategory())
                .status(RecommendationStatus.PENDING)
                .workspaceId(scope.workspaceId())
                .teamId(scope.teamId())
                .createdAt(now)
                .updatedAt(now);
    }

    private OptimizationRecommendation persist(OptimizationRecommendation recommendation, LocalDateTime now) {
        try {
            costStore.findRecommendation(recommendation.getId()).ifPresent(existing -> {
                recommendation.setStatus(existing.getStatus());
                recommendation.setCreatedAt(existing.getCreatedAt());
            });
            recommendation.setUpdatedAt(now);
            return costStore.saveRecommendation(recommendation);
        } catch (Exception e) {
            log.error("Failed to persist recommendation {}: {}", recommendation.getId(), e.getMessage());
            return recommendation;
        }
    }

    private List<OptimizationRecommendation> runAnalysis(String name, Supplier<List<OptimizationRecommendation>> analysis) {
        try {
            return analysis.get();
        } catch (Exception e) {
            log.error("Optimization analysis '{}' failed: {}", name, e.getMessage());
            return List.of();
        }
    }
}
