package com.costtelemetry.store;

import com.costtelemetry.domain.model.*;
import com.costtelemetry.domain.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cost store backed by Spring Data JPA repositories.
 *
 * Simple sums and counts run as JPQL aggregates. Group-by-day and
 * group-by-hour shapes are folded in memory from the windowed rows, which
 * keeps date bucketing independent of the database dialect.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCostStore implements CostStore {

    private static final List<AlertStatus> EVALUABLE_ALERT_STATUSES =
            List.of(AlertStatus.ACTIVE, AlertStatus.TRIGGERED);

    private final CostRecordRepository costRecordRepository;
    private final ModelUsageRecordRepository usageRepository;
    private final OperationalCostRecordRepository operationalRepository;
    private final BudgetRepository budgetRepository;
    private final BudgetAlertRepository alertRepository;
    private final CostAnomalyRepository anomalyRepository;
    private final CostPredictionRepository predictionRepository;
    private final OptimizationRecommendationRepository recommendationRepository;

    @Override
    @Transactional(readOnly = true)
    public double sumSpend(SpendQuery query) {
        BigDecimal total;
        if (query.resourceType() != null) {
            total = costRecordRepository.sumCostByResourceType(query.resourceType(), query.from(), query.to());
        } else {
            total = usageRepository.sumCost(query.from(), query.to(),
                    query.workspaceId(), query.teamId(), query.userId());
        }
        return toDouble(total);
    }

    @Override
    @Transactional(readOnly = true)
    public long countActiveResources(LocalDateTime at) {
        return costRecordRepository.countActiveResources(at);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CostBreakdownEntry> costBreakdown(BreakdownDimension dimension, LocalDateTime from, LocalDateTime to) {
        Function<CostRecord, String> classifier = switch (dimension) {
            case SERVICE -> r -> r.getResourceType().key();
            case REGION -> CostRecord::getRegion;
            case TEAM -> CostRecord::getTeamId;
        };

        Map<String, Double> totals = new HashMap<>();
        for (CostRecord record : costRecordRepository.findStartedBetween(from, to, null, null)) {
            String key = classifier.apply(record);
            if (key == null) {
                continue;
            }
            totals.merge(key, toDouble(record.getCostUsd()), Double::sum);
        }

        return totals.entrySet().stream()
                .map(e -> new CostBreakdownEntry(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingDouble(CostBreakdownEntry::cost).reversed())
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countOpenAnomaliesSince(LocalDateTime since) {
        return anomalyRepository.countByStatusAndDetectedAtGreaterThanEqual(AnomalyStatus.OPEN, since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Budget> findActiveBudgets(LocalDateTime at) {
        return budgetRepository.findCovering(BudgetStatus.ACTIVE, at);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GroupDailyCost> dailyCostByResourceGroup(LocalDateTime from, LocalDateTime to) {
        record GroupDay(ResourceType type, String region, LocalDate date) {}

        Map<GroupDay, Double> totals = new HashMap<>();
        for (CostRecord record : costRecordRepository.findStartedBetween(from, to, null, null)) {
            var key = new GroupDay(record.getResourceType(), record.getRegion(),
                    record.getBillingPeriodStart().toLocalDate());
            totals.merge(key, toDouble(record.getCostUsd()), Double::sum);
        }

        return totals.entrySet().stream()
                .map(e -> new GroupDailyCost(e.getKey().type(), e.getKey().region(), e.getKey().date(), e.getValue()))
                .sorted(Comparator.comparing(GroupDailyCost::resourceType)
                        .thenComparing(GroupDailyCost::region)
                        .thenComparing(GroupDailyCost::date))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CostAnomaly> findOpenAnomaly(ResourceType resourceType, String resourceId) {
        return anomalyRepository.findFirstByResourceTypeAndResourceIdAndStatusOrderByDetectedAtDesc(
                resourceType, resourceId, AnomalyStatus.OPEN);
    }

    @Override
    @Transactional
    public CostAnomaly saveAnomaly(CostAnomaly anomaly) {
        return anomalyRepository.save(anomaly);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BudgetAlert> findEvaluableAlerts() {
        return alertRepository.findEvaluable(BudgetStatus.ACTIVE, EVALUABLE_ALERT_STATUSES);
    }

    @Override
    @Transactional
    public BudgetAlert saveAlert(BudgetAlert alert) {
        return alertRepository.save(alert);
    }

    @Override
    @Transactional
    public Budget saveBudget(Budget budget) {
        return budgetRepository.save(budget);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DailyCost> dailySpend(LocalDateTime from, LocalDateTime to) {
        Map<LocalDate, Double> totals = new TreeMap<>();
        for (ModelUsageRecord record : usageRepository.findCharges(from, to, null, null)) {
            totals.merge(record.getCreatedAt().toLocalDate(), toDouble(record.getCostUsd()), Double::sum);
        }
        return totals.entrySet().stream()
                .map(e -> new DailyCost(e.getKey(), e.getValue()))
                .toList();
    }

    @Override
    @Transactional
    public CostPrediction savePrediction(CostPrediction prediction) {
        return predictionRepository.save(prediction);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ResourceUtilization> resourceUtilization(LocalDateTime since, ScopeFilter scope) {
        record ResourceKey(ResourceType type, String resourceId) {}

        Map<ResourceKey, List<CostRecord>> byResource = costRecordRepository
                .findBillingSince(since, scope.workspaceId(), scope.teamId())
                .stream()
                .collect(Collectors.groupingBy(r -> new ResourceKey(r.getResourceType(), r.getResourceId()),
                        LinkedHashMap::new, Collectors.toList()));

        List<ResourceUtilization> result = new ArrayList<>();
        byResource.forEach((key, records) -> {
            var usages = records.stream()
                    .map(CostRecord::getUsageAmount)
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .toArray();
            if (usages.length == 0) {
                log.debug("Resource {} has no usage measurements, skipping", key.resourceId());
                return;
            }
            double totalCost = records.stream().mapToDouble(r -> toDouble(r.getCostUsd())).sum();
            result.add(new ResourceUtilization(key.type(), key.resourceId(),
                    Arrays.stream(usages).average().orElse(0.0), totalCost, records.size()));
        });
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public List<HourlyCost> hourlyOperationalCost(LocalDateTime since, ScopeFilter scope) {
        Map<Integer, List<Double>> byHour = new TreeMap<>();
        for (OperationalCostRecord record : operationalRepository.findSince(since, scope.workspaceId(), scope.teamId())) {
            byHour.computeIfAbsent(record.getCreatedAt().getHour(), h -> new ArrayList<>())
                    .add(toDouble(record.getCostUsd()));
        }
        return byHour.entrySet().stream()
                .map(e -> new HourlyCost(e.getKey(),
                        e.getValue().stream().mapToDouble(Double::doubleValue).average().orElse(0.0),
                        e.getValue().size()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ModelUsageStats> modelUsageStats(LocalDateTime from, LocalDateTime to, ScopeFilter scope) {
        Map<String, List<ModelUsageRecord>> byModel = usageRepository
                .findCharges(from, to, scope.workspaceId(), scope.teamId())
                .stream()
                .collect(Collectors.groupingBy(ModelUsageRecord::getModel));

        return byModel.entrySet().stream()
                .map(e -> {
                    var records = e.getValue();
                    double total = records.stream().mapToDouble(r -> toDouble(r.getCostUsd())).sum();
                    long successes = records.stream().filter(ModelUsageRecord::isSuccess).count();
                    return new ModelUsageStats(e.getKey(), records.size(), total / records.size(), total,
                            (double) successes / records.size());
                })
                .sorted(Comparator.comparingDouble(ModelUsageStats::averageCost).reversed())
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OptimizationRecommendation> findRecommendation(String id) {
        return recommendationRepository.findById(id);
    }

    @Override
    @Transactional
    public OptimizationRecommendation saveRecommendation(OptimizationRecommendation recommendation) {
        return recommendationRepository.save(recommendation);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UsageCharge> usageCharges(LocalDateTime from, LocalDateTime to, ScopeFilter scope) {
        return usageRepository.findCharges(from, to, scope.workspaceId(), scope.teamId()).stream()
                .map(r -> new UsageCharge(
                        r.getCreatedAt(),
                        r.getModel(),
                        toDouble(r.getCostUsd()),
                        r.getTotalTokens() != null ? r.getTotalTokens() : 0L,
                        r.getExecutionTimeMs() != null ? r.getExecutionTimeMs() : 0L,
                        r.isSuccess(),
                        r.getUserId(),
                        r.getWorkspaceId(),
                        r.getTeamId()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<InfrastructureCharge> infrastructureCharges(LocalDateTime from, LocalDateTime to, ScopeFilter scope) {
        return costRecordRepository.findStartedBetween(from, to, scope.workspaceId(), scope.teamId()).stream()
                .map(r -> new InfrastructureCharge(
                        r.getBillingPeriodStart(),
                        r.getResourceId(),
                        r.getResourceType(),
                        r.getRegion(),
                        toDouble(r.getCostUsd()),
                        r.getUsageAmount(),
                        r.getWorkspaceId(),
                        r.getTeamId()))
                .toList();
    }

    private static double toDouble(BigDecimal value) {
        return value != null ? value.doubleValue() : 0.0;
    }
}
