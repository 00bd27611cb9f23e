package com.costtelemetry.config;

import com.costtelemetry.domain.model.*;
import com.costtelemetry.domain.repository.CostRecordRepository;
import com.costtelemetry.domain.repository.ModelUsageRecordRepository;
import com.costtelemetry.domain.repository.OperationalCostRecordRepository;
import com.costtelemetry.service.BudgetService;
import com.costtelemetry.service.BudgetService.CreateBudgetRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Seeds a month of synthetic cost data for local exploration.
 *
 * Only runs with {@code cost-telemetry.demo-data.enabled=true} and only if
 * the infrastructure ledger is empty. The compute group in eastus spikes
 * over the last three days so the first monitoring pass reports an anomaly.
 */
@Component
@ConditionalOnProperty(prefix = "cost-telemetry.demo-data", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoDataLoader implements CommandLineRunner {

    private static final int DAYS = 30;
    private static final String[] MODELS = {"gpt-4o", "gpt-4o-mini", "claude-3-haiku"};
    private static final String[] WORKSPACES = {"ws-analytics", "ws-platform"};
    private static final String[] TEAMS = {"data", "infra"};

    private final CostRecordRepository costRecordRepository;
    private final ModelUsageRecordRepository modelUsageRepository;
    private final OperationalCostRecordRepository operationalRepository;
    private final BudgetService budgetService;
    private final Clock clock;

    @Override
    @Transactional
    public void run(String... args) {
        if (costRecordRepository.count() > 0) {
            log.info("Cost records already exist, skipping demo seed");
            return;
        }

        log.info("Seeding {} days of demo cost data...", DAYS);
        var random = new Random(42);
        LocalDate today = LocalDate.now(clock);

        seedInfrastructure(random, today);
        seedModelUsage(random, today);
        seedOperations(random, today);
        seedBudgets(today);

        log.info("Demo data seeded: {} infrastructure, {} usage, {} operational records",
                costRecordRepository.count(), modelUsageRepository.count(), operationalRepository.count());
    }

    private void seedInfrastructure(Random random, LocalDate today) {
        List<CostRecord> records = new ArrayList<>();
        for (int day = DAYS; day >= 1; day--) {
            LocalDateTime start = today.minusDays(day).atStartOfDay();
            boolean spike = day <= 3;

            records.add(infra("vm-api-01", ResourceType.COMPUTE, CloudProvider.AZURE, "eastus",
                    spike ? 140 + random.nextDouble() * 10 : 45 + random.nextDouble() * 5,
                    0.7 + random.nextDouble() * 0.2, start, WORKSPACES[0], TEAMS[1]));
            records.add(infra("vm-batch-02", ResourceType.COMPUTE, CloudProvider.AZURE, "westeurope",
                    30 + random.nextDouble() * 4, 0.2 + random.nextDouble() * 0.1, start, WORKSPACES[1], TEAMS[0]));
            records.add(infra("db-orders", ResourceType.DATABASE, CloudProvider.AWS, "us-east-1",
                    60 + random.nextDouble() * 6, 0.55 + random.nextDouble() * 0.2, start, WORKSPACES[0], TEAMS[0]));
            records.add(infra("bucket-logs", ResourceType.STORAGE, CloudProvider.GCP, "us-central1",
                    12 + random.nextDouble() * 2, null, start, WORKSPACES[1], null));
        }
        costRecordRepository.saveAll(records);
    }

    private CostRecord infra(String resourceId, ResourceType type, CloudProvider provider, String region,
                             double cost, Double usage, LocalDateTime start, String workspaceId, String teamId) {
        return CostRecord.builder()
                .resourceId(resourceId)
                .resourceType(type)
                .provider(provider)
                .resourceName(resourceId)
                .region(region)
                .costUsd(money(cost))
                .usageAmount(usage)
                .usageUnit(usage != null ? "ratio" : null)
                .billingPeriodStart(start)
                .billingPeriodEnd(start.plusDays(1))
                .workspaceId(workspaceId)
                .teamId(teamId)
                .tags(Map.of("env", "demo"))
                .build();
    }

    private void seedModelUsage(Random random, LocalDate today) {
        List<ModelUsageRecord> records = new ArrayList<>();
        for (int day = DAYS; day >= 0; day--) {
            for (int i = 0; i < 20; i++) {
                int modelIndex = random.nextInt(MODELS.length);
                // the most expensive model is also the least reliable
                double baseCost = switch (modelIndex) {
                    case 0 -> 0.40;
                    case 1 -> 0.03;
                    default -> 0.02;
                };
                boolean success = modelIndex == 0 ? random.nextDouble() > 0.2 : random.nextDouble() > 0.03;
                records.add(ModelUsageRecord.builder()
                        .executionId(UUID.randomUUID().toString())
                        .model(MODELS[modelIndex])
                        .costUsd(money(baseCost * (0.8 + random.nextDouble() * 0.4)))
                        .totalTokens(500L + random.nextInt(4000))
                        .executionTimeMs(200L + random.nextInt(3000))
                        .success(success)
                        .userId("user-" + random.nextInt(6))
                        .workspaceId(WORKSPACES[i % WORKSPACES.length])
                        .teamId(TEAMS[random.nextInt(TEAMS.length)])
                        .createdAt(today.minusDays(day).atTime(random.nextInt(24), random.nextInt(60)))
                        .build());
            }
        }
        modelUsageRepository.saveAll(records);
    }

    private void seedOperations(Random random, LocalDate today) {
        List<OperationalCostRecord> records = new ArrayList<>();
        for (int day = DAYS; day >= 1; day--) {
            for (int hour = 0; hour < 24; hour++) {
                boolean offHours = hour < 7 || hour >= 21;
                records.add(OperationalCostRecord.builder()
                        .operationType(OperationType.values()[hour % OperationType.values().length])
                        .operationName("demo-op-" + hour)
                        .costUsd(money(offHours ? 0.2 + random.nextDouble() * 0.1 : 2 + random.nextDouble()))
                        .durationMs(1000L + random.nextInt(5000))
                        .resourceConsumption(Map.of("cpu", random.nextDouble()))
                        .workspaceId(WORKSPACES[day % WORKSPACES.length])
                        .teamId(TEAMS[hour % TEAMS.length])
                        .success(true)
                        .createdAt(today.minusDays(day).atTime(hour, 15))
                        .build());
            }
        }
        operationalRepository.saveAll(records);
    }

    private void seedBudgets(LocalDate today) {
        LocalDateTime monthStart = today.withDayOfMonth(1).atStartOfDay();
        budgetService.createBudget(new CreateBudgetRequest(
                "Monthly model spend", "All usage charges", CostPeriod.MONTHLY, new BigDecimal("150.00"),
                "USD", BudgetScope.GLOBAL, null, null, monthStart, null,
                true, false, "demo", true, 80.0));
        budgetService.createBudget(new CreateBudgetRequest(
                "Analytics workspace", null, CostPeriod.WEEKLY, new BigDecimal("25.00"),
                "USD", BudgetScope.WORKSPACE, WORKSPACES[0], null, null, null,
                true, true, "demo", true, 90.0));
        budgetService.createBudget(new CreateBudgetRequest(
                "Compute infrastructure", null, CostPeriod.MONTHLY, new BigDecimal("2500.00"),
                "USD", BudgetScope.RESOURCE_TYPE, "compute", null, monthStart, null,
                false, false, "demo", true, null));
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }
}
