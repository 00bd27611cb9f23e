package com.costtelemetry.service;

import com.costtelemetry.budget.BudgetSpendCalculator;
import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.*;
import com.costtelemetry.domain.repository.BudgetAlertRepository;
import com.costtelemetry.domain.repository.BudgetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Service for budget administration.
 *
 * Creates budgets, attaches alerts and handles the user-driven parts of the
 * alert lifecycle (snoozing). Evaluation itself belongs to the alert engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private static final String DEFAULT_CURRENCY = "USD";

    private final BudgetRepository budgetRepository;
    private final BudgetAlertRepository alertRepository;
    private final BudgetSpendCalculator spendCalculator;
    private final CostTelemetryProperties properties;
    private final Clock clock;

    /**
     * Validate and persist a new ACTIVE budget.
     *
     * @throws IllegalArgumentException if the amount is not positive, the
     *         window is empty, or a scoped budget has no usable scope id
     */
    @Transactional
    public Budget createBudget(CreateBudgetRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        validate(request);

        BudgetScope scope = request.scope() != null ? request.scope() : BudgetScope.GLOBAL;
        LocalDateTime start = request.startDate() != null ? request.startDate() : now;
        LocalDateTime end = request.endDate() != null ? request.endDate() : request.period().advance(start);
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Budget end date must be after its start date");
        }

        var budget = Budget.builder()
                .name(request.name().trim())
                .description(request.description())
                .period(request.period())
                .amount(request.amount())
                .currency(request.currency() != null ? request.currency().toUpperCase(Locale.ROOT) : DEFAULT_CURRENCY)
                .scope(scope)
                .scopeId(scope.requiresScopeId() ? request.scopeId().trim() : null)
                .resourceFilters(request.resourceFilters())
                .startDate(start)
                .endDate(end)
                .autoReset(request.autoReset())
                .rolloverUnused(request.rolloverUnused())
                .status(BudgetStatus.ACTIVE)
                .createdBy(request.createdBy())
                .createdAt(now)
                .updatedAt(now)
                .build();

        var saved = budgetRepository.save(budget);
        log.info("Created {} budget '{}' of {} {} for scope {}{}",
                saved.getPeriod().key(), saved.getName(), saved.getAmount(), saved.getCurrency(),
                saved.getScope(), saved.getScopeId() != null ? " " + saved.getScopeId() : "");

        if (request.attachDefaultAlert()) {
            double threshold = request.alertThresholdPercentage() != null
                    ? request.alertThresholdPercentage()
                    : properties.getBudgets().getDefaultAlertThreshold();
            alertRepository.save(BudgetAlert.builder()
                    .budget(saved)
                    .name(saved.getName() + " " + formatThreshold(threshold) + "% threshold")
                    .alertType(AlertType.THRESHOLD)
                    .thresholdPercentage(threshold)
                    .severity(AlertType.THRESHOLD.getDefaultSeverity())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            log.debug("Attached default threshold alert at {}% to budget {}", threshold, saved.getId());
        }

        return saved;
    }

    /**
     * Budgets matching the optional filters with their current spend and alerts.
     */
    @Transactional(readOnly = true)
    public List<BudgetSummary> listBudgets(BudgetStatus status, BudgetScope scope, String scopeId) {
        return budgetRepository.search(status, scope, scopeId).stream()
                .map(this::summarize)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<BudgetSummary> findBudget(Long budgetId) {
        return budgetRepository.findById(budgetId).map(this::summarize);
    }

    /**
     * Attach an alert to a budget.
     *
     * @return the new alert, or empty if the budget does not exist or is deleted
     */
    @Transactional
    public Optional<BudgetAlert> addAlert(Long budgetId, AddAlertRequest request) {
        if (request.thresholdPercentage() <= 0) {
            throw new IllegalArgumentException("Alert threshold must be positive");
        }
        var budget = budgetRepository.findById(budgetId);
        if (budget.isEmpty() || budget.get().getStatus() == BudgetStatus.DELETED) {
            log.warn("Cannot add alert: budget {} not found or deleted", budgetId);
            return Optional.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        var alert = BudgetAlert.builder()
                .budget(budget.get())
                .name(request.name())
                .alertType(request.alertType())
                .thresholdPercentage(request.thresholdPercentage())
                .forecastDays(request.forecastDays())
                .severity(request.severity() != null ? request.severity() : request.alertType().getDefaultSeverity())
                .notificationChannels(request.notificationChannels())
                .createdAt(now)
                .updatedAt(now)
                .build();

        var saved = alertRepository.save(alert);
        log.info("Added {} alert '{}' at {}% to budget {}",
                saved.getAlertType(), saved.getName(), saved.getThresholdPercentage(), budgetId);
        return Optional.of(saved);
    }

    /**
     * Silence an alert until {@code until}. Re-snoozing extends the deadline.
     */
    @Transactional
    public Optional<BudgetAlert> snoozeAlert(Long alertId, LocalDateTime until) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (until == null || !until.isAfter(now)) {
            throw new IllegalArgumentException("Snooze deadline must be in the future");
        }
        var found = alertRepository.findById(alertId);
        if (found.isEmpty()) {
            log.warn("Alert {} not found", alertId);
            return Optional.empty();
        }

        var alert = found.get();
        alert.setStatus(AlertStatus.SNOOZED);
        alert.setSnoozeUntil(until);
        alert.setUpdatedAt(now);
        log.info("Alert {} snoozed until {}", alertId, until);
        return Optional.of(alertRepository.save(alert));
    }

    /**
     * Return a snoozed alert to ACTIVE so the next evaluation picks it up.
     */
    @Transactional
    public Optional<BudgetAlert> unsnoozeAlert(Long alertId) {
        var found = alertRepository.findById(alertId);
        if (found.isEmpty()) {
            log.warn("Alert {} not found", alertId);
            return Optional.empty();
        }

        var alert = found.get();
        if (alert.getStatus() != AlertStatus.SNOOZED) {
            log.warn("Cannot unsnooze alert {} with status {}", alertId, alert.getStatus());
            return Optional.empty();
        }

        alert.setStatus(AlertStatus.ACTIVE);
        alert.setSnoozeUntil(null);
        alert.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Alert {} unsnoozed", alertId);
        return Optional.of(alertRepository.save(alert));
    }

    /**
     * Move a budget between ACTIVE, PAUSED and DELETED.
     *
     * EXPIRED is reserved for the rollover job, and deleted or expired budgets
     * cannot be reactivated.
     *
     * @return the updated budget, or empty if it is missing or the transition is invalid
     */
    @Transactional
    public Optional<Budget> updateStatus(Long budgetId, BudgetStatus target) {
        if (target == BudgetStatus.EXPIRED) {
            throw new IllegalArgumentException("Budgets expire through rollover only");
        }
        var found = budgetRepository.findById(budgetId);
        if (found.isEmpty()) {
            log.warn("Budget {} not found", budgetId);
            return Optional.empty();
        }

        var budget = found.get();
        var current = budget.getStatus();
        boolean allowed = switch (current) {
            case ACTIVE -> target == BudgetStatus.PAUSED || target == BudgetStatus.DELETED;
            case PAUSED -> target == BudgetStatus.ACTIVE || target == BudgetStatus.DELETED;
            case EXPIRED -> target == BudgetStatus.DELETED;
            case DELETED -> false;
        };
        if (!allowed) {
            log.warn("Cannot move budget {} from {} to {}", budgetId, current, target);
            return Optional.empty();
        }

        budget.setStatus(target);
        budget.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Budget {} moved from {} to {}", budgetId, current, target);
        return Optional.of(budgetRepository.save(budget));
    }

    private BudgetSummary summarize(Budget budget) {
        double spend;
        try {
            spend = spendCalculator.currentSpend(budget);
        } catch (Exception e) {
            log.error("Failed to compute spend for budget {}: {}", budget.getId(), e.getMessage());
            spend = 0.0;
        }
        double amount = budget.getAmount().doubleValue();
        Double utilization = amount > 0 ? spend / amount * 100 : null;
        return new BudgetSummary(budget, spend, utilization, alertRepository.findByBudgetIdOrderByIdAsc(budget.getId()));
    }

    private void validate(CreateBudgetRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Budget name is required");
        }
        if (request.period() == null) {
            throw new IllegalArgumentException("Budget period is required");
        }
        if (request.amount() == null || request.amount().signum() <= 0) {
            throw new IllegalArgumentException("Budget amount must be positive");
        }
        BudgetScope scope = request.scope() != null ? request.scope() : BudgetScope.GLOBAL;
        if (scope.requiresScopeId() && (request.scopeId() == null || request.scopeId().isBlank())) {
            throw new IllegalArgumentException("Scope " + scope + " requires a scope id");
        }
        if (scope == BudgetScope.RESOURCE_TYPE) {
            try {
                ResourceType.valueOf(request.scopeId().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown resource type: " + request.scopeId());
            }
        }
        if (request.alertThresholdPercentage() != null && request.alertThresholdPercentage() <= 0) {
            throw new IllegalArgumentException("Alert threshold must be positive");
        }
    }

    private static String formatThreshold(double threshold) {
        return threshold == Math.rint(threshold) ? String.valueOf((long) threshold) : String.valueOf(threshold);
    }

    /**
     * Input for {@link #createBudget}. Scope defaults to GLOBAL, start to now,
     * end to start plus one period, currency to USD.
     */
    public record CreateBudgetRequest(
            String name,
            String description,
            CostPeriod period,
            BigDecimal amount,
            String currency,
            BudgetScope scope,
            String scopeId,
            Map<String, String> resourceFilters,
            LocalDateTime startDate,
            LocalDateTime endDate,
            boolean autoReset,
            boolean rolloverUnused,
            String createdBy,
            boolean attachDefaultAlert,
            Double alertThresholdPercentage
    ) {}

    public record AddAlertRequest(
            String name,
            AlertType alertType,
            double thresholdPercentage,
            Integer forecastDays,
            AlertSeverity severity,
            List<String> notificationChannels
    ) {}

    /**
     * Budget with spend in its current window. Utilization is null for a
     * non-positive amount.
     */
    public record BudgetSummary(
            Budget budget,
            double currentSpend,
            Double utilizationPercentage,
            List<BudgetAlert> alerts
    ) {}
}
