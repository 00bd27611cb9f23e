package com.costtelemetry.scheduler;

import com.costtelemetry.budget.BudgetSpendCalculator;
import com.costtelemetry.domain.model.AlertStatus;
import com.costtelemetry.domain.model.Budget;
import com.costtelemetry.domain.model.BudgetStatus;
import com.costtelemetry.domain.repository.BudgetAlertRepository;
import com.costtelemetry.domain.repository.BudgetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Scheduled job that closes elapsed budget windows.
 *
 * Runs hourly. ACTIVE budgets whose window has ended either move to the
 * next period window (auto-reset) or become EXPIRED. With rollover-unused,
 * whatever was left of the ended window is added to the next one.
 *
 * The same schedule returns alerts whose snooze deadline has passed to ACTIVE.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BudgetRolloverJob {

    private final BudgetRepository budgetRepository;
    private final BudgetAlertRepository alertRepository;
    private final BudgetSpendCalculator spendCalculator;
    private final Clock clock;

    @Scheduled(cron = "${cost-telemetry.budgets.rollover-cron:0 5 * * * *}")
    @Transactional
    public void rollOverElapsedBudgets() {
        LocalDateTime now = LocalDateTime.now(clock);
        var elapsed = budgetRepository.findByStatusAndEndDateLessThanEqual(BudgetStatus.ACTIVE, now);
        if (elapsed.isEmpty()) {
            log.debug("No elapsed budgets to roll over");
            return;
        }

        int reset = 0;
        int expired = 0;
        for (var budget : elapsed) {
            try {
                if (budget.isAutoReset()) {
                    resetWindow(budget, now);
                    reset++;
                } else {
                    budget.setStatus(BudgetStatus.EXPIRED);
                    budget.setUpdatedAt(now);
                    budgetRepository.save(budget);
                    expired++;
                }
            } catch (Exception e) {
                log.error("Failed to roll over budget {}: {}", budget.getId(), e.getMessage());
            }
        }

        log.info("Budget rollover complete: {} reset, {} expired", reset, expired);
    }

    @Scheduled(cron = "${cost-telemetry.budgets.rollover-cron:0 5 * * * *}")
    @Transactional
    public void releaseExpiredSnoozes() {
        LocalDateTime now = LocalDateTime.now(clock);
        var expired = alertRepository.findByStatusAndSnoozeUntilLessThanEqual(AlertStatus.SNOOZED, now);
        for (var alert : expired) {
            alert.setStatus(AlertStatus.ACTIVE);
            alert.setSnoozeUntil(null);
            alert.setUpdatedAt(now);
            alertRepository.save(alert);
        }
        if (!expired.isEmpty()) {
            log.info("Released {} snoozed alerts", expired.size());
        }
    }

    private void resetWindow(Budget budget, LocalDateTime now) {
        if (budget.isRolloverUnused()) {
            double unused = budget.getAmount().doubleValue() - spendCalculator.currentSpend(budget);
            if (unused > 0) {
                budget.setAmount(budget.getAmount()
                        .add(BigDecimal.valueOf(unused))
                        .setScale(2, RoundingMode.HALF_UP));
                log.debug("Budget {} carries {} unused into the next window",
                        budget.getName(), String.format("%.2f", unused));
            }
        }

        // Several periods may have passed while the job was not running
        LocalDateTime start = budget.getEndDate();
        LocalDateTime end = budget.getPeriod().advance(start);
        while (!end.isAfter(now)) {
            start = end;
            end = budget.getPeriod().advance(start);
        }
        budget.setStartDate(start);
        budget.setEndDate(end);
        budget.setUpdatedAt(now);
        budgetRepository.save(budget);

        for (var alert : alertRepository.findByBudgetIdOrderByIdAsc(budget.getId())) {
            if (alert.getStatus() == AlertStatus.SNOOZED) {
                continue;
            }
            alert.setStatus(AlertStatus.ACTIVE);
            alert.setCurrentAmount(0.0);
            alert.setPercentageUsed(0.0);
            alert.setProjectedAmount(null);
            alert.setUpdatedAt(now);
            alertRepository.save(alert);
        }

        log.info("Budget '{}' reset to window {} - {}", budget.getName(), start, end);
    }
}
