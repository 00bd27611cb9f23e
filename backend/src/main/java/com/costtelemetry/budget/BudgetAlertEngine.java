package com.costtelemetry.budget;

import com.costtelemetry.domain.model.AlertStatus;
import com.costtelemetry.domain.model.AlertType;
import com.costtelemetry.domain.model.BudgetAlert;
import com.costtelemetry.notification.BudgetAlertNotifier;
import com.costtelemetry.store.CostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Evaluates budget alerts against current spend and drives their state machine.
 *
 * DECISION FLOW (per alert):
 * 1. Skip budgets with a non-positive amount (utilization undefined)
 * 2. currentAmount = spend in the budget window and scope
 * 3. percentageUsed = currentAmount / amount * 100
 * 4. THRESHOLD alerts measure percentageUsed, FORECAST alerts the projected
 *    end-of-window percentage
 * 5. ACTIVE -> TRIGGERED at or above threshold: triggerCount + 1, lastTriggered, notify
 *    TRIGGERED -> RESOLVED below threshold
 *
 * CONCURRENCY:
 * Evaluation is read-then-write per alert. A single evaluator lock makes
 * concurrent {@link #checkAlerts()} calls run one after the other, so a
 * transition is never counted twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetAlertEngine {

    private final CostStore costStore;
    private final BudgetSpendCalculator spendCalculator;
    private final BudgetAlertNotifier notifier;
    private final Clock clock;

    private final ReentrantLock evaluationLock = new ReentrantLock();

    /**
     * Evaluate every alert of every active budget.
     *
     * @return alerts that transitioned into TRIGGERED during this pass
     */
    public List<BudgetAlert> checkAlerts() {
        evaluationLock.lock();
        try {
            var alerts = costStore.findEvaluableAlerts();
            log.debug("Evaluating {} budget alerts", alerts.size());

            List<BudgetAlert> triggered = new ArrayList<>();
            int resolved = 0;
            for (var alert : alerts) {
                try {
                    var outcome = evaluate(alert);
                    if (outcome == Transition.TRIGGERED) {
                        triggered.add(alert);
                    } else if (outcome == Transition.RESOLVED) {
                        resolved++;
                    }
                } catch (Exception e) {
                    log.error("Failed to evaluate budget alert {}: {}", alert.getId(), e.getMessage());
                }
            }

            log.info("Budget alert check complete: {} evaluated, {} triggered, {} resolved",
                    alerts.size(), triggered.size(), resolved);
            return triggered;
        } finally {
            evaluationLock.unlock();
        }
    }

    Transition evaluate(BudgetAlert alert) {
        var budget = alert.getBudget();
        double amount = budget.getAmount() != null ? budget.getAmount().doubleValue() : 0.0;
        if (amount <= 0) {
            log.warn("Skipping alert {}: budget {} has non-positive amount {}",
                    alert.getName(), budget.getName(), amount);
            return Transition.SKIPPED;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        double spend = spendCalculator.currentSpend(budget);
        double percentageUsed = spend / amount * 100;
        double projected = spendCalculator.projectedSpend(budget, spend, now);

        alert.setCurrentAmount(spend);
        alert.setPercentageUsed(percentageUsed);
        alert.setProjectedAmount(projected);
        alert.setUpdatedAt(now);

        Transition transition = Transition.NONE;
        if (alert.getAlertType().isTransitioning()) {
            double measured = alert.getAlertType() == AlertType.FORECAST
                    ? projected / amount * 100
                    : percentageUsed;
            boolean breached = measured >= alert.getThresholdPercentage();

            if (alert.getStatus() == AlertStatus.ACTIVE && breached) {
                alert.setStatus(AlertStatus.TRIGGERED);
                alert.setTriggerCount(alert.getTriggerCount() + 1);
                alert.setLastTriggered(now);
                transition = Transition.TRIGGERED;
            } else if (alert.getStatus() == AlertStatus.TRIGGERED && !breached) {
                alert.setStatus(AlertStatus.RESOLVED);
                transition = Transition.RESOLVED;
            }
        }

        costStore.saveAlert(alert);

        if (transition == Transition.TRIGGERED) {
            log.info("Alert '{}' triggered for budget '{}': {}% used (threshold {}%)",
                    alert.getName(), budget.getName(),
                    String.format("%.1f", percentageUsed), alert.getThresholdPercentage());
            notifySafely(alert);
        } else if (transition == Transition.RESOLVED) {
            log.info("Alert '{}' resolved for budget '{}'", alert.getName(), budget.getName());
        }
        return transition;
    }

    private void notifySafely(BudgetAlert alert) {
        var severity = alert.getSeverity() != null
                ? alert.getSeverity()
                : alert.getAlertType().getDefaultSeverity();
        try {
            notifier.notify(alert.getName(), alert.getPercentageUsed(), severity);
        } catch (Exception e) {
            log.error("Notification for alert '{}' failed, transition kept: {}", alert.getName(), e.getMessage());
        }
    }

    enum Transition {
        NONE,
        TRIGGERED,
        RESOLVED,
        SKIPPED
    }
}
