package com.costtelemetry.budget;

import com.costtelemetry.domain.model.Budget;
import com.costtelemetry.store.CostStore;
import com.costtelemetry.store.CostStore.SpendQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Measures spend against budgets.
 *
 * Spend is the sum of charges inside the budget's [start, end) window and
 * scope. Utilization is only defined for positive amounts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BudgetSpendCalculator {

    private final CostStore costStore;

    public double currentSpend(Budget budget) {
        return costStore.sumSpend(SpendQuery.forBudget(budget));
    }

    /**
     * Utilization percentage per active budget name, for budgets whose window contains {@code now}.
     * Budgets with a non-positive amount are left out.
     */
    public Map<String, Double> utilization(LocalDateTime now) {
        Map<String, Double> utilization = new LinkedHashMap<>();
        for (Budget budget : costStore.findActiveBudgets(now)) {
            double amount = budget.getAmount() != null ? budget.getAmount().doubleValue() : 0.0;
            if (amount <= 0) {
                log.warn("Budget {} has non-positive amount {}, utilization undefined", budget.getName(), amount);
                continue;
            }
            utilization.put(budget.getName(), currentSpend(budget) / amount * 100);
        }
        return utilization;
    }

    /**
     * Linear projection of spend to the end of the window, from the share of the window elapsed.
     */
    public double projectedSpend(Budget budget, double currentSpend, LocalDateTime now) {
        long total = Duration.between(budget.getStartDate(), budget.getEndDate()).toSeconds();
        long elapsed = Duration.between(budget.getStartDate(), now).toSeconds();
        if (total <= 0 || elapsed <= 0 || elapsed >= total) {
            return currentSpend;
        }
        return currentSpend * total / elapsed;
    }
}
