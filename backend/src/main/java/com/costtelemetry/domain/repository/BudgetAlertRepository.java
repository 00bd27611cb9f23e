package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.AlertStatus;
import com.costtelemetry.domain.model.BudgetAlert;
import com.costtelemetry.domain.model.BudgetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface BudgetAlertRepository extends JpaRepository<BudgetAlert, Long> {

    /**
     * Alerts in one of {@code statuses} whose budget has {@code budgetStatus}, with the budget loaded.
     */
    @Query("SELECT a FROM BudgetAlert a JOIN FETCH a.budget b " +
           "WHERE b.status = :budgetStatus AND a.status IN :statuses ORDER BY a.id ASC")
    List<BudgetAlert> findEvaluable(
            @Param("budgetStatus") BudgetStatus budgetStatus,
            @Param("statuses") Collection<AlertStatus> statuses
    );

    List<BudgetAlert> findByBudgetIdOrderByIdAsc(Long budgetId);

    List<BudgetAlert> findByStatusAndSnoozeUntilLessThanEqual(AlertStatus status, LocalDateTime at);
}
