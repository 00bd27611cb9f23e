package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.Budget;
import com.costtelemetry.domain.model.BudgetScope;
import com.costtelemetry.domain.model.BudgetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, Long> {

    /**
     * Budgets with the given status whose window contains {@code at}.
     */
    @Query("SELECT b FROM Budget b WHERE b.status = :status " +
           "AND b.startDate <= :at AND b.endDate > :at ORDER BY b.name ASC")
    List<Budget> findCovering(@Param("status") BudgetStatus status, @Param("at") LocalDateTime at);

    /**
     * Budgets whose window ended at or before {@code at}.
     */
    List<Budget> findByStatusAndEndDateLessThanEqual(BudgetStatus status, LocalDateTime at);

    @Query("SELECT b FROM Budget b WHERE (:status IS NULL OR b.status = :status) " +
           "AND (:scope IS NULL OR b.scope = :scope) " +
           "AND (:scopeId IS NULL OR b.scopeId = :scopeId) " +
           "ORDER BY b.createdAt DESC")
    List<Budget> search(
            @Param("status") BudgetStatus status,
            @Param("scope") BudgetScope scope,
            @Param("scopeId") String scopeId
    );
}
