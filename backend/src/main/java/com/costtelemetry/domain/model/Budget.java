package com.costtelemetry.domain.model;

import com.costtelemetry.domain.model.json.StringMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Spending limit over a time window and a scope.
 *
 * SCOPE:
 * GLOBAL budgets count all spend. Other scopes filter spend by
 * {@code scopeId} (workspace, team, user or resource type key).
 *
 * WINDOW:
 * Spend is counted over [startDate, endDate). When the window elapses,
 * auto-reset budgets advance by one period; others expire.
 */
@Entity
@Table(name = "budgets", indexes = {
    @Index(name = "idx_budget_scope", columnList = "scope, scopeId"),
    @Index(name = "idx_budget_status", columnList = "status"),
    @Index(name = "idx_budget_window", columnList = "startDate, endDate")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Budget {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(length = 1024)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CostPeriod period;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = "USD";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BudgetScope scope;

    @Column(length = 64)
    private String scopeId;

    @Convert(converter = StringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> resourceFilters;

    @Column(nullable = false)
    private LocalDateTime startDate;

    @Column(nullable = false)
    private LocalDateTime endDate;

    private boolean autoReset;

    private boolean rolloverUnused;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private BudgetStatus status = BudgetStatus.ACTIVE;

    @Column(length = 64)
    private String createdBy;

    @Column(length = 64)
    private String approvedBy;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Whether {@code instant} falls inside [startDate, endDate).
     */
    public boolean covers(LocalDateTime instant) {
        return !instant.isBefore(startDate) && instant.isBefore(endDate);
    }
}
