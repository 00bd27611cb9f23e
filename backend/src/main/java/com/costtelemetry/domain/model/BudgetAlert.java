package com.costtelemetry.domain.model;

import com.costtelemetry.domain.model.json.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Alert attached to a budget, re-evaluated every monitoring cycle.
 *
 * STATE MACHINE:
 * ACTIVE -> TRIGGERED when the measured percentage reaches the threshold.
 * TRIGGERED -> RESOLVED when it drops back below.
 * SNOOZED is set and cleared by users only.
 *
 * After every evaluation percentageUsed == currentAmount / budget.amount * 100.
 */
@Entity
@Table(name = "budget_alerts", indexes = {
    @Index(name = "idx_alert_budget", columnList = "budget_id"),
    @Index(name = "idx_alert_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BudgetAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "budget_id", nullable = false)
    private Budget budget;

    @Column(nullable = false, length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertType alertType;

    @Column(nullable = false)
    private double thresholdPercentage;

    /**
     * Look-ahead used by forecast alerts; informational for other types.
     */
    private Integer forecastDays;

    private double currentAmount;

    private double percentageUsed;

    /**
     * Spend projected to the end of the budget window.
     */
    private Double projectedAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private AlertStatus status = AlertStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertSeverity severity;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> notificationChannels;

    private LocalDateTime lastTriggered;

    private LocalDateTime snoozeUntil;

    private int triggerCount;

    @Version
    private Long version;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (severity == null && alertType != null) {
            severity = alertType.getDefaultSeverity();
        }
    }
}
