package com.costtelemetry.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Usage charge for one model execution.
 *
 * This ledger is the spend source for the real-time spend rate, budget
 * consumption, forecasting and usage analytics.
 */
@Entity
@Table(name = "model_usage_costs", indexes = {
    @Index(name = "idx_usage_created", columnList = "createdAt"),
    @Index(name = "idx_usage_workspace", columnList = "workspaceId, createdAt"),
    @Index(name = "idx_usage_team", columnList = "teamId, createdAt"),
    @Index(name = "idx_usage_user", columnList = "userId, createdAt"),
    @Index(name = "idx_usage_model", columnList = "model")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelUsageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64)
    private String executionId;

    @Column(nullable = false, length = 128)
    private String model;

    @Column(nullable = false, precision = 14, scale = 6)
    private BigDecimal costUsd;

    private Long totalTokens;

    private Long executionTimeMs;

    @Column(nullable = false)
    private boolean success;

    @Column(length = 64)
    private String userId;

    @Column(length = 64)
    private String workspaceId;

    @Column(length = 64)
    private String teamId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
