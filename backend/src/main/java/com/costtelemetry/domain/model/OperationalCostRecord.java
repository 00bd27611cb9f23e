package com.costtelemetry.domain.model;

import com.costtelemetry.domain.model.json.NumericMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Cost of a single platform operation (API call, processing run, job).
 * Hour-of-day buckets over this ledger drive scheduled scaling advice.
 */
@Entity
@Table(name = "operational_costs", indexes = {
    @Index(name = "idx_op_cost_type", columnList = "operationType"),
    @Index(name = "idx_op_cost_user", columnList = "userId"),
    @Index(name = "idx_op_cost_workspace", columnList = "workspaceId"),
    @Index(name = "idx_op_cost_created", columnList = "createdAt")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OperationalCostRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OperationType operationType;

    @Column(length = 128)
    private String operationName;

    @Column(nullable = false, precision = 14, scale = 6)
    private BigDecimal costUsd;

    private Long durationMs;

    /**
     * Consumed units keyed by resource, e.g. {"cpu_seconds": 1.2}.
     */
    @Convert(converter = NumericMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Double> resourceConsumption;

    @Column(length = 64)
    private String userId;

    @Column(length = 64)
    private String workspaceId;

    @Column(length = 64)
    private String teamId;

    private boolean success;

    @Column(columnDefinition = "TEXT")
    private String errorDetails;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
