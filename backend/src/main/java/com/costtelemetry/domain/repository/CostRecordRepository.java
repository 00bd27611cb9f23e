package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.CostRecord;
import com.costtelemetry.domain.model.ResourceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface CostRecordRepository extends JpaRepository<CostRecord, Long> {

    /**
     * Count resources whose billing period has not ended yet.
     */
    @Query("SELECT COUNT(DISTINCT c.resourceId) FROM CostRecord c WHERE c.billingPeriodEnd >= :at")
    long countActiveResources(@Param("at") LocalDateTime at);

    /**
     * Records whose billing period started inside [from, to), oldest first.
     */
    @Query("SELECT c FROM CostRecord c WHERE c.billingPeriodStart >= :from " +
           "AND c.billingPeriodStart < :to " +
           "AND (:workspaceId IS NULL OR c.workspaceId = :workspaceId) " +
           "AND (:teamId IS NULL OR c.teamId = :teamId) " +
           "ORDER BY c.billingPeriodStart ASC")
    List<CostRecord> findStartedBetween(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("workspaceId") String workspaceId,
            @Param("teamId") String teamId
    );

    /**
     * Records still billing at or after {@code since}; the utilization window.
     */
    @Query("SELECT c FROM CostRecord c WHERE c.billingPeriodEnd >= :since " +
           "AND (:workspaceId IS NULL OR c.workspaceId = :workspaceId) " +
           "AND (:teamId IS NULL OR c.teamId = :teamId)")
    List<CostRecord> findBillingSince(
            @Param("since") LocalDateTime since,
            @Param("workspaceId") String workspaceId,
            @Param("teamId") String teamId
    );

    /**
     * Total cost of one resource type for periods started inside [from, to).
     */
    @Query("SELECT COALESCE(SUM(c.costUsd), 0) FROM CostRecord c WHERE c.resourceType = :resourceType " +
           "AND c.billingPeriodStart >= :from AND c.billingPeriodStart < :to")
    BigDecimal sumCostByResourceType(
            @Param("resourceType") ResourceType resourceType,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to
    );
}
