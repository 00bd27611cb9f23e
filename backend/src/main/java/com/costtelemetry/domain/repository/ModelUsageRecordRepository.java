package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.ModelUsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ModelUsageRecordRepository extends JpaRepository<ModelUsageRecord, Long> {

    /**
     * Sum usage charges in [from, to); null filters match everything.
     */
    @Query("SELECT COALESCE(SUM(u.costUsd), 0) FROM ModelUsageRecord u " +
           "WHERE u.createdAt >= :from AND u.createdAt < :to " +
           "AND (:workspaceId IS NULL OR u.workspaceId = :workspaceId) " +
           "AND (:teamId IS NULL OR u.teamId = :teamId) " +
           "AND (:userId IS NULL OR u.userId = :userId)")
    BigDecimal sumCost(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("workspaceId") String workspaceId,
            @Param("teamId") String teamId,
            @Param("userId") String userId
    );

    /**
     * Usage charges in [from, to), oldest first.
     */
    @Query("SELECT u FROM ModelUsageRecord u " +
           "WHERE u.createdAt >= :from AND u.createdAt < :to " +
           "AND (:workspaceId IS NULL OR u.workspaceId = :workspaceId) " +
           "AND (:teamId IS NULL OR u.teamId = :teamId) " +
           "ORDER BY u.createdAt ASC")
    List<ModelUsageRecord> findCharges(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("workspaceId") String workspaceId,
            @Param("teamId") String teamId
    );
}
