package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.OperationalCostRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface OperationalCostRecordRepository extends JpaRepository<OperationalCostRecord, Long> {

    @Query("SELECT o FROM OperationalCostRecord o WHERE o.createdAt >= :since " +
           "AND (:workspaceId IS NULL OR o.workspaceId = :workspaceId) " +
           "AND (:teamId IS NULL OR o.teamId = :teamId)")
    List<OperationalCostRecord> findSince(
            @Param("since") LocalDateTime since,
            @Param("workspaceId") String workspaceId,
            @Param("teamId") String teamId
    );
}
