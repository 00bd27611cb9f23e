package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.AnomalySeverity;
import com.costtelemetry.domain.model.AnomalyStatus;
import com.costtelemetry.domain.model.CostAnomaly;
import com.costtelemetry.domain.model.ResourceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface CostAnomalyRepository extends JpaRepository<CostAnomaly, Long> {

    long countByStatusAndDetectedAtGreaterThanEqual(AnomalyStatus status, LocalDateTime since);

    Optional<CostAnomaly> findFirstByResourceTypeAndResourceIdAndStatusOrderByDetectedAtDesc(
            ResourceType resourceType, String resourceId, AnomalyStatus status);

    @Query("SELECT a FROM CostAnomaly a WHERE a.detectedAt >= :since " +
           "AND (:status IS NULL OR a.status = :status) " +
           "AND (:severity IS NULL OR a.severity = :severity) " +
           "AND (:workspaceId IS NULL OR a.workspaceId = :workspaceId) " +
           "ORDER BY a.detectedAt DESC")
    List<CostAnomaly> search(
            @Param("since") LocalDateTime since,
            @Param("status") AnomalyStatus status,
            @Param("severity") AnomalySeverity severity,
            @Param("workspaceId") String workspaceId
    );
}
