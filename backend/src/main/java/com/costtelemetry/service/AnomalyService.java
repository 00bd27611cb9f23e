package com.costtelemetry.service;

import com.costtelemetry.domain.model.AnomalySeverity;
import com.costtelemetry.domain.model.AnomalyStatus;
import com.costtelemetry.domain.model.CostAnomaly;
import com.costtelemetry.domain.repository.CostAnomalyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Investigation workflow for detected anomalies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyService {

    private final CostAnomalyRepository anomalyRepository;
    private final Clock clock;

    /**
     * Anomalies detected in the last {@code days} days, newest first. Null filters match everything.
     */
    @Transactional(readOnly = true)
    public List<CostAnomaly> findAnomalies(int days, AnomalyStatus status, AnomalySeverity severity,
                                           String workspaceId) {
        if (days <= 0) {
            throw new IllegalArgumentException("Lookback days must be positive");
        }
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);
        return anomalyRepository.search(since, status, severity, workspaceId);
    }

    /**
     * Move an anomaly through its investigation states.
     *
     * Closed anomalies (resolved, false positive) are final. Closing stamps
     * resolvedAt.
     *
     * @return the updated anomaly, or empty if it is missing or the transition is invalid
     */
    @Transactional
    public Optional<CostAnomaly> updateStatus(Long anomalyId, AnomalyStatus target) {
        var found = anomalyRepository.findById(anomalyId);
        if (found.isEmpty()) {
            log.warn("Anomaly {} not found", anomalyId);
            return Optional.empty();
        }

        var anomaly = found.get();
        if (anomaly.getStatus().isClosed() || anomaly.getStatus() == target) {
            log.warn("Cannot move anomaly {} from {} to {}", anomalyId, anomaly.getStatus(), target);
            return Optional.empty();
        }

        var previous = anomaly.getStatus();
        anomaly.setStatus(target);
        if (target.isClosed()) {
            anomaly.setResolvedAt(LocalDateTime.now(clock));
        }

        var saved = anomalyRepository.save(anomaly);
        log.info("Anomaly {} moved from {} to {}", anomalyId, previous, target);
        return Optional.of(saved);
    }
}
