package com.costtelemetry.service;

import com.costtelemetry.domain.model.OptimizationRecommendation;
import com.costtelemetry.domain.model.RecommendationStatus;
import com.costtelemetry.domain.repository.OptimizationRecommendationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service for managing recommendation lifecycle operations.
 *
 * PENDING -> APPROVED -> IMPLEMENTED, or PENDING -> REJECTED. The reviewer
 * and any rejection reason are kept in the recommendation metadata.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    static final String REVIEWED_BY = "reviewedBy";
    static final String REJECTION_REASON = "rejectionReason";

    private final OptimizationRecommendationRepository recommendationRepository;
    private final Clock clock;

    /**
     * Recommendations by status, largest savings first. A null status lists all.
     */
    @Transactional(readOnly = true)
    public List<OptimizationRecommendation> findRecommendations(RecommendationStatus status) {
        return status != null
                ? recommendationRepository.findByStatusOrderByEstimatedSavingsDesc(status)
                : recommendationRepository.findAllByOrderByEstimatedSavingsDesc();
    }

    @Transactional
    public Optional<OptimizationRecommendation> approve(String recommendationId, String reviewedBy) {
        return transition(recommendationId, RecommendationStatus.PENDING, RecommendationStatus.APPROVED,
                reviewedBy, null);
    }

    @Transactional
    public Optional<OptimizationRecommendation> reject(String recommendationId, String reviewedBy, String reason) {
        return transition(recommendationId, RecommendationStatus.PENDING, RecommendationStatus.REJECTED,
                reviewedBy, reason);
    }

    /**
     * Mark an approved recommendation as applied.
     */
    @Transactional
    public Optional<OptimizationRecommendation> markImplemented(String recommendationId, String implementedBy) {
        return transition(recommendationId, RecommendationStatus.APPROVED, RecommendationStatus.IMPLEMENTED,
                implementedBy, null);
    }

    private Optional<OptimizationRecommendation> transition(String recommendationId,
                                                            RecommendationStatus expected,
                                                            RecommendationStatus target,
                                                            String actor, String reason) {
        log.info("Moving recommendation {} to {} by {}", recommendationId, target, actor);

        var recommendation = recommendationRepository.findById(recommendationId);
        if (recommendation.isEmpty()) {
            log.warn("Recommendation {} not found", recommendationId);
            return Optional.empty();
        }

        var rec = recommendation.get();
        if (rec.getStatus() != expected) {
            log.warn("Cannot move recommendation {} with status {} to {}",
                    recommendationId, rec.getStatus(), target);
            return Optional.empty();
        }

        Map<String, Object> metadata = rec.getMetadata() != null
                ? new HashMap<>(rec.getMetadata())
                : new HashMap<>();
        if (actor != null) {
            metadata.put(REVIEWED_BY, actor);
        }
        if (reason != null) {
            metadata.put(REJECTION_REASON, reason);
        }
        rec.setMetadata(metadata);
        rec.setStatus(target);
        rec.setUpdatedAt(LocalDateTime.now(clock));

        var saved = recommendationRepository.save(rec);
        log.info("Recommendation {} is now {}", recommendationId, target);
        return Optional.of(saved);
    }
}
