package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.OptimizationRecommendation;
import com.costtelemetry.domain.model.RecommendationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OptimizationRecommendationRepository extends JpaRepository<OptimizationRecommendation, String> {

    List<OptimizationRecommendation> findByStatusOrderByEstimatedSavingsDesc(RecommendationStatus status);

    List<OptimizationRecommendation> findAllByOrderByEstimatedSavingsDesc();
}
