package com.costtelemetry.domain.repository;

import com.costtelemetry.domain.model.CostPrediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface CostPredictionRepository extends JpaRepository<CostPrediction, String> {

    /**
     * Predictions still inside their validity window, newest first.
     */
    List<CostPrediction> findByValidUntilAfterOrderByForecastGeneratedAtDesc(LocalDateTime at);
}
