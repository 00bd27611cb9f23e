package com.costtelemetry.api;

import com.costtelemetry.analytics.UsageAnalyticsService;
import com.costtelemetry.analytics.UsageAnalyticsService.UsageAnalyticsReport;
import com.costtelemetry.domain.model.*;
import com.costtelemetry.metrics.MetricsCache;
import com.costtelemetry.metrics.RealTimeCostMetrics;
import com.costtelemetry.ml.ForecastEngine;
import com.costtelemetry.recommendation.OptimizationAdvisor;
import com.costtelemetry.scheduler.CostMonitoringOrchestrator;
import com.costtelemetry.scheduler.CostMonitoringOrchestrator.TickReport;
import com.costtelemetry.service.AnomalyService;
import com.costtelemetry.service.RecommendationService;
import com.costtelemetry.store.CostStore.ScopeFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * REST API over the monitoring engine.
 *
 * ENDPOINT DESIGN:
 * - Metrics reads come from the cache and never wait for a refresh once warm
 * - Forecasts and recommendations are computed on demand and persisted
 * - Lifecycle endpoints answer 404 when the target is missing or the
 *   requested transition is not allowed from its current state
 *
 * Budget administration lives in {@link BudgetController}.
 */
@RestController
@RequestMapping("/api/v1/cost-telemetry")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cost Telemetry", description = "Real-time metrics, forecasts, anomalies and optimization")
public class CostTelemetryController {

    private final MetricsCache metricsCache;
    private final ForecastEngine forecastEngine;
    private final OptimizationAdvisor optimizationAdvisor;
    private final UsageAnalyticsService usageAnalyticsService;
    private final AnomalyService anomalyService;
    private final RecommendationService recommendationService;
    private final CostMonitoringOrchestrator orchestrator;

    @GetMapping("/metrics")
    @Operation(summary = "Real-time cost metrics",
               description = "Spend rate, projections, breakdowns and budget utilization from the metrics cache")
    public ResponseEntity<RealTimeCostMetrics> getRealTimeCostMetrics() {
        return ResponseEntity.ok(metricsCache.getRealTimeCostMetrics());
    }

    @PostMapping("/forecasts")
    @Operation(summary = "Generate a cost forecast",
               description = "Extrapolates daily spend over the lookback window to the requested period")
    public ResponseEntity<CostPrediction> generateForecast(
            @RequestParam(defaultValue = "MONTHLY") CostPeriod period,
            @RequestParam(required = false) ForecastAlgorithm algorithm
    ) {
        log.info("Forecast request: period={}, algorithm={}", period, algorithm);
        return ResponseEntity.ok(forecastEngine.forecast(period, algorithm));
    }

    @PostMapping("/recommendations/generate")
    @Operation(summary = "Generate optimization recommendations",
               description = "Runs rightsizing, scheduling and model efficiency analyses for an optional scope")
    public ResponseEntity<List<OptimizationRecommendation>> generateOptimizationRecommendations(
            @RequestParam(required = false) String workspaceId,
            @RequestParam(required = false) String teamId
    ) {
        return ResponseEntity.ok(optimizationAdvisor.generateRecommendations(new ScopeFilter(workspaceId, teamId)));
    }

    @GetMapping("/recommendations")
    @Operation(summary = "List stored recommendations")
    public ResponseEntity<List<OptimizationRecommendation>> getRecommendations(
            @RequestParam(required = false) RecommendationStatus status
    ) {
        return ResponseEntity.ok(recommendationService.findRecommendations(status));
    }

    @PostMapping("/recommendations/{recommendationId}/approve")
    @Operation(summary = "Approve a pending recommendation")
    public ResponseEntity<OptimizationRecommendation> approveRecommendation(
            @PathVariable String recommendationId,
            @Valid @RequestBody ReviewRequest request
    ) {
        return ResponseEntity.of(recommendationService.approve(recommendationId, request.reviewedBy()));
    }

    @PostMapping("/recommendations/{recommendationId}/reject")
    @Operation(summary = "Reject a pending recommendation")
    public ResponseEntity<OptimizationRecommendation> rejectRecommendation(
            @PathVariable String recommendationId,
            @Valid @RequestBody ReviewRequest request
    ) {
        return ResponseEntity.of(recommendationService.reject(
                recommendationId, request.reviewedBy(), request.reason()));
    }

    @PostMapping("/recommendations/{recommendationId}/implement")
    @Operation(summary = "Mark an approved recommendation as implemented")
    public ResponseEntity<OptimizationRecommendation> markImplemented(
            @PathVariable String recommendationId,
            @Valid @RequestBody ReviewRequest request
    ) {
        return ResponseEntity.of(recommendationService.markImplemented(recommendationId, request.reviewedBy()));
    }

    @GetMapping("/analytics")
    @Operation(summary = "Usage analytics",
               description = "Summary, daily metrics, trends, breakdowns, efficiency and embedded recommendations")
    public ResponseEntity<UsageAnalyticsReport> getUsageAnalytics(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @RequestParam(required = false) String workspaceId,
            @RequestParam(required = false) String teamId
    ) {
        return ResponseEntity.ok(usageAnalyticsService.getUsageAnalytics(startDate, endDate, workspaceId, teamId));
    }

    @GetMapping("/anomalies")
    @Operation(summary = "List detected anomalies")
    public ResponseEntity<List<CostAnomaly>> getAnomalies(
            @RequestParam(defaultValue = "7") int days,
            @RequestParam(required = false) AnomalyStatus status,
            @RequestParam(required = false) AnomalySeverity severity,
            @RequestParam(required = false) String workspaceId
    ) {
        return ResponseEntity.ok(anomalyService.findAnomalies(days, status, severity, workspaceId));
    }

    @PatchMapping("/anomalies/{anomalyId}/status")
    @Operation(summary = "Change an anomaly's investigation status")
    public ResponseEntity<CostAnomaly> updateAnomalyStatus(
            @PathVariable Long anomalyId,
            @Valid @RequestBody AnomalyStatusRequest request
    ) {
        return ResponseEntity.of(anomalyService.updateStatus(anomalyId, request.status()));
    }

    @PostMapping("/monitoring/tick")
    @Operation(summary = "Run a monitoring pass now",
               description = "Skipped if a scheduled pass is already running")
    public ResponseEntity<TickReport> runMonitoringTick() {
        return ResponseEntity.ok(orchestrator.tick());
    }

    public record ReviewRequest(@NotBlank String reviewedBy, String reason) {}

    public record AnomalyStatusRequest(@NotNull AnomalyStatus status) {}
}
