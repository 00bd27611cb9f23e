package com.costtelemetry.ml;

import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.*;
import com.costtelemetry.store.CostStore;
import com.costtelemetry.store.CostStore.GroupDailyCost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Statistical cost anomaly detection per (resource type, region) group.
 *
 * DETECTION FLOW:
 * 1. Load daily infrastructure cost for the lookback window (30 days)
 * 2. Skip groups with fewer than 7 daily points (insufficient history)
 * 3. Split each series into recent (last 3 days) and historical (the rest)
 * 4. z = |recentAvg - historicalAvg| / populationStdDev(historical)
 * 5. Raise an anomaly when z > 2; severity HIGH above 2.5, CRITICAL above 3
 *
 * DEGENERATE INPUT:
 * A flat history (stddev 0) or a zero historical average cannot produce a
 * finite score. Such groups are skipped with a warning, never reported.
 *
 * PERSISTENCE:
 * By default every qualifying group yields a new row per run. With
 * {@code deduplicate-open-anomalies} the group's OPEN anomaly is refreshed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetector {

    private static final List<String> BASE_ACTIONS = List.of(
            "Review recent changes in resource configuration",
            "Check for increased usage or demand patterns",
            "Verify billing and pricing information",
            "Investigate potential security incidents"
    );

    private static final List<String> SPIKE_ACTIONS = List.of(
            "Consider implementing auto-scaling policies",
            "Review resource rightsizing opportunities"
    );

    private static final List<String> COMPUTE_ACTIONS = List.of(
            "Analyze CPU and memory utilization",
            "Check for inefficient algorithms or processes"
    );

    private final CostStore costStore;
    private final CostTelemetryProperties properties;
    private final Clock clock;

    /**
     * Run one detection pass and persist the anomalies found.
     *
     * @return anomalies written (inserted or refreshed) during this pass
     */
    public List<CostAnomaly> detect() {
        var settings = properties.getAnomaly();
        LocalDateTime now = LocalDateTime.now(clock);

        var rows = costStore.dailyCostByResourceGroup(now.minusDays(settings.getLookbackDays()), now);
        Map<ResourceGroup, List<GroupDailyCost>> groups = new LinkedHashMap<>();
        for (var row : rows) {
            groups.computeIfAbsent(new ResourceGroup(row.resourceType(), row.region()), g -> new ArrayList<>())
                    .add(row);
        }

        List<CostAnomaly> detected = new ArrayList<>();
        for (var entry : groups.entrySet()) {
            ResourceGroup group = entry.getKey();
            double[] dailyCosts = entry.getValue().stream()
                    .sorted(Comparator.comparing(GroupDailyCost::date))
                    .mapToDouble(GroupDailyCost::cost)
                    .toArray();

            if (dailyCosts.length < settings.getMinimumDataPoints()) {
                log.debug("Skipping group {}: {} daily points, need {}",
                        group.key(), dailyCosts.length, settings.getMinimumDataPoints());
                continue;
            }

            try {
                score(dailyCosts)
                        .filter(s -> s.zScore() > settings.getTriggerThreshold())
                        .map(s -> persist(group, s, now))
                        .ifPresent(detected::add);
            } catch (Exception e) {
                log.error("Failed to record anomaly for group {}: {}", group.key(), e.getMessage());
            }
        }

        log.info("Anomaly detection complete: {} anomalies across {} resource groups",
                detected.size(), groups.size());
        return detected;
    }

    /**
     * Score a chronologically ordered daily series.
     *
     * @return empty when the series is too short or degenerate
     */
    public Optional<AnomalyScore> score(double[] dailyCosts) {
        var settings = properties.getAnomaly();
        int recentDays = settings.getRecentWindowDays();
        if (dailyCosts.length < settings.getMinimumDataPoints() || dailyCosts.length <= recentDays) {
            return Optional.empty();
        }

        double[] historical = Arrays.copyOfRange(dailyCosts, 0, dailyCosts.length - recentDays);
        double recentAvg = CostStatistics.tailMean(dailyCosts, recentDays);
        double historicalAvg = CostStatistics.mean(historical);
        double stdDev = CostStatistics.standardDeviation(historical);

        if (stdDev == 0.0) {
            log.warn("Flat cost history (stddev 0, baseline {}), cannot score deviation", historicalAvg);
            return Optional.empty();
        }
        if (historicalAvg == 0.0) {
            log.warn("Zero historical baseline, cannot compute deviation percentage");
            return Optional.empty();
        }

        double zScore = Math.abs(recentAvg - historicalAvg) / stdDev;
        double deviationPct = (recentAvg - historicalAvg) / historicalAvg * 100;
        return Optional.of(new AnomalyScore(recentAvg, historicalAvg, stdDev, zScore, deviationPct));
    }

    AnomalySeverity severityFor(double zScore) {
        var settings = properties.getAnomaly();
        if (zScore > settings.getCriticalSeverityThreshold()) {
            return AnomalySeverity.CRITICAL;
        }
        if (zScore > settings.getHighSeverityThreshold()) {
            return AnomalySeverity.HIGH;
        }
        return AnomalySeverity.MEDIUM;
    }

    private CostAnomaly persist(ResourceGroup group, AnomalyScore score, LocalDateTime now) {
        CostAnomaly anomaly = null;
        if (properties.getAnomaly().isDeduplicateOpenAnomalies()) {
            anomaly = costStore.findOpenAnomaly(group.resourceType(), group.key()).orElse(null);
        }
        if (anomaly == null) {
            anomaly = CostAnomaly.builder()
                    .detectionAlgorithm(AnomalyAlgorithm.STATISTICAL)
                    .resourceType(group.resourceType())
                    .resourceId(group.key())
                    .region(group.region())
                    .status(AnomalyStatus.OPEN)
                    .build();
        } else {
            log.debug("Refreshing open anomaly {} for group {}", anomaly.getId(), group.key());
        }

        boolean spike = score.recentAverage() > score.historicalAverage();
        AnomalySeverity severity = severityFor(score.zScore());

        anomaly.setAnomalyType(spike ? AnomalyType.SPIKE : AnomalyType.UNUSUAL_PATTERN);
        anomaly.setSeverity(severity);
        anomaly.setBaselineCost(score.historicalAverage());
        anomaly.setActualCost(score.recentAverage());
        anomaly.setDeviationPercentage(score.deviationPercentage());
        anomaly.setZScore(score.zScore());
        anomaly.setConfidenceScore(Math.min(score.zScore() / 3 * 100, 100));
        anomaly.setRootCauseAnalysis(rootCause(group.resourceType(), spike, score.deviationPercentage()));
        anomaly.setSuggestedActions(suggestedActions(group.resourceType(), spike));
        anomaly.setBusinessImpact(businessImpact(severity, score.deviationPercentage()));
        anomaly.setDetectedAt(now);

        var saved = costStore.saveAnomaly(anomaly);
        log.info("{} {} anomaly on {}: baseline ${}/day, recent ${}/day, z={}",
                severity, saved.getAnomalyType(), group.key(),
                String.format("%.2f", score.historicalAverage()),
                String.format("%.2f", score.recentAverage()),
                String.format("%.2f", score.zScore()));
        return saved;
    }

    private String rootCause(ResourceType resourceType, boolean spike, double deviationPct) {
        String pct = String.format("%.1f", Math.abs(deviationPct));
        if (spike) {
            return "Detected " + pct + "% cost increase in " + resourceType.key() + " resources. "
                    + "Possible causes: increased demand, resource scaling, pricing changes, or configuration changes.";
        }
        return "Unusual cost pattern detected in " + resourceType.key() + " resources with " + pct
                + "% deviation. Investigate recent changes in usage patterns, resource allocation, or external factors.";
    }

    List<String> suggestedActions(ResourceType resourceType, boolean spike) {
        List<String> actions = new ArrayList<>(BASE_ACTIONS);
        if (spike) {
            actions.addAll(SPIKE_ACTIONS);
        }
        if (resourceType.isComputeBacked()) {
            actions.addAll(COMPUTE_ACTIONS);
        }
        return actions;
    }

    private String businessImpact(AnomalySeverity severity, double deviationPct) {
        String pct = String.format("%.1f", Math.abs(deviationPct));
        return switch (severity) {
            case CRITICAL -> "Critical impact: " + pct + "% cost deviation may significantly affect budget and operations";
            case HIGH -> "High impact: " + pct + "% cost deviation requires immediate attention";
            case MEDIUM -> "Medium impact: " + pct + "% cost deviation should be monitored";
            case LOW -> "Low impact: " + pct + "% cost deviation is within acceptable range";
        };
    }

    /**
     * Group identity; the key doubles as the anomaly's resource id.
     */
    record ResourceGroup(ResourceType resourceType, String region) {
        String key() {
            return resourceType.key() + "-" + region;
        }
    }

    /**
     * Deviation statistics for one series.
     */
    public record AnomalyScore(
            double recentAverage,
            double historicalAverage,
            double standardDeviation,
            double zScore,
            double deviationPercentage
    ) {}
}
