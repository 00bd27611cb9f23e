package com.costtelemetry.metrics;

import com.costtelemetry.budget.BudgetSpendCalculator;
import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.store.CostStore;
import com.costtelemetry.store.CostStore.BreakdownDimension;
import com.costtelemetry.store.CostStore.CostBreakdownEntry;
import com.costtelemetry.store.CostStore.SpendQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Time-windowed cache of real-time cost metrics.
 *
 * FRESHNESS:
 * {@link #refresh()} recomputes once the snapshot is within the refresh
 * tolerance of one interval old, so a scheduled tick that fires slightly early
 * still refreshes. {@link #getRealTimeCostMetrics()} recomputes when the
 * snapshot is a full interval old. {@link #get()} is a lock-free read of the
 * last published snapshot and never touches the store.
 *
 * PARTIAL FAILURE:
 * Each store query is isolated. A failing query contributes zero or an empty
 * breakdown for that cycle, and the snapshot is still published.
 *
 * A clock stepping backwards gives the snapshot a negative age, which counts
 * as fresh, so lastUpdated never moves backwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsCache {

    private static final int HOURS_PER_DAY = 24;
    private static final int DAYS_PER_MONTH = 30;

    private final CostStore costStore;
    private final BudgetSpendCalculator spendCalculator;
    private final CostTelemetryProperties properties;
    private final Clock clock;

    private final AtomicReference<RealTimeCostMetrics> snapshot = new AtomicReference<>();

    /**
     * Last published snapshot, empty before the first refresh.
     */
    public Optional<RealTimeCostMetrics> get() {
        return Optional.ofNullable(snapshot.get());
    }

    /**
     * Current metrics for callers. A cold or stale cache is recomputed
     * synchronously; within the interval repeated calls return the cached instance.
     */
    public RealTimeCostMetrics getRealTimeCostMetrics() {
        var current = snapshot.get();
        if (current != null && isYoungerThan(current, LocalDateTime.now(clock), refreshInterval())) {
            return current;
        }
        refresh();
        return snapshot.get();
    }

    /**
     * Recompute the snapshot if it is stale. Never throws.
     *
     * @return true if a new snapshot was published
     */
    public synchronized boolean refresh() {
        LocalDateTime now = LocalDateTime.now(clock);
        var current = snapshot.get();
        if (current != null && isYoungerThan(current, now, refreshThreshold())) {
            log.debug("Metrics snapshot from {} still fresh, skipping refresh", current.lastUpdated());
            return false;
        }

        var computed = compute(now);
        snapshot.set(computed);

        log.info("Metrics refreshed: ${}/h spend rate, {} active resources, {} open anomalies",
                String.format("%.2f", computed.currentSpendRate()),
                computed.activeResources(),
                computed.anomaliesDetected());
        return true;
    }

    private Duration refreshInterval() {
        return properties.getMetrics().getRefreshInterval();
    }

    // Interval minus tolerance, never negative.
    private Duration refreshThreshold() {
        Duration threshold = refreshInterval().minus(properties.getMetrics().getRefreshTolerance());
        return threshold.isNegative() ? Duration.ZERO : threshold;
    }

    private static boolean isYoungerThan(RealTimeCostMetrics metrics, LocalDateTime now, Duration age) {
        return Duration.between(metrics.lastUpdated(), now).compareTo(age) < 0;
    }

    private RealTimeCostMetrics compute(LocalDateTime now) {
        LocalDateTime hourAgo = now.minusHours(1);
        LocalDateTime twoHoursAgo = now.minusHours(2);
        LocalDateTime dayAgo = now.minusDays(1);

        double spendRate = query("current spend rate",
                () -> costStore.sumSpend(SpendQuery.global(hourAgo, now)), 0.0);
        double previousRate = query("previous spend rate",
                () -> costStore.sumSpend(SpendQuery.global(twoHoursAgo, hourAgo)), 0.0);
        double dailyCost = spendRate * HOURS_PER_DAY;

        return new RealTimeCostMetrics(
                spendRate,
                dailyCost,
                dailyCost * DAYS_PER_MONTH,
                spendRate - previousRate,
                query("active resources", () -> costStore.countActiveResources(now), 0L),
                breakdown(BreakdownDimension.SERVICE, dayAgo, now),
                breakdown(BreakdownDimension.REGION, dayAgo, now),
                breakdown(BreakdownDimension.TEAM, dayAgo, now),
                query("open anomalies", () -> costStore.countOpenAnomaliesSince(dayAgo), 0L),
                query("budget utilization",
                        () -> Collections.unmodifiableMap(spendCalculator.utilization(now)), Map.of()),
                now
        );
    }

    private Map<String, Double> breakdown(BreakdownDimension dimension, LocalDateTime from, LocalDateTime to) {
        return query("cost by " + dimension.name().toLowerCase(), () -> {
            Map<String, Double> result = new LinkedHashMap<>();
            for (CostBreakdownEntry entry : costStore.costBreakdown(dimension, from, to)) {
                result.put(entry.key(), entry.cost());
            }
            return Collections.unmodifiableMap(result);
        }, Map.of());
    }

    private <T> T query(String description, Supplier<T> supplier, T fallback) {
        try {
            return supplier.get();
        } catch (Exception e) {
            log.error("Metrics query '{}' failed, using empty value this cycle: {}", description, e.getMessage());
            return fallback;
        }
    }
}
