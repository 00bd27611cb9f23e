package com.costtelemetry.scheduler;

import com.costtelemetry.budget.BudgetAlertEngine;
import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.metrics.MetricsCache;
import com.costtelemetry.ml.AnomalyDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic driver of the monitoring pipeline.
 *
 * TICK ORDER:
 * 1. MetricsCache.refresh
 * 2. AnomalyDetector.detect
 * 3. BudgetAlertEngine.checkAlerts
 *
 * Each phase is caught on its own: a failure is logged and the next phase
 * and the next tick still run. No error leaves a tick.
 *
 * LIFECYCLE:
 * A single-thread scheduler fires ticks at a fixed rate. An in-flight flag
 * skips a tick (never queues it) while the previous one is still running,
 * including ticks requested through {@link #tick()}. {@link #stop()} cancels
 * future ticks and waits, bounded, for an in-flight tick to finish.
 *
 * OPERATIONAL CONSTRAINT:
 * Single instance only. Two running instances would double-detect anomalies
 * and double-notify alerts; there is no distributed lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CostMonitoringOrchestrator implements SmartLifecycle {

    private final MetricsCache metricsCache;
    private final AnomalyDetector anomalyDetector;
    private final BudgetAlertEngine budgetAlertEngine;
    private final CostTelemetryProperties properties;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private volatile boolean running;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        var monitoring = properties.getMonitoring();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cost-monitoring-tick");
            t.setDaemon(true);
            return t;
        });
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                monitoring.getInitialDelay().toMillis(),
                monitoring.getTickInterval().toMillis(),
                TimeUnit.MILLISECONDS
        );
        running = true;
        log.info("[Monitoring] Started with tick interval {}", monitoring.getTickInterval());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                long timeout = properties.getMonitoring().getShutdownTimeout().toMillis();
                if (!scheduler.awaitTermination(timeout, TimeUnit.MILLISECONDS)) {
                    log.warn("[Monitoring] In-flight tick did not finish within {}ms, interrupting", timeout);
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Monitoring] Stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getMonitoring().isEnabled();
    }

    /**
     * Run one monitoring pass now, unless another pass is in flight.
     */
    public TickReport tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Monitoring] Tick skipped: previous tick still in progress");
            return TickReport.skippedTick();
        }
        try {
            List<String> failedPhases = new ArrayList<>();
            boolean refreshed = runPhase("metrics refresh", failedPhases, metricsCache::refresh, false);
            int anomalies = runPhase("anomaly detection", failedPhases, () -> anomalyDetector.detect().size(), 0);
            int triggered = runPhase("budget alerts", failedPhases, () -> budgetAlertEngine.checkAlerts().size(), 0);

            log.debug("[Monitoring] Tick complete: refreshed={}, anomalies={}, alertsTriggered={}, failed={}",
                    refreshed, anomalies, triggered, failedPhases);
            return new TickReport(false, refreshed, anomalies, triggered, List.copyOf(failedPhases));
        } finally {
            executing.set(false);
        }
    }

    private <T> T runPhase(String name, List<String> failedPhases, Callable<T> phase, T fallback) {
        try {
            return phase.call();
        } catch (Exception e) {
            log.error("[Monitoring] Phase '{}' failed: {}", name, e.getMessage(), e);
            failedPhases.add(name);
            return fallback;
        }
    }

    /**
     * Outcome of a single tick.
     */
    public record TickReport(
            boolean skipped,
            boolean metricsRefreshed,
            int anomaliesDetected,
            int alertsTriggered,
            List<String> failedPhases
    ) {
        static TickReport skippedTick() {
            return new TickReport(true, false, 0, 0, List.of());
        }
    }
}
