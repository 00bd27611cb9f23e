package com.costtelemetry.scheduler;

import com.costtelemetry.budget.BudgetAlertEngine;
import com.costtelemetry.config.CostTelemetryProperties;
import com.costtelemetry.domain.model.BudgetAlert;
import com.costtelemetry.domain.model.CostAnomaly;
import com.costtelemetry.metrics.MetricsCache;
import com.costtelemetry.ml.AnomalyDetector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CostMonitoringOrchestrator.
 *
 * Test strategy:
 * 1. Manual ticks: phase order, fault isolation, overlap skipping
 * 2. Scheduled ticks: start, stop and draining an in-flight tick
 */
@ExtendWith(MockitoExtension.class)
class CostMonitoringOrchestratorTest {

    @Mock
    private MetricsCache metricsCache;

    @Mock
    private AnomalyDetector anomalyDetector;

    @Mock
    private BudgetAlertEngine budgetAlertEngine;

    private CostTelemetryProperties properties;
    private CostMonitoringOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new CostTelemetryProperties();
        orchestrator = new CostMonitoringOrchestrator(metricsCache, anomalyDetector, budgetAlertEngine, properties);
    }

    @AfterEach
    void tearDown() {
        orchestrator.stop();
    }

    @Nested
    @DisplayName("Manual ticks")
    class ManualTickTests {

        @Test
        @DisplayName("Should run refresh, detection and alert checks in order")
        void shouldRunPhasesInOrder() {
            when(metricsCache.refresh()).thenReturn(true);
            when(anomalyDetector.detect()).thenReturn(List.of(new CostAnomaly(), new CostAnomaly()));
            when(budgetAlertEngine.checkAlerts()).thenReturn(List.of(new BudgetAlert()));

            var report = orchestrator.tick();

            InOrder inOrder = inOrder(metricsCache, anomalyDetector, budgetAlertEngine);
            inOrder.verify(metricsCache).refresh();
            inOrder.verify(anomalyDetector).detect();
            inOrder.verify(budgetAlertEngine).checkAlerts();
            assertThat(report.skipped()).isFalse();
            assertThat(report.metricsRefreshed()).isTrue();
            assertThat(report.anomaliesDetected()).isEqualTo(2);
            assertThat(report.alertsTriggered()).isEqualTo(1);
            assertThat(report.failedPhases()).isEmpty();
        }

        @Test
        @DisplayName("Should run later phases when an earlier phase throws")
        void shouldIsolatePhaseFailures() {
            when(metricsCache.refresh()).thenThrow(new IllegalStateException("store down"));
            when(anomalyDetector.detect()).thenThrow(new IllegalStateException("store down"));
            when(budgetAlertEngine.checkAlerts()).thenReturn(List.of());

            var report = orchestrator.tick();

            verify(budgetAlertEngine).checkAlerts();
            assertThat(report.failedPhases()).containsExactly("metrics refresh", "anomaly detection");
            assertThat(report.metricsRefreshed()).isFalse();
        }

        @Test
        @DisplayName("Should keep ticking after a failed tick")
        void shouldRecoverOnNextTick() {
            when(metricsCache.refresh()).thenThrow(new IllegalStateException("store down")).thenReturn(true);
            when(anomalyDetector.detect()).thenReturn(List.of());
            when(budgetAlertEngine.checkAlerts()).thenReturn(List.of());

            orchestrator.tick();
            var second = orchestrator.tick();

            assertThat(second.failedPhases()).isEmpty();
            assertThat(second.metricsRefreshed()).isTrue();
        }

        @Test
        @DisplayName("Should skip a tick while another tick is in flight")
        void shouldSkipOverlappingTick() throws Exception {
            var entered = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            when(metricsCache.refresh()).thenAnswer(inv -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return true;
            });
            when(anomalyDetector.detect()).thenReturn(List.of());
            when(budgetAlertEngine.checkAlerts()).thenReturn(List.of());

            var inFlight = CompletableFuture.supplyAsync(orchestrator::tick);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            var overlapping = orchestrator.tick();
            release.countDown();
            var completed = inFlight.get(5, TimeUnit.SECONDS);

            assertThat(overlapping.skipped()).isTrue();
            assertThat(completed.skipped()).isFalse();
            verify(metricsCache, times(1)).refresh();
            verify(anomalyDetector, times(1)).detect();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @BeforeEach
        void fastSchedule() {
            properties.getMonitoring().setInitialDelay(Duration.ZERO);
            properties.getMonitoring().setTickInterval(Duration.ofMillis(50));
            properties.getMonitoring().setShutdownTimeout(Duration.ofSeconds(5));
            lenient().when(anomalyDetector.detect()).thenReturn(List.of());
            lenient().when(budgetAlertEngine.checkAlerts()).thenReturn(List.of());
        }

        @Test
        @DisplayName("Should tick periodically after start and stop ticking after stop")
        void shouldStartAndStop() throws Exception {
            var refreshes = new AtomicInteger();
            var twoTicks = new CountDownLatch(2);
            when(metricsCache.refresh()).thenAnswer(inv -> {
                refreshes.incrementAndGet();
                twoTicks.countDown();
                return true;
            });

            orchestrator.start();
            assertThat(orchestrator.isRunning()).isTrue();
            assertThat(twoTicks.await(5, TimeUnit.SECONDS)).isTrue();

            orchestrator.stop();
            assertThat(orchestrator.isRunning()).isFalse();

            int afterStop = refreshes.get();
            Thread.sleep(200);
            assertThat(refreshes.get()).isEqualTo(afterStop);
        }

        @Test
        @DisplayName("Should let an in-flight tick finish on stop")
        void shouldDrainInFlightTick() throws Exception {
            properties.getMonitoring().setTickInterval(Duration.ofHours(1));
            var entered = new CountDownLatch(1);
            when(metricsCache.refresh()).thenAnswer(inv -> {
                entered.countDown();
                Thread.sleep(200);
                return true;
            });

            orchestrator.start();
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            orchestrator.stop();

            verify(budgetAlertEngine).checkAlerts();
        }

        @Test
        @DisplayName("Should ignore a second start and a stop before start")
        void shouldBeIdempotent() {
            orchestrator.stop();
            orchestrator.start();
            orchestrator.start();

            assertThat(orchestrator.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Should follow the monitoring switch for auto-startup")
        void shouldFollowEnabledFlag() {
            assertThat(orchestrator.isAutoStartup()).isTrue();

            properties.getMonitoring().setEnabled(false);

            assertThat(orchestrator.isAutoStartup()).isFalse();
        }
    }
}
