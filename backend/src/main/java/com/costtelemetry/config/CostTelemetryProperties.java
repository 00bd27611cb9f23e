package com.costtelemetry.config;

import com.costtelemetry.domain.model.ForecastAlgorithm;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the monitoring engine, bound from {@code cost-telemetry.*}.
 *
 * Defaults reproduce the production heuristics, so a bare instance is a
 * valid configuration for unit tests.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "cost-telemetry")
public class CostTelemetryProperties {

    private Monitoring monitoring = new Monitoring();
    private Metrics metrics = new Metrics();
    private Anomaly anomaly = new Anomaly();
    private Forecast forecast = new Forecast();
    private Optimization optimization = new Optimization();
    private Budgets budgets = new Budgets();
    private DemoData demoData = new DemoData();

    @Getter
    @Setter
    public static class Monitoring {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofSeconds(30);
        /** Upper bound on waiting for an in-flight tick during shutdown. */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Metrics {
        /** Minimum age of the snapshot before a refresh recomputes it. */
        private Duration refreshInterval = Duration.ofMinutes(5);
        /** Slack subtracted from the interval for scheduled refreshes, absorbing tick jitter. */
        private Duration refreshTolerance = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Anomaly {
        private int lookbackDays = 30;
        private int recentWindowDays = 3;
        private int minimumDataPoints = 7;
        private double triggerThreshold = 2.0;
        private double highSeverityThreshold = 2.5;
        private double criticalSeverityThreshold = 3.0;
        /**
         * When true, an OPEN anomaly for the same resource group is refreshed
         * instead of inserting a new row every run.
         */
        private boolean deduplicateOpenAnomalies = false;
    }

    @Getter
    @Setter
    public static class Forecast {
        private int lookbackDays = 90;
        private int trendWindowDays = 7;
        private Duration validity = Duration.ofHours(24);
        private ForecastAlgorithm defaultAlgorithm = ForecastAlgorithm.ENSEMBLE;
    }

    @Getter
    @Setter
    public static class Optimization {
        private int utilizationLookbackDays = 7;
        private double underutilizationThreshold = 0.5;
        private double rightsizingSavingsRatio = 0.4;
        private double highPriorityCostThreshold = 100.0;
        private int schedulingLookbackDays = 30;
        private double lowUsageRatio = 0.3;
        private int minimumLowUsageHours = 8;
        private double schedulingSavingsRatio = 0.25;
        private int modelLookbackDays = 30;
        private int minimumModelExecutions = 10;
        private double successRateTolerance = 0.9;
        private double highPriorityModelSavings = 1000.0;
    }

    @Getter
    @Setter
    public static class Budgets {
        private String rolloverCron = "0 5 * * * *";
        private double defaultAlertThreshold = 80.0;
    }

    @Getter
    @Setter
    public static class DemoData {
        private boolean enabled = false;
    }
}
