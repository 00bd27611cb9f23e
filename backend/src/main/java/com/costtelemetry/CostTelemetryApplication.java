package com.costtelemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cost Telemetry Monitoring Engine
 *
 * Aggregates cost records into real-time metrics, detects cost anomalies,
 * drives budget alerts, forecasts spend and synthesizes optimization advice.
 */
@SpringBootApplication
@EnableScheduling
public class CostTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostTelemetryApplication.class, args);
    }
}
