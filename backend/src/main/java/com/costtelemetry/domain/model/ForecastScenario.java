package com.costtelemetry.domain.model;

public record ForecastScenario(String name, double probability, double predictedCost) {
}
