package com.costtelemetry.domain.model;

public record ContributingFactor(String factor, double impact, String description) {
}
