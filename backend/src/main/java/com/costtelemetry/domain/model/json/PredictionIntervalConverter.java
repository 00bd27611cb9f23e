package com.costtelemetry.domain.model.json;

import com.costtelemetry.domain.model.PredictionInterval;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class PredictionIntervalConverter extends JsonAttributeConverter<PredictionInterval> {

    public PredictionIntervalConverter() {
        super(new TypeReference<>() {});
    }
}
