package com.costtelemetry.domain.model.json;

import com.costtelemetry.domain.model.ScenarioAnalysis;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ScenarioAnalysisConverter extends JsonAttributeConverter<ScenarioAnalysis> {

    public ScenarioAnalysisConverter() {
        super(new TypeReference<>() {});
    }
}
