package com.costtelemetry.domain.model.json;

import com.costtelemetry.domain.model.TrendAnalysis;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class TrendAnalysisConverter extends JsonAttributeConverter<TrendAnalysis> {

    public TrendAnalysisConverter() {
        super(new TypeReference<>() {});
    }
}
