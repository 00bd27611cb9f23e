package com.costtelemetry.domain.model.json;

import com.costtelemetry.domain.model.ModelAccuracy;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ModelAccuracyConverter extends JsonAttributeConverter<ModelAccuracy> {

    public ModelAccuracyConverter() {
        super(new TypeReference<>() {});
    }
}
