package com.costtelemetry.domain.model.json;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class NumericMapConverter extends JsonAttributeConverter<Map<String, Double>> {

    public NumericMapConverter() {
        super(new TypeReference<>() {});
    }
}
